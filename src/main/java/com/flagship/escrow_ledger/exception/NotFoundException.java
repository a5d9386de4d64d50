package com.flagship.escrow_ledger.exception;

import java.util.UUID;

public class NotFoundException extends InvalidArgumentException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String resource, UUID id) {
        return new NotFoundException(resource + " not found: " + id);
    }
}
