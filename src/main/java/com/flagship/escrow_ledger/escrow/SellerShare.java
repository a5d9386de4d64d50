package com.flagship.escrow_ledger.escrow;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One seller's part of a confirmed order, as supplied by order fulfillment.
 * The gross share is {@code sellerAmount + shippingAmount}.
 */
@Value
public class SellerShare {
    UUID storeId;
    UUID shipmentId;
    BigDecimal sellerAmount;
    BigDecimal shippingAmount;
    BigDecimal commissionRate;

    public static SellerShare of(UUID storeId, BigDecimal totalAmount, BigDecimal commissionRate) {
        return new SellerShare(storeId, null, totalAmount, BigDecimal.ZERO, commissionRate);
    }
}
