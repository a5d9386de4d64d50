package com.flagship.escrow_ledger.escrow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_ledger.escrow.SellerShare;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for placing a confirmed order payment in escrow.
 */
@Value
public class CreateEscrowRequest {

    @NotNull(message = "Order ID is required")
    @JsonProperty("order_id")
    UUID orderId;

    @Size(max = 50, message = "Order number must be at most 50 characters")
    @JsonProperty("order_number")
    String orderNumber;

    @NotNull(message = "Buyer ID is required")
    @JsonProperty("buyer_id")
    UUID buyerId;

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "Payment transaction ID is required")
    @Size(max = 100, message = "Payment transaction ID must be at most 100 characters")
    @JsonProperty("payment_transaction_id")
    String paymentTransactionId;

    @NotEmpty(message = "At least one seller share is required")
    @JsonProperty("seller_shares")
    List<@Valid SellerShareRequest> sellerShares;

    @JsonProperty("initiated_by")
    String initiatedBy;

    public List<SellerShare> toSellerShares() {
        return sellerShares.stream()
            .map(SellerShareRequest::toSellerShare)
            .toList();
    }

    @Value
    public static class SellerShareRequest {

        @NotNull(message = "Store ID is required")
        @JsonProperty("store_id")
        UUID storeId;

        @JsonProperty("shipment_id")
        UUID shipmentId;

        @NotNull(message = "Seller amount is required")
        @DecimalMin(value = "0.00", message = "Seller amount cannot be negative")
        @JsonProperty("seller_amount")
        BigDecimal sellerAmount;

        @DecimalMin(value = "0.00", message = "Shipping amount cannot be negative")
        @JsonProperty("shipping_amount")
        BigDecimal shippingAmount;

        @NotNull(message = "Commission rate is required")
        @DecimalMin(value = "0", message = "Commission rate must be between 0 and 100")
        @DecimalMax(value = "100", message = "Commission rate must be between 0 and 100")
        @JsonProperty("commission_rate")
        BigDecimal commissionRate;

        SellerShare toSellerShare() {
            return new SellerShare(storeId, shipmentId, sellerAmount, shippingAmount, commissionRate);
        }
    }
}
