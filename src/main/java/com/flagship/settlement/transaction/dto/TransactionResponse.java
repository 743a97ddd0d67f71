package com.flagship.settlement.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.settlement.transaction.Transaction;
import com.flagship.settlement.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("provider_client_secret")
    String providerClientSecret;

    @JsonProperty("buyer_id")
    UUID buyerId;

    @JsonProperty("seller_id")
    UUID sellerId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("gross_amount")
    long grossAmount;

    @JsonProperty("platform_fee")
    long platformFee;

    @JsonProperty("processor_fee")
    long processorFee;

    @JsonProperty("seller_net")
    long sellerNet;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("uses_escrow")
    boolean usesEscrow;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(Transaction transaction) {
        return from(transaction, null);
    }

    public static TransactionResponse from(Transaction transaction, String clientSecret) {
        return TransactionResponse.builder()
            .transactionId(transaction.getId())
            .providerClientSecret(clientSecret)
            .buyerId(transaction.getBuyerId())
            .sellerId(transaction.getSellerId())
            .itemId(transaction.getItemId())
            .grossAmount(transaction.getGrossAmount())
            .platformFee(transaction.getPlatformFee())
            .processorFee(transaction.getProcessorFee())
            .sellerNet(transaction.getSellerNet())
            .currency(transaction.getCurrency().name())
            .usesEscrow(transaction.isUsesEscrow())
            .status(transaction.getStatus())
            .failureReason(transaction.getFailureReason())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
