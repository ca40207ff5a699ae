package com.flagship.crypto_settlement.wallet.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.Value;

import java.util.List;

/**
 * Transfer handed to the wallet for signing.
 *
 * {@code tokenId} is null for native HBAR transfers. Legs always sum to
 * zero.
 */
@Value
public class UnsignedTransfer {
    String transactionId;
    String network;
    HederaToken token;
    String tokenId;
    String memo;
    List<TransferLeg> transfers;

    public UnsignedTransfer(String transactionId, String network, HederaToken token, String tokenId,
                            String memo, List<TransferLeg> transfers) {
        long sum = transfers.stream().mapToLong(TransferLeg::getAmount).sum();
        if (sum != 0) {
            throw new IllegalArgumentException("Transfer legs must sum to zero, got " + sum);
        }
        this.transactionId = transactionId;
        this.network = network;
        this.token = token;
        this.tokenId = tokenId;
        this.memo = memo;
        this.transfers = List.copyOf(transfers);
    }

    @JsonIgnore
    public boolean isNative() {
        return tokenId == null;
    }

    public byte[] toBytes(ObjectMapper objectMapper) {
        try {
            return objectMapper.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transfer " + transactionId, e);
        }
    }
}
