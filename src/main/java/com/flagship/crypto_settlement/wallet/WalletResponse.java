package com.flagship.crypto_settlement.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.Optional;

/**
 * Normalised wallet submission response.
 *
 * Wallet builds return the transaction id in one of several places. The
 * observed shapes are tagged by {@link Shape} and resolved once by
 * {@link #from(JsonNode)}.
 */
@Value
public class WalletResponse {

    public enum Shape {
        /** {@code {"transactionId": "..."}} */
        TOP_LEVEL,
        /** {@code {"receipt": {"transactionId": "..."}}} */
        RECEIPT,
        /** {@code {"response": {"transactionId": "..."}}} */
        NESTED_RESPONSE,
        /** The response body is the id itself. */
        BARE_STRING,
        /** Submitted, but no id was returned. */
        NO_TRANSACTION_ID
    }

    private static final String TRANSACTION_ID = "transactionId";

    Shape shape;
    String transactionId;

    public static WalletResponse from(JsonNode response) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            return new WalletResponse(Shape.NO_TRANSACTION_ID, null);
        }
        if (response.isTextual()) {
            String id = response.asText();
            return id.isBlank()
                ? new WalletResponse(Shape.NO_TRANSACTION_ID, null)
                : new WalletResponse(Shape.BARE_STRING, id);
        }
        String id = text(response.path(TRANSACTION_ID));
        if (id != null) {
            return new WalletResponse(Shape.TOP_LEVEL, id);
        }
        id = text(response.path("receipt").path(TRANSACTION_ID));
        if (id != null) {
            return new WalletResponse(Shape.RECEIPT, id);
        }
        id = text(response.path("response").path(TRANSACTION_ID));
        if (id != null) {
            return new WalletResponse(Shape.NESTED_RESPONSE, id);
        }
        return new WalletResponse(Shape.NO_TRANSACTION_ID, null);
    }

    public Optional<String> transactionId() {
        return Optional.ofNullable(transactionId);
    }

    private static String text(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
