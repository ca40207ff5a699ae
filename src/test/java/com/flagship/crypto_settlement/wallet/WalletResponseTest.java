package com.flagship.crypto_settlement.wallet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WalletResponseTest {

    private static final String TX_ID = "0.0.1111@1700000000.000000001";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Every observed response shape yields the transaction id")
    void testKnownShapes() throws Exception {
        assertShape(WalletResponse.Shape.TOP_LEVEL, "{\"transactionId\": \"" + TX_ID + "\"}");
        assertShape(WalletResponse.Shape.RECEIPT, "{\"receipt\": {\"transactionId\": \"" + TX_ID + "\"}}");
        assertShape(WalletResponse.Shape.NESTED_RESPONSE, "{\"response\": {\"transactionId\": \"" + TX_ID + "\"}}");

        WalletResponse bare = WalletResponse.from(TextNode.valueOf(TX_ID));
        assertEquals(WalletResponse.Shape.BARE_STRING, bare.getShape());
        assertEquals(TX_ID, bare.getTransactionId());
    }

    @Test
    @DisplayName("Top-level id wins over nested ones")
    void testPrecedence() throws Exception {
        WalletResponse response = WalletResponse.from(objectMapper.readTree(
            "{\"transactionId\": \"top\", \"receipt\": {\"transactionId\": \"nested\"}}"));

        assertEquals("top", response.getTransactionId());
    }

    @Test
    @DisplayName("Missing, blank or non-text ids are reported as absent")
    void testNoTransactionId() throws Exception {
        assertTrue(WalletResponse.from(null).transactionId().isEmpty());
        assertTrue(WalletResponse.from(MissingNode.getInstance()).transactionId().isEmpty());
        assertTrue(WalletResponse.from(TextNode.valueOf("  ")).transactionId().isEmpty());
        assertEquals(WalletResponse.Shape.NO_TRANSACTION_ID,
            WalletResponse.from(objectMapper.readTree("{\"status\": \"SUCCESS\"}")).getShape());
        assertEquals(WalletResponse.Shape.NO_TRANSACTION_ID,
            WalletResponse.from(objectMapper.readTree("{\"transactionId\": 42}")).getShape());
    }

    private void assertShape(WalletResponse.Shape expected, String json) throws Exception {
        WalletResponse response = WalletResponse.from(objectMapper.readTree(json));
        assertEquals(expected, response.getShape());
        assertEquals(TX_ID, response.transactionId().orElseThrow());
    }
}
