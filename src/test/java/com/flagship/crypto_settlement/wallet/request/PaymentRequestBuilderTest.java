package com.flagship.crypto_settlement.wallet.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.flagship.crypto_settlement.hedera.HederaNetwork;
import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.mirror.AccountSnapshot;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.mirror.MirrorNodeException;
import com.flagship.crypto_settlement.mirror.TokenRelationship;
import com.flagship.crypto_settlement.wallet.WalletErrorKind;
import com.flagship.crypto_settlement.wallet.WalletException;
import com.flagship.crypto_settlement.wallet.WalletResponse;
import com.flagship.crypto_settlement.wallet.WalletSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PaymentRequestBuilderTest {

    private static final String PAYER = "0.0.1111";
    private static final String MERCHANT = "0.0.999";
    private static final String USDC_TESTNET = "0.0.429274";
    private static final Instant NOW = Instant.ofEpochSecond(1700000000L, 5);
    private static final Executor DIRECT = Runnable::run;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WalletSessionManager sessionManager;
    private MirrorNodeClient mirrorNodeClient;
    private PaymentRequestBuilder builder;

    @BeforeEach
    void setUp() {
        sessionManager = mock(WalletSessionManager.class);
        mirrorNodeClient = mock(MirrorNodeClient.class);
        when(mirrorNodeClient.getNetwork()).thenReturn(HederaNetwork.TESTNET);
        when(sessionManager.getAccountId()).thenReturn(Optional.of(PAYER));
        builder = new PaymentRequestBuilder(sessionManager, mirrorNodeClient, objectMapper,
            new TransactionIdGenerator(Clock.fixed(NOW, ZoneOffset.UTC)), DIRECT);
    }

    private void fundPayer(long tinybars, long usdcUnits) {
        when(mirrorNodeClient.getTokenRelationships(PAYER)).thenReturn(List.of(
            new TokenRelationship(USDC_TESTNET, BigInteger.valueOf(usdcUnits), false)));
        when(mirrorNodeClient.getAccount(PAYER)).thenReturn(new AccountSnapshot(PAYER,
            BigInteger.valueOf(tinybars), Map.of(USDC_TESTNET, BigInteger.valueOf(usdcUnits))));
    }

    private void walletReturns(JsonNode response) {
        when(sessionManager.submitTransaction(any(), anyString()))
            .thenReturn(CompletableFuture.completedFuture(WalletResponse.from(response)));
    }

    private static WalletErrorKind failureKind(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return assertInstanceOf(WalletException.class, e.getCause()).getKind();
    }

    @Nested
    @DisplayName("1. Building transfers")
    class Build {

        @Test
        @DisplayName("HBAR transfer has two tinybar legs and no token id")
        void testHbarTransfer() {
            UnsignedTransfer transfer = builder.build(PAYER,
                new PaymentRequest(HederaToken.HBAR, MERCHANT, "12.5", "INV-1"));

            assertTrue(transfer.isNative());
            assertEquals("0.0.1111@1700000000.000000005", transfer.getTransactionId());
            assertEquals("testnet", transfer.getNetwork());
            assertEquals(List.of(
                new TransferLeg(PAYER, -1_250_000_000L),
                new TransferLeg(MERCHANT, 1_250_000_000L)), transfer.getTransfers());
            assertEquals("INV-1", transfer.getMemo());
        }

        @Test
        @DisplayName("Token transfer carries the network token id and micro-units")
        void testTokenTransfer() {
            UnsignedTransfer transfer = builder.build(PAYER,
                new PaymentRequest(HederaToken.USDC, MERCHANT, "50.01", null));

            assertFalse(transfer.isNative());
            assertEquals(USDC_TESTNET, transfer.getTokenId());
            assertEquals(50_010_000L, transfer.getTransfers().get(1).getAmount());
            assertEquals("", transfer.getMemo());
        }

        @Test
        @DisplayName("Mainnet uses mainnet token ids")
        void testMainnetTokenId() {
            when(mirrorNodeClient.getNetwork()).thenReturn(HederaNetwork.MAINNET);

            UnsignedTransfer transfer = builder.build(PAYER,
                new PaymentRequest(HederaToken.USDC, MERCHANT, "1", null));

            assertEquals("0.0.456858", transfer.getTokenId());
        }

        @Test
        @DisplayName("Over-precise amounts are rejected")
        void testOverPrecise_Rejected() {
            assertThrows(IllegalArgumentException.class, () -> builder.build(PAYER,
                new PaymentRequest(HederaToken.USDC, MERCHANT, "1.0000001", null)));
        }

        @Test
        @DisplayName("Request validation")
        void testRequestValidation() {
            assertThrows(IllegalArgumentException.class,
                () -> new PaymentRequest(HederaToken.USDC, "merchant", "1", null));
            assertThrows(IllegalArgumentException.class,
                () -> new PaymentRequest(null, MERCHANT, "1", null));
            assertThrows(IllegalArgumentException.class,
                () -> new PaymentRequest(HederaToken.USDC, MERCHANT, "1", "x".repeat(101)));
            assertThrows(IllegalArgumentException.class,
                () -> new UnsignedTransfer("id", "testnet", HederaToken.HBAR, null, "",
                    List.of(new TransferLeg(PAYER, -10), new TransferLeg(MERCHANT, 9))));
        }
    }

    @Nested
    @DisplayName("2. Pre-flight checks")
    class Preflight {

        @Test
        @DisplayName("Unassociated token fails before the wallet is asked")
        void testTokenNotAssociated() {
            when(mirrorNodeClient.getTokenRelationships(PAYER)).thenReturn(List.of());

            CompletableFuture<PaymentSubmission> result =
                builder.submit(new PaymentRequest(HederaToken.USDC, MERCHANT, "50", "INV-1"));

            assertEquals(WalletErrorKind.TOKEN_NOT_ASSOCIATED, failureKind(result));
            verify(sessionManager, never()).submitTransaction(any(), any());
        }

        @Test
        @DisplayName("Insufficient balance fails before the wallet is asked")
        void testInsufficientBalance() {
            fundPayer(0, 49_000_000L);

            CompletableFuture<PaymentSubmission> result =
                builder.submit(new PaymentRequest(HederaToken.USDC, MERCHANT, "50", "INV-1"));

            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            WalletException cause = assertInstanceOf(WalletException.class, e.getCause());
            assertEquals(WalletErrorKind.INSUFFICIENT_BALANCE, cause.getKind());
            assertEquals("Insufficient USDC balance: required 50.000000, available 49.000000", cause.getMessage());
            verify(sessionManager, never()).submitTransaction(any(), any());
        }

        @Test
        @DisplayName("HBAR balance is checked in tinybars without an association lookup")
        void testHbarBalance() {
            fundPayer(100_000_000L, 0);

            assertThrows(WalletException.class, () -> builder.preflight(PAYER, HederaToken.HBAR, 200_000_000L));
            assertDoesNotThrow(() -> builder.preflight(PAYER, HederaToken.HBAR, 100_000_000L));
            verify(mirrorNodeClient, never()).getTokenRelationships(anyString());
        }

        @Test
        @DisplayName("Mirror node outage skips the checks")
        void testMirrorUnavailable_Skipped() throws Exception {
            when(mirrorNodeClient.getTokenRelationships(PAYER)).thenThrow(new MirrorNodeException("down"));
            walletReturns(NullNode.getInstance());

            PaymentSubmission submission = builder
                .submit(new PaymentRequest(HederaToken.USDC, MERCHANT, "50", "INV-1"))
                .get(5, TimeUnit.SECONDS);

            assertNotNull(submission);
        }
    }

    @Nested
    @DisplayName("3. Submission")
    class Submit {

        @Test
        @DisplayName("Not paired fails NOT_PAIRED")
        void testNotPaired() {
            when(sessionManager.getAccountId()).thenReturn(Optional.empty());

            assertEquals(WalletErrorKind.NOT_PAIRED,
                failureKind(builder.submit(new PaymentRequest(HederaToken.HBAR, MERCHANT, "1", null))));
        }

        @Test
        @DisplayName("Zero amount is rejected")
        void testZeroAmount() {
            CompletableFuture<PaymentSubmission> result =
                builder.submit(new PaymentRequest(HederaToken.HBAR, MERCHANT, "0.0", null));

            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }

        @Test
        @DisplayName("Amount beyond the 64-bit unit range fails the future")
        void testAmountTooLarge() {
            CompletableFuture<PaymentSubmission> result = assertDoesNotThrow(() ->
                builder.submit(new PaymentRequest(HederaToken.HBAR, MERCHANT, "100000000000", null)));

            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertTrue(e.getCause().getMessage().contains("too large"));
            verify(sessionManager, never()).submitTransaction(any(), anyString());
        }

        @Test
        @DisplayName("Wallet-reported id is returned in dash form")
        void testReportedId_Normalized() throws Exception {
            fundPayer(0, 100_000_000L);
            walletReturns(objectMapper.readTree("{\"transactionId\": \"0.0.1111@1700000001.000000007\"}"));

            PaymentSubmission submission = builder
                .submit(new PaymentRequest(HederaToken.USDC, MERCHANT, "50.01", "INV-7"))
                .get(5, TimeUnit.SECONDS);

            assertEquals("0.0.1111-1700000001-000000007", submission.getTransactionId());
            assertEquals("INV-7", submission.getMemo());
            assertTrue(submission.isReportedByWallet());

            ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
            verify(sessionManager).submitTransaction(bytes.capture(), eq(PAYER));
            JsonNode sent = objectMapper.readTree(bytes.getValue());
            assertEquals(USDC_TESTNET, sent.path("tokenId").asText());
            assertEquals("INV-7", sent.path("memo").asText());
            assertEquals(-50_010_000L, sent.path("transfers").get(0).path("amount").asLong());
            assertFalse(sent.has("native"));
        }

        @Test
        @DisplayName("Generated id is used when the wallet reports none")
        void testNoReportedId_FallsBack() throws Exception {
            fundPayer(500_000_000L, 0);
            walletReturns(objectMapper.readTree("{\"status\": \"SUCCESS\"}"));

            PaymentSubmission submission = builder
                .submit(new PaymentRequest(HederaToken.HBAR, MERCHANT, "1", null))
                .get(5, TimeUnit.SECONDS);

            assertEquals("0.0.1111-1700000000-000000005", submission.getTransactionId());
            assertFalse(submission.isReportedByWallet());
        }

        @Test
        @DisplayName("Wallet failures propagate unchanged")
        void testWalletFailure() {
            fundPayer(500_000_000L, 0);
            when(sessionManager.submitTransaction(any(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(WalletException.of(WalletErrorKind.USER_REJECTED)));

            assertEquals(WalletErrorKind.USER_REJECTED,
                failureKind(builder.submit(new PaymentRequest(HederaToken.HBAR, MERCHANT, "1", null))));
        }
    }
}
