package com.flagship.crypto_settlement.wallet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.crypto_settlement.hedera.HederaNetwork;
import com.flagship.crypto_settlement.hedera.HederaToken;
import com.flagship.crypto_settlement.mirror.AccountSnapshot;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.mirror.MirrorNodeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WalletSessionManagerTest {

    private static final String ACCOUNT = "0.0.1111";
    private static final String PAIRING_TOPIC = "pairing-topic-1";
    private static final String SESSION_TOPIC = "session-topic-1";
    private static final Executor DIRECT = Runnable::run;

    private FakeWalletConnector connector;
    private MirrorNodeClient mirrorNodeClient;
    private WalletSessionManager manager;

    @BeforeEach
    void setUp() {
        connector = new FakeWalletConnector();
        mirrorNodeClient = mock(MirrorNodeClient.class);
        when(mirrorNodeClient.getNetwork()).thenReturn(HederaNetwork.TESTNET);
        when(mirrorNodeClient.getAccount(ACCOUNT)).thenReturn(new AccountSnapshot(ACCOUNT,
            new BigInteger("2500000000"), Map.of("0.0.429274", new BigInteger("75000000"))));
        manager = newManager(Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    private WalletSessionManager newManager(Duration submitTimeout, Duration pairingTimeout) {
        return new WalletSessionManager(connector, mirrorNodeClient, DIRECT,
            submitTimeout, pairingTimeout, Duration.ofMillis(10), 3, 5);
    }

    private static PairingRecord pairing() {
        return new PairingRecord(PAIRING_TOPIC, List.of(ACCOUNT), "testnet");
    }

    private static SessionRecord readySession(String topic) {
        return new SessionRecord(topic, Set.of(SessionRecord.HEDERA_NAMESPACE), true);
    }

    private void pair() throws Exception {
        CompletableFuture<PairingRecord> connecting = manager.connect();
        connector.firePairing(pairing());
        connecting.get(5, TimeUnit.SECONDS);
    }

    private static WalletErrorKind failureKind(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        WalletException cause = assertInstanceOf(WalletException.class, e.getCause());
        return cause.getKind();
    }

    @Nested
    @DisplayName("1. Initialization")
    class Initialization {

        @Test
        @DisplayName("Concurrent init calls share one handshake")
        void testConcurrentInit_SingleHandshake() throws Exception {
            CompletableFuture<Void> handshake = new CompletableFuture<>();
            connector.initResult = handshake;

            CompletableFuture<Void> first = manager.init();
            CompletableFuture<Void> second = manager.init();

            assertSame(first, second);
            assertEquals(WalletState.INITIALIZING, manager.getState());

            handshake.complete(null);
            first.get(5, TimeUnit.SECONDS);

            assertEquals(1, connector.initCalls.get());
            assertEquals(WalletState.READY, manager.getState());
            assertEquals(1, connector.pairingRegistrations.get());
        }

        @Test
        @DisplayName("Failed init can be retried")
        void testFailedInit_Retryable() throws Exception {
            connector.initResult = CompletableFuture.failedFuture(new IllegalStateException("relay unreachable"));

            assertEquals(WalletErrorKind.TRANSIENT, failureKind(manager.init()));
            assertEquals(WalletState.UNINITIALIZED, manager.getState());
            assertTrue(manager.getSnapshot().getError().contains("relay unreachable"));

            connector.initResult = CompletableFuture.completedFuture(null);
            manager.init().get(5, TimeUnit.SECONDS);

            assertEquals(2, connector.initCalls.get());
            assertEquals(WalletState.READY, manager.getState());
            assertNull(manager.getSnapshot().getError());
        }

        @Test
        @DisplayName("Saved pairing is rehydrated without a handshake")
        void testSavedPairing_Rehydrated() throws Exception {
            connector.savedPairing = Optional.of(pairing());

            manager.init().get(5, TimeUnit.SECONDS);

            assertEquals(0, connector.initCalls.get());
            assertEquals(WalletState.PAIRED, manager.getState());
            assertEquals(Optional.of(ACCOUNT), manager.getAccountId());
            assertEquals("25.00000000", manager.getBalances().get(HederaToken.HBAR));
        }
    }

    @Nested
    @DisplayName("2. Pairing")
    class Pairing {

        @Test
        @DisplayName("Connect completes on the pairing event and loads balances")
        void testConnect_Paired() throws Exception {
            CompletableFuture<PairingRecord> connecting = manager.connect();
            assertEquals(WalletState.PAIRING, manager.getState());
            assertFalse(connecting.isDone());

            connector.firePairing(pairing());

            assertEquals(PAIRING_TOPIC, connecting.get(5, TimeUnit.SECONDS).getPairingTopic());
            WalletSnapshot snapshot = manager.getSnapshot();
            assertTrue(snapshot.isConnected());
            assertEquals(ACCOUNT, snapshot.getAccountId());
            assertEquals("testnet", snapshot.getNetwork());
            assertEquals("25.00000000", snapshot.getBalances().get(HederaToken.HBAR));
            assertEquals("75.000000", snapshot.getBalances().get(HederaToken.USDC));
            assertEquals("0.000000", snapshot.getBalances().get(HederaToken.USDT));
        }

        @Test
        @DisplayName("Second connect joins the pending pairing")
        void testConcurrentConnect_JoinsPending() throws Exception {
            CompletableFuture<PairingRecord> first = manager.connect();
            CompletableFuture<PairingRecord> second = manager.connect();

            connector.firePairing(pairing());

            assertEquals(ACCOUNT, first.get(5, TimeUnit.SECONDS).primaryAccountId());
            assertEquals(ACCOUNT, second.get(5, TimeUnit.SECONDS).primaryAccountId());
            assertEquals(1, connector.modalCalls.get());
        }

        @Test
        @DisplayName("Connect when already paired completes immediately")
        void testConnect_AlreadyPaired() throws Exception {
            pair();

            CompletableFuture<PairingRecord> again = manager.connect();

            assertTrue(again.isDone());
            assertEquals(1, connector.modalCalls.get());
        }

        @Test
        @DisplayName("Missing pairing URI is retried once")
        void testUriMissing_RetriedOnce() throws Exception {
            connector.enqueueModalResult(CompletableFuture.failedFuture(
                new IllegalStateException("Pairing URI missing")));

            CompletableFuture<PairingRecord> connecting = manager.connect();
            Thread.sleep(100);
            assertEquals(2, connector.modalCalls.get());

            connector.firePairing(pairing());
            connecting.get(5, TimeUnit.SECONDS);
            assertEquals(WalletState.PAIRED, manager.getState());
        }

        @Test
        @DisplayName("Modal failure other than a missing URI is not retried")
        void testModalFailure_NotRetried() {
            connector.enqueueModalResult(CompletableFuture.failedFuture(
                new IllegalStateException("User cancelled the pairing")));

            assertEquals(WalletErrorKind.USER_REJECTED, failureKind(manager.connect()));
            assertEquals(1, connector.modalCalls.get());
            assertEquals(WalletState.READY, manager.getState());
        }

        @Test
        @DisplayName("Pairing timeout returns the session to READY")
        void testPairingTimeout() {
            manager = newManager(Duration.ofSeconds(5), Duration.ofMillis(100));

            assertEquals(WalletErrorKind.TRANSIENT, failureKind(manager.connect()));
            assertEquals(WalletState.READY, manager.getState());
            assertNotNull(manager.getSnapshot().getError());
        }

        @Test
        @DisplayName("Disconnect during pairing fails the attempt and allows a fresh one")
        void testDisconnectWhilePairing_CanPairAgain() throws Exception {
            manager = newManager(Duration.ofSeconds(5), Duration.ofMillis(200));
            CompletableFuture<PairingRecord> first = manager.connect();
            assertEquals(WalletState.PAIRING, manager.getState());

            manager.disconnect().get(5, TimeUnit.SECONDS);

            assertEquals(WalletErrorKind.NOT_PAIRED, failureKind(first));
            assertEquals(WalletState.DISCONNECTED, manager.getState());

            Thread.sleep(300);
            CompletableFuture<PairingRecord> second = manager.connect();
            assertFalse(second.isDone());
            assertEquals(2, connector.modalCalls.get());

            connector.firePairing(pairing());

            assertEquals(ACCOUNT, second.get(5, TimeUnit.SECONDS).primaryAccountId());
            assertEquals(WalletState.PAIRED, manager.getState());
        }

        @Test
        @DisplayName("Connector disconnection during pairing does not block later pairing")
        void testConnectorDisconnectWhilePairing_CanPairAgain() throws Exception {
            CompletableFuture<PairingRecord> first = manager.connect();

            connector.fireDisconnection();

            assertEquals(WalletErrorKind.NOT_PAIRED, failureKind(first));
            CompletableFuture<PairingRecord> second = manager.connect();
            connector.firePairing(pairing());

            assertEquals(ACCOUNT, second.get(5, TimeUnit.SECONDS).primaryAccountId());
            assertEquals(2, connector.modalCalls.get());
        }

        @Test
        @DisplayName("Pairing event without accounts is ignored")
        void testPairingWithoutAccounts_Ignored() {
            CompletableFuture<PairingRecord> connecting = manager.connect();

            connector.firePairing(new PairingRecord(PAIRING_TOPIC, List.of(), "testnet"));

            assertFalse(connecting.isDone());
            assertEquals(WalletState.PAIRING, manager.getState());
        }

        @Test
        @DisplayName("Connector listeners are attached once across reconnects")
        void testListenersRegisteredOnce() throws Exception {
            pair();
            manager.disconnect().get(5, TimeUnit.SECONDS);
            pair();
            manager.disconnect().get(5, TimeUnit.SECONDS);
            pair();

            assertEquals(1, connector.pairingRegistrations.get());
            assertEquals(1, connector.statusRegistrations.get());
            assertEquals(1, connector.disconnectionRegistrations.get());
            assertEquals(1, connector.initCalls.get());
            assertEquals(WalletState.PAIRED, manager.getState());
        }

        @Test
        @DisplayName("Connection status events are tracked")
        void testConnectionStatus() throws Exception {
            pair();

            connector.fireConnectionStatus(ConnectionStatus.CONNECTED);

            assertEquals(Optional.of(ConnectionStatus.CONNECTED), manager.getConnectionStatus());
        }
    }

    @Nested
    @DisplayName("3. Signing session convergence")
    class SessionConvergence {

        @Test
        @DisplayName("Session in only one registry never converges")
        void testOneRegistryOnly_Empty() throws Exception {
            connector.sessions.add(readySession(SESSION_TOPIC));

            assertEquals(Optional.empty(), manager.getSessionTopic(3, 5).get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Unacknowledged or non-Hedera sessions are not signing-ready")
        void testNotSigningReady_Empty() throws Exception {
            connector.sessions.add(new SessionRecord(SESSION_TOPIC, Set.of(SessionRecord.HEDERA_NAMESPACE), false));
            connector.signingSessions.add(new SessionRecord(SESSION_TOPIC, Set.of("eip155"), true));

            assertEquals(Optional.empty(), manager.getSessionTopic(2, 5).get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Topic is returned once both registries agree")
        void testConvergesLater() throws Exception {
            connector.sessions.add(readySession(SESSION_TOPIC));
            CompletableFuture<Optional<String>> topic = new WalletSessionManager(connector, mirrorNodeClient,
                ForkJoinPool.commonPool()).getSessionTopic(10, 20);

            Thread.sleep(30);
            connector.signingSessions.add(readySession(SESSION_TOPIC));

            assertEquals(Optional.of(SESSION_TOPIC), topic.get(10, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("4. Transaction submission")
    class Submission {

        @Test
        @DisplayName("Submitting before pairing fails NOT_PAIRED")
        void testNotPaired() {
            assertEquals(WalletErrorKind.NOT_PAIRED, failureKind(manager.submitTransaction(new byte[]{1}, null)));
        }

        @Test
        @DisplayName("No converged session fails SESSION_NOT_ESTABLISHED and stays PAIRED")
        void testSessionNotEstablished() throws Exception {
            pair();

            assertEquals(WalletErrorKind.SESSION_NOT_ESTABLISHED,
                failureKind(manager.submitTransaction(new byte[]{1}, null)));
            assertEquals(WalletState.PAIRED, manager.getState());
            assertTrue(connector.sentTopics.isEmpty());
        }

        @Test
        @DisplayName("Transaction is sent over the session topic, not the pairing topic")
        void testSubmit_UsesSessionTopic() throws Exception {
            pair();
            connector.sessions.add(readySession(SESSION_TOPIC));
            connector.signingSessions.add(readySession(SESSION_TOPIC));
            connector.sendResult = CompletableFuture.completedFuture(new ObjectMapper()
                .readTree("{\"receipt\": {\"transactionId\": \"0.0.1111@1700000000.000000001\"}}"));

            WalletResponse response = manager.submitTransaction(new byte[]{1, 2}, null).get(5, TimeUnit.SECONDS);

            assertEquals(WalletResponse.Shape.RECEIPT, response.getShape());
            assertEquals("0.0.1111@1700000000.000000001", response.getTransactionId());
            assertEquals(List.of(SESSION_TOPIC), connector.sentTopics);
            assertEquals(List.of(ACCOUNT), connector.sentSigners);
        }

        @Test
        @DisplayName("Wallet timeout fails TRANSIENT and keeps the pairing")
        void testSubmitTimeout_StaysPaired() throws Exception {
            manager = newManager(Duration.ofMillis(100), Duration.ofSeconds(5));
            pair();
            connector.sessions.add(readySession(SESSION_TOPIC));
            connector.signingSessions.add(readySession(SESSION_TOPIC));

            assertEquals(WalletErrorKind.TRANSIENT, failureKind(manager.submitTransaction(new byte[]{1}, ACCOUNT)));
            assertEquals(WalletState.PAIRED, manager.getState());
            assertEquals(WalletErrorKind.TRANSIENT.getUserMessage(), manager.getSnapshot().getError());
            assertFalse(connector.sendResult.isDone());
        }

        @Test
        @DisplayName("Wallet rejection is classified USER_REJECTED")
        void testSubmitRejected() throws Exception {
            pair();
            connector.sessions.add(readySession(SESSION_TOPIC));
            connector.signingSessions.add(readySession(SESSION_TOPIC));
            connector.sendResult = CompletableFuture.failedFuture(new RuntimeException("User rejected the request"));

            assertEquals(WalletErrorKind.USER_REJECTED, failureKind(manager.submitTransaction(new byte[]{1}, null)));
            assertEquals(WalletState.PAIRED, manager.getState());
        }
    }

    @Nested
    @DisplayName("5. Disconnection and state delivery")
    class Disconnection {

        @Test
        @DisplayName("Disconnect resets balances and notifies the connector")
        void testDisconnect_ResetsBalances() throws Exception {
            pair();
            assertNotEquals(WalletBalances.empty(), manager.getBalances());

            manager.disconnect().get(5, TimeUnit.SECONDS);

            assertEquals(WalletState.DISCONNECTED, manager.getState());
            assertEquals(WalletBalances.empty(), manager.getBalances());
            assertEquals("0.00000000", manager.getBalances().get(HederaToken.HBAR));
            assertEquals(List.of(PAIRING_TOPIC), connector.disconnectedTopics);
            assertTrue(manager.getAccountId().isEmpty());
        }

        @Test
        @DisplayName("Disconnect before init is a no-op")
        void testDisconnectBeforeInit_NoOp() throws Exception {
            manager.disconnect().get(5, TimeUnit.SECONDS);

            assertEquals(WalletState.UNINITIALIZED, manager.getState());
            assertTrue(connector.disconnectedTopics.isEmpty());
        }

        @Test
        @DisplayName("Wallet-initiated disconnection clears the pairing")
        void testConnectorDisconnection() throws Exception {
            pair();

            connector.fireDisconnection();

            assertEquals(WalletState.DISCONNECTED, manager.getState());
            assertFalse(manager.getSnapshot().isConnected());
        }

        @Test
        @DisplayName("Failed balance refresh keeps the previous balances")
        void testRefreshFailure_KeepsBalances() throws Exception {
            pair();
            WalletBalances before = manager.getBalances();
            when(mirrorNodeClient.getAccount(ACCOUNT)).thenThrow(new MirrorNodeException("Mirror node returned 503"));

            WalletBalances after = manager.refreshBalances().get(5, TimeUnit.SECONDS);

            assertEquals(before, after);
            assertEquals("Failed to refresh wallet balances", manager.getSnapshot().getError());
        }

        @Test
        @DisplayName("Subscribers get the current snapshot at once and every change after")
        void testSubscribe() throws Exception {
            List<WalletState> seen = new CopyOnWriteArrayList<>();
            Runnable unsubscribe = manager.subscribe(snapshot -> seen.add(snapshot.getState()));
            assertEquals(List.of(WalletState.UNINITIALIZED), seen);

            manager.init().get(5, TimeUnit.SECONDS);
            assertTrue(seen.contains(WalletState.INITIALIZING));
            assertEquals(WalletState.READY, seen.get(seen.size() - 1));

            unsubscribe.run();
            int count = seen.size();
            pair();
            assertEquals(count, seen.size());
        }

        @Test
        @DisplayName("A failing listener does not break the others")
        void testFailingListener_Isolated() throws Exception {
            List<WalletState> seen = new CopyOnWriteArrayList<>();
            manager.subscribe(snapshot -> {
                throw new IllegalStateException("listener bug");
            });
            manager.subscribe(snapshot -> seen.add(snapshot.getState()));

            manager.init().get(5, TimeUnit.SECONDS);

            assertEquals(WalletState.READY, seen.get(seen.size() - 1));
        }
    }
}
