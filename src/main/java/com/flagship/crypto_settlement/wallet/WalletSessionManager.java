package com.flagship.crypto_settlement.wallet;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.crypto_settlement.hedera.HederaNetwork;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owns the wallet pairing lifecycle for one {@link WalletConnector}.
 *
 * Construct once at the application boundary and share it. All operations
 * are asynchronous; none of them block the calling thread.
 *
 * <ul>
 *   <li>{@link #init()} is idempotent: concurrent callers receive the same
 *       in-flight future and only one handshake is ever started. A failed
 *       initialization can be retried.</li>
 *   <li>Pairing, connection-status and disconnection listeners are attached
 *       to the connector exactly once, however many connect/disconnect
 *       cycles follow.</li>
 *   <li>{@link #getSessionTopic(int, long)} waits until both connector
 *       registries agree on a signing-ready session.</li>
 *   <li>A failed or timed-out submission leaves the session PAIRED.</li>
 * </ul>
 */
@Slf4j
public class WalletSessionManager {

    public static final Duration DEFAULT_SUBMIT_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_PAIRING_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_MODAL_RETRY_DELAY = Duration.ofMillis(500);
    public static final int DEFAULT_SESSION_RETRIES = 10;
    public static final long DEFAULT_SESSION_DELAY_MS = 500;

    private static final double SESSION_BACKOFF_MULTIPLIER = 1.5;

    private final WalletConnector connector;
    private final MirrorNodeClient mirrorNodeClient;
    private final Executor executor;
    private final Duration submitTimeout;
    private final Duration pairingTimeout;
    private final Duration modalRetryDelay;
    private final int sessionRetries;
    private final long sessionDelayMs;

    private final Set<WalletStateListener> listeners = new CopyOnWriteArraySet<>();
    private final AtomicBoolean connectorListenersRegistered = new AtomicBoolean();
    private final Object monitor = new Object();

    // guarded by monitor
    private CompletableFuture<Void> initFuture;
    private CompletableFuture<PairingRecord> pendingPairing;
    private WalletState state = WalletState.UNINITIALIZED;
    private PairingRecord pairing;
    private WalletBalances balances = WalletBalances.empty();
    private ConnectionStatus connectionStatus;
    private String error;

    public WalletSessionManager(WalletConnector connector, MirrorNodeClient mirrorNodeClient, Executor executor) {
        this(connector, mirrorNodeClient, executor,
            DEFAULT_SUBMIT_TIMEOUT, DEFAULT_PAIRING_TIMEOUT, DEFAULT_MODAL_RETRY_DELAY,
            DEFAULT_SESSION_RETRIES, DEFAULT_SESSION_DELAY_MS);
    }

    public WalletSessionManager(WalletConnector connector,
                                MirrorNodeClient mirrorNodeClient,
                                Executor executor,
                                Duration submitTimeout,
                                Duration pairingTimeout,
                                Duration modalRetryDelay,
                                int sessionRetries,
                                long sessionDelayMs) {
        this.connector = connector;
        this.mirrorNodeClient = mirrorNodeClient;
        this.executor = executor;
        this.submitTimeout = submitTimeout;
        this.pairingTimeout = pairingTimeout;
        this.modalRetryDelay = modalRetryDelay;
        this.sessionRetries = sessionRetries;
        this.sessionDelayMs = sessionDelayMs;
    }

    /**
     * Starts the handshake, or joins the one already running.
     *
     * Completes with the session either READY or, when the connector held a
     * saved pairing, PAIRED.
     */
    public CompletableFuture<Void> init() {
        CompletableFuture<Void> future;
        synchronized (monitor) {
            if (initFuture != null) {
                log.debug("Wallet initialization already started, joining: state={}", state);
                return initFuture;
            }
            initFuture = new CompletableFuture<>();
            future = initFuture;
            state = WalletState.INITIALIZING;
            error = null;
        }
        log.info("Initializing wallet session");
        notifyListeners();

        Optional<PairingRecord> saved;
        try {
            saved = connector.findSavedPairing();
        } catch (RuntimeException e) {
            failInit(future, e);
            return future;
        }

        if (saved.isPresent()) {
            registerConnectorListeners();
            log.info("Rehydrating saved pairing: accountId={}", saved.get().primaryAccountId());
            applyPairing(saved.get());
            future.complete(null);
            return future;
        }

        handshake().whenComplete((ignored, ex) -> {
            if (ex != null) {
                failInit(future, ex);
                return;
            }
            registerConnectorListeners();
            boolean changed;
            synchronized (monitor) {
                changed = state == WalletState.INITIALIZING;
                if (changed) {
                    state = WalletState.READY;
                }
            }
            if (changed) {
                notifyListeners();
            }
            log.info("Wallet session initialized: state={}", getState());
            future.complete(null);
        });
        return future;
    }

    /**
     * Opens the pairing prompt and completes once the wallet pairs.
     *
     * Already paired sessions complete immediately. A concurrent second call
     * joins the pending pairing. Fails TRANSIENT when nobody pairs within the
     * pairing timeout; the session then returns to READY.
     */
    public CompletableFuture<PairingRecord> connect() {
        return init().thenCompose(ignored -> openPairing());
    }

    private CompletableFuture<PairingRecord> openPairing() {
        CompletableFuture<PairingRecord> pending;
        synchronized (monitor) {
            if (state == WalletState.PAIRED && pairing != null) {
                return CompletableFuture.completedFuture(pairing);
            }
            if (pendingPairing != null) {
                return pendingPairing;
            }
            if (!state.canOpenPairing()) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Cannot open pairing in state " + state));
            }
            pending = new CompletableFuture<>();
            pendingPairing = pending;
            state = WalletState.PAIRING;
            error = null;
        }
        notifyListeners();

        openModalWithRetry().whenComplete((ignored, ex) -> {
            if (ex != null) {
                pending.completeExceptionally(ex);
            }
        });

        return pending
            .orTimeout(pairingTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((record, ex) -> {
                if (ex != null) {
                    WalletException failure = WalletErrorClassifier.toWalletException(ex);
                    abortPairing(pending, failure);
                    throw failure;
                }
                return record;
            });
    }

    private CompletableFuture<Void> openModalWithRetry() {
        return openModal()
            .handle((ignored, ex) -> {
                if (ex == null) {
                    return CompletableFuture.<Void>completedFuture(null);
                }
                if (WalletErrorClassifier.isUriMissing(ex)) {
                    log.warn("Pairing URI missing, retrying once in {}ms", modalRetryDelay.toMillis());
                    Executor delayed = CompletableFuture.delayedExecutor(
                        modalRetryDelay.toMillis(), TimeUnit.MILLISECONDS, executor);
                    return CompletableFuture.runAsync(() -> { }, delayed).thenCompose(done -> openModal());
                }
                return CompletableFuture.<Void>failedFuture(ex);
            })
            .thenCompose(Function.identity());
    }

    private CompletableFuture<Void> openModal() {
        try {
            return connector.openPairingModal();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Polls both connector registries until they agree on an acknowledged
     * Hedera session.
     *
     * @return the session topic, or empty once {@code maxRetries} attempts
     *         have not converged
     */
    public CompletableFuture<Optional<String>> getSessionTopic(int maxRetries, long delayMs) {
        return ConvergencePoll.poll(this::findConvergedSessionTopic, maxRetries, delayMs,
                SESSION_BACKOFF_MULTIPLIER, executor)
            .thenApply(outcome -> {
                if (outcome.isConverged()) {
                    log.debug("Signing session converged after {} attempts", outcome.getAttempts());
                } else {
                    log.warn("Signing session not established after {} attempts", outcome.getAttempts());
                }
                return outcome.toOptional();
            });
    }

    private Optional<String> findConvergedSessionTopic() {
        Set<String> signingTopics = connector.signingSessions().stream()
            .filter(SessionRecord::isSigningReady)
            .map(SessionRecord::getTopic)
            .collect(Collectors.toSet());
        return connector.sessions().stream()
            .filter(SessionRecord::isSigningReady)
            .map(SessionRecord::getTopic)
            .filter(signingTopics::contains)
            .findFirst();
    }

    /**
     * Sends a serialized transaction to the wallet for signing over the
     * signing session topic.
     *
     * @param signerAccountId account that signs; the paired account when null
     * @return the normalised response; fails with a classified
     *         {@link WalletException}
     */
    public CompletableFuture<WalletResponse> submitTransaction(byte[] transaction, String signerAccountId) {
        PairingRecord current;
        synchronized (monitor) {
            current = state == WalletState.PAIRED ? pairing : null;
        }
        if (current == null) {
            return CompletableFuture.failedFuture(WalletException.of(WalletErrorKind.NOT_PAIRED));
        }
        String signer = signerAccountId != null ? signerAccountId : current.primaryAccountId();

        return getSessionTopic(sessionRetries, sessionDelayMs)
            .thenCompose(topic -> {
                if (topic.isEmpty()) {
                    throw WalletException.of(WalletErrorKind.SESSION_NOT_ESTABLISHED);
                }
                log.info("Submitting transaction to wallet: signer={}, bytes={}", signer, transaction.length);
                return send(topic.get(), transaction, signer);
            })
            .handle((response, ex) -> {
                if (ex != null) {
                    WalletException failure = WalletErrorClassifier.toWalletException(ex);
                    log.warn("Wallet submission failed: kind={}, message={}", failure.getKind(), failure.getMessage());
                    recordError(failure.getMessage());
                    throw failure;
                }
                WalletResponse parsed = WalletResponse.from(response);
                if (parsed.getTransactionId() == null) {
                    log.warn("Wallet accepted the transaction but returned no transaction id");
                } else {
                    log.info("Wallet submitted transaction: txId={}, shape={}",
                        parsed.getTransactionId(), parsed.getShape());
                }
                return parsed;
            });
    }

    private CompletableFuture<JsonNode> send(String sessionTopic, byte[] transaction, String signer) {
        try {
            return connector.sendTransaction(sessionTopic, transaction, signer)
                .copy()
                .orTimeout(submitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Drops the pairing and resets balances. Connector listeners stay
     * attached.
     */
    public CompletableFuture<Void> disconnect() {
        PairingRecord current;
        synchronized (monitor) {
            if (state == WalletState.UNINITIALIZED) {
                return CompletableFuture.completedFuture(null);
            }
            current = pairing;
        }
        if (current == null) {
            clearPairing();
            return CompletableFuture.completedFuture(null);
        }
        log.info("Disconnecting wallet: accountId={}", current.primaryAccountId());
        CompletableFuture<Void> disconnected;
        try {
            disconnected = connector.disconnect(current.getPairingTopic());
        } catch (RuntimeException e) {
            disconnected = CompletableFuture.failedFuture(e);
        }
        return disconnected.thenRun(this::clearPairing);
    }

    /**
     * Reloads balances of the paired account from the mirror node. On
     * failure the previous balances are kept and the error is recorded.
     */
    public CompletableFuture<WalletBalances> refreshBalances() {
        String accountId = getAccountId().orElse(null);
        if (accountId == null) {
            log.debug("No paired account, skipping balance refresh");
            return CompletableFuture.completedFuture(getBalances());
        }
        return CompletableFuture
            .supplyAsync(() -> mirrorNodeClient.getAccount(accountId), executor)
            .thenApply(snapshot -> WalletBalances.fromSnapshot(snapshot, mirrorNodeClient.getNetwork()))
            .handle((fresh, ex) -> {
                if (ex != null) {
                    log.warn("Failed to refresh wallet balances: accountId={}, error={}",
                        accountId, WalletErrorClassifier.unwrap(ex).getMessage());
                    recordError("Failed to refresh wallet balances");
                    return getBalances();
                }
                boolean applied;
                synchronized (monitor) {
                    applied = pairing != null && accountId.equals(pairing.primaryAccountId());
                    if (applied) {
                        balances = fresh;
                    }
                }
                if (applied) {
                    notifyListeners();
                }
                return fresh;
            });
    }

    /**
     * Registers a listener and immediately delivers the current snapshot.
     *
     * @return action that removes the listener
     */
    public Runnable subscribe(WalletStateListener listener) {
        listeners.add(listener);
        deliver(listener, getSnapshot());
        return () -> listeners.remove(listener);
    }

    public WalletSnapshot getSnapshot() {
        synchronized (monitor) {
            String accountId = pairing == null ? null : pairing.primaryAccountId();
            String network = pairing != null && pairing.getNetwork() != null
                ? pairing.getNetwork()
                : defaultNetwork();
            return new WalletSnapshot(state, accountId, network, balances, error);
        }
    }

    public WalletState getState() {
        synchronized (monitor) {
            return state;
        }
    }

    public Optional<PairingRecord> getPairing() {
        synchronized (monitor) {
            return Optional.ofNullable(pairing);
        }
    }

    public Optional<String> getAccountId() {
        return getPairing().map(PairingRecord::primaryAccountId);
    }

    public WalletBalances getBalances() {
        synchronized (monitor) {
            return balances;
        }
    }

    public Optional<ConnectionStatus> getConnectionStatus() {
        synchronized (monitor) {
            return Optional.ofNullable(connectionStatus);
        }
    }

    private String defaultNetwork() {
        HederaNetwork network = mirrorNodeClient.getNetwork();
        return network == null ? null : network.getId();
    }

    private CompletableFuture<Void> handshake() {
        try {
            return connector.init();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void registerConnectorListeners() {
        if (!connectorListenersRegistered.compareAndSet(false, true)) {
            return;
        }
        connector.onPairing(this::handlePairing);
        connector.onConnectionStatusChange(this::handleConnectionStatus);
        connector.onDisconnection(this::handleDisconnection);
        log.debug("Wallet connector listeners registered");
    }

    private void handlePairing(PairingRecord record) {
        if (record.primaryAccountId() == null) {
            log.warn("Pairing event without account ids ignored: topic={}", record.getPairingTopic());
            return;
        }
        log.info("Wallet paired: accountId={}, network={}", record.primaryAccountId(), record.getNetwork());
        applyPairing(record);
    }

    private void handleConnectionStatus(ConnectionStatus status) {
        log.info("Wallet connection status changed: {}", status);
        synchronized (monitor) {
            connectionStatus = status;
        }
    }

    private void handleDisconnection() {
        log.info("Wallet disconnected by connector");
        clearPairing();
    }

    private void applyPairing(PairingRecord record) {
        CompletableFuture<PairingRecord> pending;
        synchronized (monitor) {
            pairing = record;
            state = WalletState.PAIRED;
            error = null;
            pending = pendingPairing;
            pendingPairing = null;
        }
        notifyListeners();
        if (pending != null) {
            pending.complete(record);
        }
        refreshBalances();
    }

    private void clearPairing() {
        CompletableFuture<PairingRecord> pending;
        synchronized (monitor) {
            pairing = null;
            balances = WalletBalances.empty();
            state = WalletState.DISCONNECTED;
            error = null;
            pending = pendingPairing;
            pendingPairing = null;
        }
        notifyListeners();
        if (pending != null) {
            pending.completeExceptionally(
                new WalletException(WalletErrorKind.NOT_PAIRED, "Wallet disconnected while pairing"));
        }
    }

    private void abortPairing(CompletableFuture<PairingRecord> pending, WalletException failure) {
        boolean changed;
        synchronized (monitor) {
            boolean owned = pendingPairing == pending;
            if (owned) {
                pendingPairing = null;
            }
            changed = owned && state == WalletState.PAIRING;
            if (changed) {
                state = WalletState.READY;
                error = failure.getMessage();
            }
        }
        if (changed) {
            log.warn("Wallet pairing aborted: kind={}, message={}", failure.getKind(), failure.getMessage());
            notifyListeners();
        }
    }

    private void failInit(CompletableFuture<Void> future, Throwable cause) {
        Throwable root = WalletErrorClassifier.unwrap(cause);
        String message = "Wallet initialization failed: " + root.getMessage();
        log.error(message, root);
        synchronized (monitor) {
            initFuture = null;
            state = WalletState.UNINITIALIZED;
            error = message;
        }
        notifyListeners();
        future.completeExceptionally(new WalletException(WalletErrorKind.TRANSIENT, message, root));
    }

    private void recordError(String message) {
        synchronized (monitor) {
            error = message;
        }
        notifyListeners();
    }

    private void notifyListeners() {
        WalletSnapshot snapshot = getSnapshot();
        for (WalletStateListener listener : listeners) {
            deliver(listener, snapshot);
        }
    }

    private static void deliver(WalletStateListener listener, WalletSnapshot snapshot) {
        try {
            listener.onStateChange(snapshot);
        } catch (RuntimeException e) {
            log.error("Wallet state listener failed", e);
        }
    }
}
