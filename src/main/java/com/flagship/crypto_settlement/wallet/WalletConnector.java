package com.flagship.crypto_settlement.wallet;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Seam to the external wallet pairing library.
 *
 * Implementations wrap one underlying pairing instance. Listener
 * registration methods attach to that instance for its whole lifetime;
 * {@link WalletSessionManager} calls each of them exactly once.
 */
public interface WalletConnector {

    /**
     * Performs the relay handshake.
     */
    CompletableFuture<Void> init();

    /**
     * Pairing cached by the underlying instance from an earlier session.
     */
    Optional<PairingRecord> findSavedPairing();

    /**
     * Shows the pairing prompt. May fail transiently with a "URI missing"
     * error while the wallet extension is still starting.
     */
    CompletableFuture<Void> openPairingModal();

    void onPairing(Consumer<PairingRecord> listener);

    void onConnectionStatusChange(Consumer<ConnectionStatus> listener);

    void onDisconnection(Runnable listener);

    /**
     * Generic session registry of the relay client.
     */
    Collection<SessionRecord> sessions();

    /**
     * Session registry of the signing client. Populated independently of,
     * and usually later than, {@link #sessions()}.
     */
    Collection<SessionRecord> signingSessions();

    /**
     * Asks the wallet to sign and submit a serialized transaction.
     *
     * @param sessionTopic signing session topic, never the pairing topic
     * @return the raw wallet response
     */
    CompletableFuture<JsonNode> sendTransaction(String sessionTopic, byte[] transaction, String signerAccountId);

    CompletableFuture<Void> disconnect(String pairingTopic);
}
