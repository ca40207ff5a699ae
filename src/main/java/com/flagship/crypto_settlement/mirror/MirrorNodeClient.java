package com.flagship.crypto_settlement.mirror;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.crypto_settlement.hedera.HederaNetwork;
import com.flagship.crypto_settlement.hedera.TransactionIdNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only client for the Hedera mirror node REST API.
 *
 * Endpoints used:
 * - GET /api/v1/transactions (account page, newest first)
 * - GET /api/v1/transactions/{id}
 * - GET /api/v1/accounts/{id}
 * - GET /api/v1/accounts/{id}/tokens
 *
 * Every failure surfaces as {@link MirrorNodeException}; callers decide
 * whether that is fatal. Responses are read as {@link JsonNode} so fields the
 * mirror node adds or omits never break parsing.
 */
@Component
@Slf4j
public class MirrorNodeClient {

    private static final String API_PREFIX = "/api/v1";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final HederaNetwork network;
    private final String baseUrl;

    public MirrorNodeClient(@Qualifier("mirrorNodeRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            @Value("${hedera.network:testnet}") String network,
                            @Value("${hedera.mirror.base-url:}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.network = HederaNetwork.fromId(network);
        this.baseUrl = baseUrl == null || baseUrl.isBlank()
            ? this.network.getMirrorNodeUrl()
            : stripTrailingSlash(baseUrl);
        log.info("Mirror node client configured: network={}, baseUrl={}", this.network.getId(), this.baseUrl);
    }

    public HederaNetwork getNetwork() {
        return network;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Fetches one newest-first page of transactions touching an account.
     */
    public List<MirrorTransaction> findTransactions(TransactionQuery query) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path(API_PREFIX + "/transactions")
            .queryParam("account.id", query.getAccountId())
            .queryParam("limit", query.getLimit())
            .queryParam("order", "desc");
        if (query.getSince() != null) {
            builder.queryParam("timestamp", "gte:" + query.getSince().getEpochSecond());
        }
        if (query.getTransactionType() != null) {
            builder.queryParam("transactionType", query.getTransactionType());
        }

        JsonNode root = get(builder.encode().build().toUri())
            .orElseThrow(() -> new MirrorNodeException("Mirror node returned no transaction page"));
        return parseTransactions(root.path("transactions"));
    }

    /**
     * Looks up a single transaction. Accepts either id format.
     *
     * @return empty when the mirror node does not know the id (yet)
     */
    public Optional<MirrorTransaction> getTransaction(String transactionId) {
        String normalized = TransactionIdNormalizer.normalize(transactionId);
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path(API_PREFIX + "/transactions/{id}")
            .buildAndExpand(normalized)
            .encode()
            .toUri();

        return get(uri).flatMap(root -> parseTransactions(root.path("transactions")).stream().findFirst());
    }

    public AccountSnapshot getAccount(String accountId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path(API_PREFIX + "/accounts/{id}")
            .buildAndExpand(accountId)
            .encode()
            .toUri();

        JsonNode root = get(uri)
            .orElseThrow(() -> new MirrorNodeException("Account not found on mirror node: " + accountId));

        JsonNode balance = root.path("balance");
        Map<String, BigInteger> tokens = new LinkedHashMap<>();
        for (JsonNode token : balance.path("tokens")) {
            tokens.put(token.path("token_id").asText(), token.path("balance").bigIntegerValue());
        }
        return new AccountSnapshot(
            root.path("account").asText(accountId),
            balance.path("balance").bigIntegerValue(),
            Collections.unmodifiableMap(tokens));
    }

    public List<TokenRelationship> getTokenRelationships(String accountId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path(API_PREFIX + "/accounts/{id}/tokens")
            .buildAndExpand(accountId)
            .encode()
            .toUri();

        JsonNode root = get(uri).orElse(null);
        if (root == null) {
            return List.of();
        }
        List<TokenRelationship> relationships = new ArrayList<>();
        for (JsonNode token : root.path("tokens")) {
            relationships.add(new TokenRelationship(
                token.path("token_id").asText(),
                token.path("balance").bigIntegerValue(),
                token.path("automatic_association").asBoolean(false)));
        }
        return relationships;
    }

    /**
     * Cheapest request the mirror node answers: one row of the global
     * transactions list.
     *
     * @throws MirrorNodeException when the node is unreachable or errors
     */
    public void ping() {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path(API_PREFIX + "/transactions")
            .queryParam("limit", 1)
            .encode()
            .build()
            .toUri();
        get(uri).orElseThrow(() -> new MirrorNodeException("Mirror node returned 404 for " + uri.getPath()));
    }

    private Optional<JsonNode> get(URI uri) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new MirrorNodeException("Empty response from mirror node: " + uri.getPath());
            }
            return Optional.of(objectMapper.readTree(body));
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new MirrorNodeException(
                String.format("Mirror node returned %d for %s", e.getStatusCode().value(), uri.getPath()), e);
        } catch (RestClientException e) {
            throw new MirrorNodeException("Mirror node request failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new MirrorNodeException("Unparseable mirror node response for " + uri.getPath(), e);
        }
    }

    private List<MirrorTransaction> parseTransactions(JsonNode transactions) {
        if (!transactions.isArray()) {
            return List.of();
        }
        List<MirrorTransaction> result = new ArrayList<>(transactions.size());
        for (JsonNode tx : transactions) {
            List<MirrorTransfer> transfers = new ArrayList<>();
            for (JsonNode t : tx.path("transfers")) {
                transfers.add(new MirrorTransfer(
                    t.path("account").asText(),
                    t.path("amount").asLong(),
                    t.path("is_approval").asBoolean(false)));
            }
            List<MirrorTokenTransfer> tokenTransfers = new ArrayList<>();
            for (JsonNode t : tx.path("token_transfers")) {
                tokenTransfers.add(new MirrorTokenTransfer(
                    t.path("token_id").asText(),
                    t.path("account").asText(),
                    t.path("amount").asLong(),
                    t.path("is_approval").asBoolean(false)));
            }
            result.add(new MirrorTransaction(
                tx.path("transaction_id").asText(),
                textOrNull(tx, "consensus_timestamp"),
                tx.path("charged_tx_fee").asLong(0),
                textOrNull(tx, "memo_base64"),
                textOrNull(tx, "result"),
                textOrNull(tx, "name"),
                List.copyOf(transfers),
                List.copyOf(tokenTransfers)));
        }
        return result;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
