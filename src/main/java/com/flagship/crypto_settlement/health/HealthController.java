package com.flagship.crypto_settlement.health;

import com.flagship.crypto_settlement.ledger.LedgerService;
import com.flagship.crypto_settlement.mirror.MirrorNodeClient;
import com.flagship.crypto_settlement.outbox.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settlement liveness outside Actuator.
 *
 * DOWN (503) when the settlement tables cannot be read. Confirmed payments
 * still missing ledger entries make the status DEGRADED; operators clear
 * them with the ledger retry endpoint. The mirror node is not probed here.
 */
@RestController
@Slf4j
public class HealthController {

    private final LedgerService ledgerService;
    private final OutboxEventRepository outboxRepository;
    private final MirrorNodeClient mirrorNodeClient;
    private final String lockMode;

    public HealthController(LedgerService ledgerService,
                            OutboxEventRepository outboxRepository,
                            MirrorNodeClient mirrorNodeClient,
                            @Value("${settlement.lock.mode:advisory}") String lockMode) {
        this.ledgerService = ledgerService;
        this.outboxRepository = outboxRepository;
        this.mirrorNodeClient = mirrorNodeClient;
        this.lockMode = lockMode;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("network", mirrorNodeClient.getNetwork().getId());
        response.put("lockMode", lockMode);

        long unposted;
        long pendingSync;
        try {
            unposted = ledgerService.countConfirmedWithoutEntries();
            pendingSync = outboxRepository.countUnpublished();
        } catch (DataAccessException e) {
            log.warn("Settlement health check failed: {}", e.getMessage());
            response.put("status", "DOWN");
            response.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }

        response.put("status", unposted == 0 ? "UP" : "DEGRADED");
        response.put("database", "UP");
        response.put("unpostedSettlements", unposted);
        response.put("pendingLedgerSync", pendingSync);
        return ResponseEntity.ok(response);
    }
}
