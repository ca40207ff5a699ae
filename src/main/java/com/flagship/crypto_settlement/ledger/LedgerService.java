package com.flagship.crypto_settlement.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Posts balanced entries to the double-entry ledger.
 *
 * Invariants enforced here:
 * 1. Debits equal credits for every posting
 * 2. Entries are append-only
 * 3. Each line's idempotency key is written at most once (unique index)
 *
 * A posting whose keys all exist already is reported as already posted and
 * writes nothing. A posting where only some keys exist means an earlier
 * write was partial, which cannot happen inside one transaction, so it is
 * rejected rather than topped up.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws IllegalArgumentException if the posting is unbalanced or names an unknown account
     * @throws IllegalStateException if some but not all idempotency keys are already present
     */
    @Transactional
    public PostingResult post(PostingRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Posting is not balanced: debits=%s, credits=%s",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        List<String> keys = request.idempotencyKeys();
        int existing = countExistingKeys(keys);
        if (existing == keys.size()) {
            log.info("Ledger entries already posted: invoiceId={}, keys={}", request.getInvoiceId(), keys);
            return new PostingResult(null, 0, true);
        }
        if (existing > 0) {
            throw new IllegalStateException(String.format(
                "Partial ledger posting found for invoice %s: %d of %d keys present",
                request.getInvoiceId(), existing, keys.size()));
        }

        validateAccountsExist(request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, invoice_id, correlation_id, description, created_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getInvoiceId(),
            request.getCorrelationId(),
            request.getDescription()
        );

        for (PostingRequest.Line debit : request.getDebits()) {
            insertEntry(transactionId, request, debit, EntryType.DEBIT);
        }
        for (PostingRequest.Line credit : request.getCredits()) {
            insertEntry(transactionId, request, credit, EntryType.CREDIT);
        }

        int written = request.getDebits().size() + request.getCredits().size();
        log.info("Ledger posting written: invoiceId={}, transactionId={}, entries={}, amount={} {}",
            request.getInvoiceId(), transactionId, written, request.getDebitTotal(), request.getCurrency());
        return new PostingResult(transactionId, written, false);
    }

    public boolean hasEntriesForInvoice(UUID invoiceId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE invoice_id = ?",
            Integer.class,
            invoiceId
        );
        return count != null && count > 0;
    }

    public List<LedgerEntry> getEntriesForInvoice(UUID invoiceId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, invoice_id, account_id, amount, currency, entry_type, description, " +
            "idempotency_key, sequence_number FROM ledger_entries WHERE invoice_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            invoiceId
        );
    }

    /**
     * Confirmed payments whose ledger posting never happened; each one needs
     * a ledger retry.
     */
    public long countConfirmedWithoutEntries() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM payment_events pe WHERE pe.event_type = 'PAYMENT_CONFIRMED' " +
            "AND NOT EXISTS (SELECT 1 FROM ledger_entries le WHERE le.invoice_id = pe.invoice_id)",
            Long.class
        );
        return count != null ? count : 0;
    }

    public int countEntriesByIdempotencyKeyPrefix(String prefix) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE idempotency_key LIKE ?",
            Integer.class,
            prefix + "%"
        );
        return count != null ? count : 0;
    }

    /**
     * Sums an invoice's debits and credits.
     */
    public BalanceCheck validateInvoiceBalance(UUID invoiceId) {
        return jdbcTemplate.queryForObject(
            "SELECT " +
            "COALESCE(SUM(CASE WHEN entry_type = 'DEBIT' THEN amount ELSE 0 END), 0) AS debits, " +
            "COALESCE(SUM(CASE WHEN entry_type = 'CREDIT' THEN amount ELSE 0 END), 0) AS credits, " +
            "COUNT(*) AS entry_count " +
            "FROM ledger_entries WHERE invoice_id = ?",
            (rs, rowNum) -> new BalanceCheck(
                invoiceId,
                rs.getBigDecimal("debits"),
                rs.getBigDecimal("credits"),
                rs.getInt("entry_count")),
            invoiceId
        );
    }

    /**
     * Derived balance. ASSET and EXPENSE grow on debit, the rest on credit.
     */
    public BigDecimal getAccountBalance(UUID accountId) {
        List<String> types = jdbcTemplate.queryForList(
            "SELECT account_type FROM ledger_accounts WHERE id = ?",
            String.class,
            accountId
        );
        if (types.isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        LedgerAccount.AccountType accountType = LedgerAccount.AccountType.valueOf(types.get(0));
        String debitNormal = switch (accountType) {
            case ASSET, EXPENSE -> "DEBIT";
            case LIABILITY, EQUITY, REVENUE -> "CREDIT";
        };

        BigDecimal balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = ? THEN amount ELSE -amount END), 0) " +
            "FROM ledger_entries WHERE account_id = ?",
            BigDecimal.class,
            debitNormal,
            accountId
        );
        return balance != null ? balance : BigDecimal.ZERO;
    }

    private void insertEntry(UUID transactionId, PostingRequest request, PostingRequest.Line line, EntryType type) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, invoice_id, account_id, amount, currency, entry_type, " +
            "description, idempotency_key, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            transactionId,
            request.getInvoiceId(),
            line.getAccountId(),
            line.getAmount(),
            request.getCurrency(),
            type.name(),
            line.getDescription() != null ? line.getDescription() : request.getDescription(),
            line.getIdempotencyKey()
        );
    }

    private int countExistingKeys(List<String> keys) {
        int existing = 0;
        for (String key : keys) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ledger_entries WHERE idempotency_key = ?",
                Integer.class,
                key
            );
            if (count != null && count > 0) {
                existing++;
            }
        }
        return existing;
    }

    private void validateAccountsExist(PostingRequest request) {
        List<UUID> accountIds = new ArrayList<>();
        request.getDebits().forEach(line -> accountIds.add(line.getAccountId()));
        request.getCredits().forEach(line -> accountIds.add(line.getAccountId()));

        for (UUID accountId : accountIds) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM ledger_accounts WHERE id = ?",
                Integer.class,
                accountId
            );
            if (count == null || count == 0) {
                throw new IllegalArgumentException("Account not found: " + accountId);
            }
        }
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transaction_id", UUID.class),
            rs.getObject("invoice_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getBigDecimal("amount"),
            rs.getString("currency"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getString("idempotency_key"),
            rs.getLong("sequence_number")
        );
    }
}
