package com.flagship.crypto_settlement.ledger;

import com.flagship.crypto_settlement.hedera.HederaToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Provisions the chart-of-accounts rows crypto settlement needs.
 *
 * Accounts are created on first use per organization. Provisioning is an
 * upsert on (organization_id, code): a concurrent creator that loses the
 * insert race reads the winner's row instead of failing.
 */
@Service
@Slf4j
public class LedgerAccountService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerAccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the account with the given code, creating it if absent.
     */
    @Transactional
    public LedgerAccount ensureAccount(UUID organizationId, String code, String name,
                                       LedgerAccount.AccountType accountType) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO ledger_accounts (id, organization_id, code, name, account_type, created_at) " +
            "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (organization_id, code) DO NOTHING",
            UUID.randomUUID(),
            organizationId,
            code,
            name,
            accountType.name()
        );
        if (inserted > 0) {
            log.info("Created ledger account: organizationId={}, code={}, name={}", organizationId, code, name);
        }
        return findByCode(organizationId, code)
            .orElseThrow(() -> new IllegalStateException(
                "Ledger account " + code + " missing after provisioning for organization " + organizationId));
    }

    /**
     * Provisions the token's clearing account and Accounts Receivable.
     */
    @Transactional
    public SettlementAccounts ensureSettlementAccounts(UUID organizationId, HederaToken token) {
        LedgerAccount clearing = ensureAccount(
            organizationId,
            LedgerAccountCodes.clearingCode(token),
            LedgerAccountCodes.clearingName(token),
            LedgerAccount.AccountType.ASSET);
        LedgerAccount receivable = ensureAccount(
            organizationId,
            LedgerAccountCodes.ACCOUNTS_RECEIVABLE,
            LedgerAccountCodes.ACCOUNTS_RECEIVABLE_NAME,
            LedgerAccount.AccountType.ASSET);
        return new SettlementAccounts(clearing, receivable);
    }

    public Optional<LedgerAccount> findByCode(UUID organizationId, String code) {
        List<LedgerAccount> accounts = jdbcTemplate.query(
            "SELECT id, organization_id, code, name, account_type FROM ledger_accounts " +
            "WHERE organization_id = ? AND code = ?",
            accountRowMapper(),
            organizationId,
            code
        );
        return accounts.stream().findFirst();
    }

    public List<LedgerAccount> findByOrganization(UUID organizationId) {
        return jdbcTemplate.query(
            "SELECT id, organization_id, code, name, account_type FROM ledger_accounts " +
            "WHERE organization_id = ? ORDER BY code",
            accountRowMapper(),
            organizationId
        );
    }

    private RowMapper<LedgerAccount> accountRowMapper() {
        return (rs, rowNum) -> new LedgerAccount(
            rs.getObject("id", UUID.class),
            rs.getObject("organization_id", UUID.class),
            rs.getString("code"),
            rs.getString("name"),
            LedgerAccount.AccountType.valueOf(rs.getString("account_type"))
        );
    }
}
