package com.flagship.general_ledger.projection;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Storage for projected balances (account_balances).
 *
 * Reads are public. The write method is package-private: the balance
 * projector in this package is the only code that may change a balance.
 */
@Repository
@RequiredArgsConstructor
public class AccountBalanceStore {

    private static final String COLUMNS =
        "account_id, balance, total_debit, total_credit, line_count, last_entry_id, last_posted_at, projected_at";

    private final JdbcTemplate jdbcTemplate;

    public Optional<AccountBalance> find(UUID accountId) {
        List<AccountBalance> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM account_balances WHERE account_id = ?",
            rowMapper(),
            accountId);
        return rows.stream().findFirst();
    }

    public Map<UUID, AccountBalance> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM account_balances", rowMapper())
            .stream()
            .collect(Collectors.toMap(AccountBalance::getAccountId, Function.identity()));
    }

    /**
     * Writes the balance, overwriting whatever was stored. Each statement
     * commits on its own: the last projection to finish wins, and every
     * projection is computed from committed journal lines.
     */
    void save(AccountBalance balance) {
        int updated = update(balance);
        if (updated > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                "INSERT INTO account_balances (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                balance.getAccountId(),
                balance.getBalance(),
                balance.getTotalDebit(),
                balance.getTotalCredit(),
                balance.getLineCount(),
                balance.getLastEntryId(),
                timestamp(balance.getLastPostedAt()),
                timestamp(balance.getProjectedAt()));
        } catch (DuplicateKeyException e) {
            // Row created by a concurrent projection after our update.
            update(balance);
        }
    }

    private int update(AccountBalance balance) {
        return jdbcTemplate.update(
            "UPDATE account_balances SET balance = ?, total_debit = ?, total_credit = ?, line_count = ?, " +
            "last_entry_id = ?, last_posted_at = ?, projected_at = ? WHERE account_id = ?",
            balance.getBalance(),
            balance.getTotalDebit(),
            balance.getTotalCredit(),
            balance.getLineCount(),
            balance.getLastEntryId(),
            timestamp(balance.getLastPostedAt()),
            timestamp(balance.getProjectedAt()),
            balance.getAccountId());
    }

    private RowMapper<AccountBalance> rowMapper() {
        return (rs, rowNum) -> new AccountBalance(
            UUID.fromString(rs.getString("account_id")),
            rs.getBigDecimal("balance"),
            rs.getBigDecimal("total_debit"),
            rs.getBigDecimal("total_credit"),
            rs.getLong("line_count"),
            uuid(rs, "last_entry_id"),
            instant(rs, "last_posted_at"),
            instant(rs, "projected_at"));
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static OffsetDateTime timestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }
}
