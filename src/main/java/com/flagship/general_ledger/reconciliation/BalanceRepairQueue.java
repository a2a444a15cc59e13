package com.flagship.general_ledger.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Accounts whose projected balance or mirror could not be refreshed after a
 * posting. One row per account; enqueueing an account twice keeps one row and
 * bumps its generation.
 *
 * A repair reads the row first and removes it with {@link #removeIfUnchanged}
 * afterwards. If the account was queued again in between, the generation
 * differs and the row stays for the next pass.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class BalanceRepairQueue {

    private static final int MAX_REASON_LENGTH = 500;

    private final JdbcTemplate jdbcTemplate;

    @Value
    public static class Item {
        UUID accountId;
        String reason;
        int attempts;
        long generation;
        Instant enqueuedAt;
    }

    public void enqueue(UUID accountId, String reason) {
        String trimmed = trim(reason);
        if (jdbcTemplate.update(
                "UPDATE balance_repair_queue SET reason = ?, generation = generation + 1 WHERE account_id = ?",
                trimmed, accountId) > 0) {
            return;
        }
        try {
            jdbcTemplate.update(
                "INSERT INTO balance_repair_queue (account_id, reason, attempts, enqueued_at) VALUES (?, ?, 0, ?)",
                accountId, trimmed, OffsetDateTime.now(ZoneOffset.UTC));
            log.info("Queued account {} for balance repair: {}", accountId, trimmed);
        } catch (DuplicateKeyException e) {
            log.debug("Account {} already queued for balance repair", accountId);
        }
    }

    public List<Item> nextBatch(int limit) {
        return jdbcTemplate.query(
            "SELECT account_id, reason, attempts, generation, enqueued_at FROM balance_repair_queue " +
            "ORDER BY enqueued_at, account_id LIMIT ?",
            (rs, rowNum) -> new Item(
                UUID.fromString(rs.getString("account_id")),
                rs.getString("reason"),
                rs.getInt("attempts"),
                rs.getLong("generation"),
                rs.getObject("enqueued_at", OffsetDateTime.class).toInstant()),
            limit);
    }

    public void recordFailedAttempt(UUID accountId, String error) {
        jdbcTemplate.update(
            "UPDATE balance_repair_queue SET attempts = attempts + 1, last_attempt_at = ?, reason = ? " +
            "WHERE account_id = ?",
            OffsetDateTime.now(ZoneOffset.UTC), trim(error), accountId);
    }

    /**
     * Removes the account if it has not been queued again since {@code item} was read.
     *
     * @return false when a newer request keeps the account queued
     */
    public boolean removeIfUnchanged(Item item) {
        return jdbcTemplate.update(
            "DELETE FROM balance_repair_queue WHERE account_id = ? AND generation = ?",
            item.getAccountId(), item.getGeneration()) > 0;
    }

    public boolean contains(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM balance_repair_queue WHERE account_id = ?", Integer.class, accountId);
        return count != null && count > 0;
    }

    public long size() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM balance_repair_queue", Long.class);
        return count != null ? count : 0L;
    }

    private static String trim(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > MAX_REASON_LENGTH ? reason.substring(0, MAX_REASON_LENGTH) : reason;
    }
}
