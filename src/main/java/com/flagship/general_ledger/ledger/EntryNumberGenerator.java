package com.flagship.general_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Issues human-readable entry numbers of the form {@code PREFIX-YYYY-MM-NNNN}.
 *
 * One counter row per prefix and month. Opening the series and the increment
 * both run in the caller's transaction on the caller's connection, so the row
 * stays locked until the entry commits and a rolled back append gives its
 * number back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EntryNumberGenerator {

    private static final DateTimeFormatter PERIOD = DateTimeFormatter.ofPattern("yyyy-MM");

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public String next(String prefix, LocalDate entryDate) {
        String period = entryDate.format(PERIOD);
        openSeries(prefix, period);

        jdbcTemplate.update(
            "UPDATE entry_number_sequences SET last_value = last_value + 1 WHERE prefix = ? AND period = ?",
            prefix, period);
        Long value = jdbcTemplate.queryForObject(
            "SELECT last_value FROM entry_number_sequences WHERE prefix = ? AND period = ?",
            Long.class, prefix, period);
        if (value == null) {
            throw new IllegalStateException("Entry number counter missing for " + prefix + " " + period);
        }
        return format(prefix, period, value);
    }

    static String format(String prefix, String period, long value) {
        return String.format("%s-%s-%04d", prefix, period, value);
    }

    // ON CONFLICT DO NOTHING: a concurrent opener waits on the row instead of aborting the transaction.
    private void openSeries(String prefix, String period) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO entry_number_sequences (prefix, period, last_value) VALUES (?, ?, 0) " +
            "ON CONFLICT DO NOTHING",
            prefix, period);
        if (inserted > 0) {
            log.info("Opened entry number series {}-{}", prefix, period);
        }
    }
}
