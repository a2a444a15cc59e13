package com.flagship.general_ledger.ledger;

import com.flagship.general_ledger.ledger.exception.DuplicatePostingException;
import com.flagship.general_ledger.ledger.exception.IllegalEntryStateException;
import com.flagship.general_ledger.ledger.exception.JournalEntryNotFoundException;
import com.flagship.general_ledger.ledger.exception.UnbalancedEntryException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only store of journal entries and their lines.
 *
 * This store enforces the core invariants:
 * 1. A posted entry is balanced (application check plus a table constraint)
 * 2. At most one posted entry per idempotency key (primary key of journal_posting_keys)
 * 3. Entry, key and lines are written in one transaction
 *
 * Lines are never updated or deleted. The only columns that change after an
 * insert are the lifecycle ones on journal_entries.
 *
 * Write methods require a transaction owned by the caller so that outbox
 * events and entry numbers commit or roll back together with the entry.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LedgerStore {

    private static final String ENTRY_COLUMNS =
        "id, entry_number, entry_date, description, source_type, source_id, purpose, status, " +
        "total_debit, total_credit, posted_at, reversed_by, reversed_from, void_reason, created_at";

    private static final String LINE_SELECT =
        "SELECT l.id, l.entry_id, l.line_number, l.account_id, a.code AS account_code, " +
        "l.debit, l.credit, l.description " +
        "FROM journal_lines l JOIN accounts a ON a.id = l.account_id ";

    private final JdbcTemplate jdbcTemplate;
    private final EntryNumberGenerator entryNumberGenerator;

    /**
     * Appends a POSTED entry with its lines and claims its idempotency key.
     *
     * @throws UnbalancedEntryException if the lines do not balance
     * @throws DuplicatePostingException if the key is owned by another entry;
     *         the caller's transaction must roll back
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry append(NewJournalEntry entry) {
        requireBalanced(entry.totalDebit(), entry.totalCredit());

        UUID entryId = UUID.randomUUID();
        Instant now = now();
        String entryNumber = entryNumberGenerator.next(entry.entryPrefix(), entry.getEntryDate());

        insertEntry(entryId, entryNumber, entry, EntryStatus.POSTED, now);
        claimKey(entry.getIdempotencyKey(), entryId, now);
        insertLines(entryId, entry.getLines());

        log.debug("Appended journal entry: entryNumber={}, key={}, lines={}",
                entryNumber, entry.getIdempotencyKey(), entry.getLines().size());
        return getById(entryId);
    }

    /**
     * Stores a DRAFT entry. No key is claimed and no balance is required yet.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry saveDraft(NewJournalEntry entry) {
        UUID entryId = UUID.randomUUID();
        String entryNumber = entryNumberGenerator.next(entry.entryPrefix(), entry.getEntryDate());

        insertEntry(entryId, entryNumber, entry, EntryStatus.DRAFT, now());
        insertLines(entryId, entry.getLines());

        log.debug("Saved draft journal entry: entryNumber={}, key={}", entryNumber, entry.getIdempotencyKey());
        return getById(entryId);
    }

    /**
     * Promotes a DRAFT entry to POSTED under the same rules as {@link #append}.
     *
     * @throws IllegalEntryStateException if the entry is not a draft
     * @throws UnbalancedEntryException if the draft's lines do not balance
     * @throws DuplicatePostingException if another entry owns the draft's key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry promoteDraft(UUID entryId) {
        JournalEntry draft = lockEntry(entryId);
        if (!draft.isDraft()) {
            throw new IllegalEntryStateException(
                "Journal entry " + draft.getEntryNumber() + " is " + draft.getStatus() + ", not DRAFT");
        }
        requireBalanced(draft.getTotalDebit(), draft.getTotalCredit());

        Instant now = now();
        claimKey(draft.getIdempotencyKey(), entryId, now);
        jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, posted_at = ? WHERE id = ? AND status = ?",
            EntryStatus.POSTED.name(), timestamp(now), entryId, EntryStatus.DRAFT.name());

        log.debug("Promoted draft journal entry: entryNumber={}", draft.getEntryNumber());
        return getById(entryId);
    }

    /**
     * Voids a POSTED entry by appending a reversing entry dated {@code voidDate}
     * with every line's sides swapped. The original's idempotency key is
     * released so that the business event can be posted again.
     *
     * Voiding an entry that is already VOID writes nothing and returns the
     * existing reversal.
     *
     * @throws IllegalEntryStateException for drafts and for reversing entries
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VoidResult voidEntry(UUID entryId, String reason, LocalDate voidDate) {
        JournalEntry original = lockEntry(entryId);
        if (original.isVoid()) {
            JournalEntry reversal = original.getReversedBy() != null ? getById(original.getReversedBy()) : null;
            return new VoidResult(original, reversal, true);
        }
        if (original.isDraft()) {
            throw new IllegalEntryStateException(
                "Draft journal entry " + original.getEntryNumber() + " cannot be voided");
        }
        if (original.isReversal()) {
            throw new IllegalEntryStateException(
                "Reversing journal entry " + original.getEntryNumber() + " cannot be voided");
        }

        jdbcTemplate.update(
            "DELETE FROM journal_posting_keys WHERE entry_id = ?", entryId);

        List<NewJournalEntry.Line> swapped = original.getLines().stream()
            .map(line -> new NewJournalEntry.Line(
                line.getAccountId(),
                line.getAccountCode(),
                line.getCredit(),
                line.getDebit(),
                line.getDescription()))
            .toList();
        NewJournalEntry reversing = new NewJournalEntry(
            voidDate,
            reversalDescription(original.getDescription()),
            original.getIdempotencyKey().reversalOf(original.getEntryNumber()),
            swapped,
            original.getId());
        JournalEntry reversal = append(reversing);

        jdbcTemplate.update(
            "UPDATE journal_entries SET status = ?, reversed_by = ?, void_reason = ? WHERE id = ? AND status = ?",
            EntryStatus.VOID.name(), reversal.getId(), reason, entryId, EntryStatus.POSTED.name());

        log.debug("Voided journal entry {} with reversal {}", original.getEntryNumber(), reversal.getEntryNumber());
        return new VoidResult(getById(entryId), reversal, false);
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findById(UUID entryId) {
        List<JournalEntry> headers = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE id = ?",
            entryHeaderRowMapper(),
            entryId);
        return headers.stream().findFirst().map(this::withLines);
    }

    @Transactional(readOnly = true)
    public JournalEntry getById(UUID entryId) {
        return findById(entryId).orElseThrow(() -> new JournalEntryNotFoundException(entryId));
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findByEntryNumber(String entryNumber) {
        List<UUID> ids = jdbcTemplate.query(
            "SELECT id FROM journal_entries WHERE entry_number = ?",
            (rs, rowNum) -> uuid(rs, "id"),
            entryNumber);
        return ids.stream().findFirst().flatMap(this::findById);
    }

    /**
     * The entry that currently owns the key, if any. Released keys (voided
     * entries) do not match.
     */
    @Transactional(readOnly = true)
    public Optional<JournalEntry> findByIdempotencyKey(IdempotencyKey key) {
        List<UUID> ids = jdbcTemplate.query(
            "SELECT entry_id FROM journal_posting_keys WHERE source_type = ? AND source_id = ? AND purpose = ?",
            (rs, rowNum) -> uuid(rs, "entry_id"),
            key.getSourceType().name(), key.getSourceId(), key.getPurpose());
        return ids.stream().findFirst().flatMap(this::findById);
    }

    /**
     * Lines for one account ordered by posted timestamp, entry id and line
     * number. With {@code postedOnly} the lines of drafts are skipped; lines of
     * voided entries are kept because their reversal offsets them.
     *
     * The stream holds a database cursor and must be closed by the caller.
     * Calling again restarts from the first line.
     */
    public Stream<AccountLedgerLine> linesForAccount(UUID accountId, boolean postedOnly) {
        String sql =
            "SELECT l.id, l.entry_id, e.entry_number, e.entry_date, e.status, e.posted_at, " +
            "l.account_id, l.debit, l.credit, COALESCE(l.description, e.description) AS description " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.account_id = ? " +
            (postedOnly ? "AND e.posted_at IS NOT NULL " : "") +
            "ORDER BY e.posted_at, e.id, l.line_number";
        return jdbcTemplate.queryForStream(sql, accountLineRowMapper(), accountId);
    }

    public Stream<AccountLedgerLine> linesForAccount(UUID accountId) {
        return linesForAccount(accountId, true);
    }

    /**
     * Aggregate of the posted lines of one account.
     */
    public LineTotals postedTotals(UUID accountId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(l.debit), 0) AS total_debit, COALESCE(SUM(l.credit), 0) AS total_credit, " +
            "COUNT(l.id) AS line_count " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.account_id = ? AND e.posted_at IS NOT NULL",
            (rs, rowNum) -> new LineTotals(
                accountId,
                rs.getBigDecimal("total_debit"),
                rs.getBigDecimal("total_credit"),
                rs.getLong("line_count"),
                lastPostedEntry(accountId)),
            accountId);
    }

    /**
     * Aggregates of the posted lines of every account that has any, keyed by
     * account id. Two queries regardless of the number of accounts.
     */
    public Map<UUID, LineTotals> postedTotalsByAccount() {
        Map<UUID, LastPosted> lastPosted = lastPostedByAccount();
        List<LineTotals> totals = jdbcTemplate.query(
            "SELECT l.account_id, COALESCE(SUM(l.debit), 0) AS total_debit, " +
            "COALESCE(SUM(l.credit), 0) AS total_credit, COUNT(l.id) AS line_count " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE e.posted_at IS NOT NULL GROUP BY l.account_id",
            (rs, rowNum) -> {
                UUID accountId = uuid(rs, "account_id");
                return new LineTotals(
                    accountId,
                    rs.getBigDecimal("total_debit"),
                    rs.getBigDecimal("total_credit"),
                    rs.getLong("line_count"),
                    lastPosted.get(accountId));
            });
        return totals.stream().collect(Collectors.toMap(LineTotals::getAccountId, Function.identity()));
    }

    /**
     * Posted entries whose stored totals disagree with their lines or with
     * each other. Used by the integrity check.
     */
    public List<EntryTotalsMismatch> findEntryTotalMismatches() {
        return jdbcTemplate.query(
            "SELECT e.id, e.entry_number, e.total_debit, e.total_credit, " +
            "COALESCE(SUM(l.debit), 0) AS line_debit, COALESCE(SUM(l.credit), 0) AS line_credit " +
            "FROM journal_entries e LEFT JOIN journal_lines l ON l.entry_id = e.id " +
            "WHERE e.posted_at IS NOT NULL " +
            "GROUP BY e.id, e.entry_number, e.total_debit, e.total_credit " +
            "HAVING e.total_debit <> e.total_credit " +
            "OR e.total_debit <> COALESCE(SUM(l.debit), 0) " +
            "OR e.total_credit <> COALESCE(SUM(l.credit), 0) " +
            "ORDER BY e.entry_number",
            (rs, rowNum) -> new EntryTotalsMismatch(
                uuid(rs, "id"),
                rs.getString("entry_number"),
                rs.getBigDecimal("total_debit"),
                rs.getBigDecimal("total_credit"),
                rs.getBigDecimal("line_debit"),
                rs.getBigDecimal("line_credit")));
    }

    public boolean hasLines(UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_lines WHERE account_id = ?",
            Integer.class,
            accountId);
        return count != null && count > 0;
    }

    public long countEntries(EntryStatus status) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE status = ?",
            Long.class,
            status.name());
        return count != null ? count : 0L;
    }

    // journal_entries.description is VARCHAR(500)
    private static String reversalDescription(String description) {
        String reversal = "REVERSAL: " + description;
        return reversal.length() > 500 ? reversal.substring(0, 500) : reversal;
    }

    private LastPosted lastPostedEntry(UUID accountId) {
        List<LastPosted> last = jdbcTemplate.query(
            "SELECT e.id, e.posted_at FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE l.account_id = ? AND e.posted_at IS NOT NULL " +
            "ORDER BY e.posted_at DESC, e.id DESC LIMIT 1",
            (rs, rowNum) -> new LastPosted(uuid(rs, "id"), instant(rs, "posted_at")),
            accountId);
        return last.isEmpty() ? null : last.get(0);
    }

    // Same ordering as lastPostedEntry, one row per account.
    private Map<UUID, LastPosted> lastPostedByAccount() {
        Map<UUID, LastPosted> last = new HashMap<>();
        jdbcTemplate.query(
            "SELECT account_id, id, posted_at FROM (" +
            "SELECT l.account_id, e.id, e.posted_at, ROW_NUMBER() OVER (" +
            "PARTITION BY l.account_id ORDER BY e.posted_at DESC, e.id DESC) AS rn " +
            "FROM journal_lines l JOIN journal_entries e ON e.id = l.entry_id " +
            "WHERE e.posted_at IS NOT NULL) ranked WHERE rn = 1",
            rs -> {
                last.put(uuid(rs, "account_id"), new LastPosted(uuid(rs, "id"), instant(rs, "posted_at")));
            });
        return last;
    }

    private JournalEntry lockEntry(UUID entryId) {
        List<JournalEntry> headers = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE id = ? FOR UPDATE",
            entryHeaderRowMapper(),
            entryId);
        if (headers.isEmpty()) {
            throw new JournalEntryNotFoundException(entryId);
        }
        return withLines(headers.get(0));
    }

    private void insertEntry(UUID entryId, String entryNumber, NewJournalEntry entry,
                             EntryStatus status, Instant now) {
        IdempotencyKey key = entry.getIdempotencyKey();
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, entry_number, entry_date, description, source_type, source_id, " +
            "purpose, status, total_debit, total_credit, posted_at, reversed_from, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entryId,
            entryNumber,
            entry.getEntryDate(),
            entry.getDescription(),
            key.getSourceType().name(),
            key.getSourceId(),
            key.getPurpose(),
            status.name(),
            entry.totalDebit(),
            entry.totalCredit(),
            status == EntryStatus.DRAFT ? null : timestamp(now),
            entry.getReversedFrom(),
            timestamp(now));
    }

    private void claimKey(IdempotencyKey key, UUID entryId, Instant now) {
        try {
            jdbcTemplate.update(
                "INSERT INTO journal_posting_keys (source_type, source_id, purpose, entry_id, claimed_at) " +
                "VALUES (?, ?, ?, ?, ?)",
                key.getSourceType().name(),
                key.getSourceId(),
                key.getPurpose(),
                entryId,
                timestamp(now));
        } catch (DuplicateKeyException e) {
            throw new DuplicatePostingException(key, e);
        }
    }

    private void insertLines(UUID entryId, List<NewJournalEntry.Line> lines) {
        List<Object[]> rows = new ArrayList<>(lines.size());
        int lineNumber = 1;
        for (NewJournalEntry.Line line : lines) {
            rows.add(new Object[] {
                UUID.randomUUID(),
                entryId,
                lineNumber++,
                line.getAccountId(),
                line.getDebit(),
                line.getCredit(),
                line.getDescription()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (id, entry_id, line_number, account_id, debit, credit, description) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            rows);
    }

    private JournalEntry withLines(JournalEntry header) {
        List<JournalLine> lines = jdbcTemplate.query(
            LINE_SELECT + "WHERE l.entry_id = ? ORDER BY l.line_number",
            lineRowMapper(),
            header.getId());
        return new JournalEntry(
            header.getId(),
            header.getEntryNumber(),
            header.getEntryDate(),
            header.getDescription(),
            header.getIdempotencyKey(),
            header.getStatus(),
            header.getTotalDebit(),
            header.getTotalCredit(),
            header.getPostedAt(),
            header.getReversedBy(),
            header.getReversedFrom(),
            header.getVoidReason(),
            header.getCreatedAt(),
            List.copyOf(lines));
    }

    private static void requireBalanced(BigDecimal debit, BigDecimal credit) {
        if (debit.compareTo(credit) != 0) {
            throw new UnbalancedEntryException(debit, credit);
        }
    }

    private RowMapper<JournalEntry> entryHeaderRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            uuid(rs, "id"),
            rs.getString("entry_number"),
            rs.getObject("entry_date", LocalDate.class),
            rs.getString("description"),
            new IdempotencyKey(
                SourceType.valueOf(rs.getString("source_type")),
                rs.getString("source_id"),
                rs.getString("purpose")),
            EntryStatus.valueOf(rs.getString("status")),
            rs.getBigDecimal("total_debit"),
            rs.getBigDecimal("total_credit"),
            instant(rs, "posted_at"),
            uuid(rs, "reversed_by"),
            uuid(rs, "reversed_from"),
            rs.getString("void_reason"),
            instant(rs, "created_at"),
            List.of());
    }

    private RowMapper<JournalLine> lineRowMapper() {
        return (rs, rowNum) -> new JournalLine(
            uuid(rs, "id"),
            uuid(rs, "entry_id"),
            rs.getInt("line_number"),
            uuid(rs, "account_id"),
            rs.getString("account_code"),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getString("description"));
    }

    private RowMapper<AccountLedgerLine> accountLineRowMapper() {
        return (rs, rowNum) -> new AccountLedgerLine(
            uuid(rs, "id"),
            uuid(rs, "entry_id"),
            rs.getString("entry_number"),
            rs.getObject("entry_date", LocalDate.class),
            EntryStatus.valueOf(rs.getString("status")),
            instant(rs, "posted_at"),
            uuid(rs, "account_id"),
            rs.getBigDecimal("debit"),
            rs.getBigDecimal("credit"),
            rs.getString("description"));
    }

    static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value != null ? UUID.fromString(value) : null;
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static OffsetDateTime timestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    // PostgreSQL keeps microseconds; truncate so that round-tripped values compare equal.
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Sums of the posted lines of one account.
     */
    @Value
    public static class LineTotals {
        UUID accountId;
        BigDecimal totalDebit;
        BigDecimal totalCredit;
        long lineCount;
        LastPosted lastPosted;
    }

    @Value
    public static class LastPosted {
        UUID entryId;
        Instant postedAt;
    }

    @Value
    public static class EntryTotalsMismatch {
        UUID entryId;
        String entryNumber;
        BigDecimal storedDebit;
        BigDecimal storedCredit;
        BigDecimal lineDebit;
        BigDecimal lineCredit;
    }
}
