package com.flagship.general_ledger.posting;

import com.flagship.general_ledger.account.Account;
import com.flagship.general_ledger.account.AccountDirectory;
import com.flagship.general_ledger.ledger.NewJournalEntry;
import com.flagship.general_ledger.ledger.exception.LedgerValidationException;
import com.flagship.general_ledger.ledger.exception.UnbalancedEntryException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a proposal into an entry the ledger store can append.
 *
 * Checks, in order:
 * 1. Shape (Bean Validation): key parts, date, description, two or more lines, amount precision
 * 2. Each line carries exactly one positive amount
 * 3. Each account code resolves to an active leaf account
 * 4. Debits equal credits exactly (skipped for drafts)
 *
 * Nothing is rounded and no balancing line is ever added.
 */
@Component
@RequiredArgsConstructor
public class ProposalResolver {

    private final Validator validator;
    private final AccountDirectory accountDirectory;

    public NewJournalEntry resolve(JournalEntryProposal proposal, boolean requireBalanced) {
        if (proposal == null) {
            throw new LedgerValidationException("Journal entry proposal is required");
        }
        checkShape(proposal);

        List<NewJournalEntry.Line> lines = new ArrayList<>(proposal.getLines().size());
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;
        int lineNumber = 1;
        for (ProposedLine line : proposal.getLines()) {
            if (line == null) {
                throw new LedgerValidationException("Line " + lineNumber + " is missing");
            }
            checkAmounts(line, lineNumber);
            Account account = accountDirectory.requirePostable(line.getAccountCode());

            BigDecimal debit = line.hasDebit() ? scaled(line.getDebit()) : zero();
            BigDecimal credit = line.hasCredit() ? scaled(line.getCredit()) : zero();
            lines.add(new NewJournalEntry.Line(account.getId(), account.getCode(), debit, credit,
                line.getDescription()));
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);
            lineNumber++;
        }

        if (requireBalanced && totalDebit.compareTo(totalCredit) != 0) {
            throw new UnbalancedEntryException(totalDebit, totalCredit);
        }

        return new NewJournalEntry(
            proposal.getEntryDate(),
            proposal.getDescription().trim(),
            proposal.idempotencyKey(),
            List.copyOf(lines),
            null);
    }

    private void checkShape(JournalEntryProposal proposal) {
        Set<ConstraintViolation<JournalEntryProposal>> violations = validator.validate(proposal);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining("; "));
            throw new LedgerValidationException("Invalid journal entry proposal: " + message);
        }
    }

    private static void checkAmounts(ProposedLine line, int lineNumber) {
        if (line.getDebit() != null && line.getDebit().signum() < 0
            || line.getCredit() != null && line.getCredit().signum() < 0) {
            throw new LedgerValidationException(
                "Line " + lineNumber + " (" + line.getAccountCode() + ") has a negative amount");
        }
        if (line.hasDebit() && line.hasCredit()) {
            throw new LedgerValidationException(
                "Line " + lineNumber + " (" + line.getAccountCode() + ") carries both a debit and a credit");
        }
        if (!line.hasDebit() && !line.hasCredit()) {
            throw new LedgerValidationException(
                "Line " + lineNumber + " (" + line.getAccountCode() + ") carries no amount");
        }
    }

    // @Digits already limits the fraction to two digits, so this never rounds.
    private static BigDecimal scaled(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2);
    }
}
