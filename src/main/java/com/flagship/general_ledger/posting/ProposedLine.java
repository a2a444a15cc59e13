package com.flagship.general_ledger.posting;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a proposal, addressed by account code. Exactly one of
 * {@code debit} and {@code credit} must be set and positive.
 */
@Value
public class ProposedLine {

    @NotBlank(message = "account code is required")
    String accountCode;

    @Digits(integer = 18, fraction = 2, message = "debit must have at most 18 integer and 2 fraction digits")
    BigDecimal debit;

    @Digits(integer = 18, fraction = 2, message = "credit must have at most 18 integer and 2 fraction digits")
    BigDecimal credit;

    @Size(max = 500)
    String description;

    public static ProposedLine debit(String accountCode, BigDecimal amount) {
        return new ProposedLine(accountCode, amount, null, null);
    }

    public static ProposedLine debit(String accountCode, String amount) {
        return debit(accountCode, new BigDecimal(amount));
    }

    public static ProposedLine credit(String accountCode, BigDecimal amount) {
        return new ProposedLine(accountCode, null, amount, null);
    }

    public static ProposedLine credit(String accountCode, String amount) {
        return credit(accountCode, new BigDecimal(amount));
    }

    public static ProposedLine of(String accountCode, BigDecimal debit, BigDecimal credit, String description) {
        return new ProposedLine(accountCode, debit, credit, description);
    }

    public ProposedLine withDescription(String lineDescription) {
        return new ProposedLine(accountCode, debit, credit, lineDescription);
    }

    public boolean hasDebit() {
        return debit != null && debit.signum() != 0;
    }

    public boolean hasCredit() {
        return credit != null && credit.signum() != 0;
    }
}
