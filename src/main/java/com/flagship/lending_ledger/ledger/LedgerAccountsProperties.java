package com.flagship.lending_ledger.ledger;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Chart codes for each {@link LedgerAccount} role ({@code ledger.accounts.*}).
 */
@ConfigurationProperties(prefix = "ledger.accounts")
@Validated
@Getter
@Setter
public class LedgerAccountsProperties {

    /** Resolve and verify every code during startup instead of on first use. */
    private boolean verifyOnStartup = true;

    @NotBlank
    private String cashBank = "1100";

    @NotBlank
    private String loansReceivable = "1300";

    @NotBlank
    private String interestIncome = "4100";

    @NotBlank
    private String feeIncome = "4200";

    @NotBlank
    private String savingsLiability = "2100";

    @NotBlank
    private String fixedDepositLiability = "2200";

    @NotBlank
    private String interestPayable = "2300";

    @NotBlank
    private String depositInterestExpense = "5220";

    @NotBlank
    private String savingsInterestExpense = "5210";

    public String codeFor(LedgerAccount account) {
        return switch (account) {
            case CASH_BANK -> cashBank;
            case LOANS_RECEIVABLE -> loansReceivable;
            case INTEREST_INCOME -> interestIncome;
            case FEE_INCOME -> feeIncome;
            case SAVINGS_LIABILITY -> savingsLiability;
            case FIXED_DEPOSIT_LIABILITY -> fixedDepositLiability;
            case INTEREST_PAYABLE -> interestPayable;
            case DEPOSIT_INTEREST_EXPENSE -> depositInterestExpense;
            case SAVINGS_INTEREST_EXPENSE -> savingsInterestExpense;
        };
    }
}
