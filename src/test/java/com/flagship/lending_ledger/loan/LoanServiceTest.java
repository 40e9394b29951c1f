package com.flagship.lending_ledger.loan;

import com.flagship.lending_ledger.ledger.AccountService;
import com.flagship.lending_ledger.ledger.ActorIdentity;
import com.flagship.lending_ledger.ledger.JournalEntry;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;
import com.flagship.lending_ledger.ledger.LedgerService;
import com.flagship.lending_ledger.period.PeriodStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loan lifecycle against a real database: creation, disbursement, repayment
 * allocation, overdue marking and payoff, with the ledger effect of each step.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class LoanServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final ActorIdentity OFFICER = ActorIdentity.of("loan-officer", 2, null);
    private static final LocalDate START = LocalDate.of(2025, 1, 10);

    @Autowired
    private LoanService loanService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AccountService accountService;

    private String customerId;

    @BeforeEach
    void setUp() {
        customerId = "CUST-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private LoanApplication.LoanApplicationBuilder standardApplication() {
        return LoanApplication.builder()
            .customerId(customerId)
            .principal(new BigDecimal("1200000"))
            .annualRate(new BigDecimal("24"))
            .tenureMonths(12)
            .processingFee(new BigDecimal("12000"))
            .startDate(START);
    }

    private Loan activeLoan() {
        Loan loan = loanService.createLoan(OFFICER, standardApplication().build()).getOrThrow();
        return loanService.disburse(OFFICER, loan.getId(), START).getOrThrow();
    }

    private LedgerResult<RepaymentReceipt> repay(UUID loanId, String amount, LocalDate date, String reference) {
        return loanService.repay(OFFICER, RepaymentRequest.builder()
            .loanId(loanId)
            .amount(new BigDecimal(amount))
            .paymentDate(date)
            .paymentReference(reference)
            .build());
    }

    private BigDecimal balance(String code) {
        return accountService.findByCode(code).orElseThrow().getCurrentBalance();
    }

    @Test
    @DisplayName("Creating a loan computes and stores its schedule without touching the ledger")
    void testCreateLoan() {
        BigDecimal receivableBefore = balance("1300");

        Loan loan = loanService.createLoan(OFFICER, standardApplication().build()).getOrThrow();

        assertEquals(LoanStatus.PENDING_DISBURSEMENT, loan.getStatus());
        assertTrue(loan.getLoanNumber().startsWith("LN"));
        assertEquals(0, new BigDecimal("113471.52").compareTo(loan.getInstallmentAmount()));
        assertEquals(0, new BigDecimal("161658.19").compareTo(loan.getTotalInterest()));
        assertEquals(START.plusMonths(12), loan.getMaturityDate());

        List<ScheduleEntry> schedule = loanService.getSchedule(loan.getId());
        assertEquals(12, schedule.size());
        assertTrue(schedule.stream().allMatch(entry -> entry.getStatus() == ScheduleStatus.PENDING));
        assertEquals(0, BigDecimal.ZERO.compareTo(schedule.get(11).getOutstandingBalance()));
        assertEquals(0, receivableBefore.compareTo(balance("1300")));
    }

    @Test
    @DisplayName("Invalid loan terms are rejected before anything is written")
    void testInvalidApplication() {
        assertTrue(loanService.createLoan(OFFICER, standardApplication().tenureMonths(0).build())
            .hasErrorKind(LedgerErrorKind.INVALID_AMOUNT));
        assertTrue(loanService.createLoan(OFFICER, standardApplication().principal(BigDecimal.ZERO).build())
            .hasErrorKind(LedgerErrorKind.INVALID_AMOUNT));
        assertTrue(loanService.createLoan(OFFICER, standardApplication().processingFee(new BigDecimal("1200000")).build())
            .hasErrorKind(LedgerErrorKind.INVALID_AMOUNT));
        assertTrue(loanService.createLoan(OFFICER, standardApplication().customerId(" ").build())
            .hasErrorKind(LedgerErrorKind.INVALID_LINE));
    }

    @Test
    @DisplayName("Disbursement debits loans receivable, credits cash net of fee and fee income")
    void testDisbursement() {
        Loan pending = loanService.createLoan(OFFICER, standardApplication().build()).getOrThrow();
        BigDecimal cashBefore = balance("1100");
        BigDecimal receivableBefore = balance("1300");
        BigDecimal feesBefore = balance("4200");

        Loan loan = loanService.disburse(OFFICER, pending.getId(), START).getOrThrow();

        assertEquals(LoanStatus.ACTIVE, loan.getStatus());
        assertNotNull(loan.getDisbursementEntryId());
        assertEquals(0, new BigDecimal("-1188000.00").compareTo(balance("1100").subtract(cashBefore)));
        assertEquals(0, new BigDecimal("1200000.00").compareTo(balance("1300").subtract(receivableBefore)));
        assertEquals(0, new BigDecimal("12000.00").compareTo(balance("4200").subtract(feesBefore)));

        JournalEntry entry = ledgerService.findEntry(loan.getDisbursementEntryId()).orElseThrow();
        assertEquals("LOAN_DISBURSEMENT", entry.getSourceType());
        assertEquals(3, entry.getLines().size());

        // Disbursing twice is not possible
        assertTrue(loanService.disburse(OFFICER, loan.getId(), START).hasErrorKind(LedgerErrorKind.INVALID_STATUS));
    }

    @Test
    @DisplayName("Partial repayment pays interest first and leaves the installment PARTIAL")
    void testPartialRepayment() {
        Loan loan = activeLoan();
        BigDecimal interestBefore = balance("4100");
        BigDecimal receivableBefore = balance("1300");

        RepaymentReceipt receipt = repay(loan.getId(), "50000.00", START.plusMonths(1), null).getOrThrow();

        assertTrue(receipt.getReceiptNumber().startsWith("RC"));
        assertEquals(0, new BigDecimal("24000.00").compareTo(receipt.getInterestPortion()));
        assertEquals(0, new BigDecimal("26000.00").compareTo(receipt.getPrincipalPortion()));
        assertEquals(LoanStatus.ACTIVE, receipt.getLoanStatus());

        assertEquals(0, new BigDecimal("24000.00").compareTo(balance("4100").subtract(interestBefore)));
        assertEquals(0, new BigDecimal("-26000.00").compareTo(balance("1300").subtract(receivableBefore)));

        List<ScheduleEntry> schedule = loanService.getSchedule(loan.getId());
        assertEquals(ScheduleStatus.PARTIAL, schedule.get(0).getStatus());
        assertEquals(0, new BigDecimal("26000.00").compareTo(schedule.get(0).getPrincipalPaid()));
        assertEquals(ScheduleStatus.PENDING, schedule.get(1).getStatus());
        assertEquals(0, new BigDecimal("1311658.19").compareTo(loanService.getOutstanding(loan.getId())));
    }

    @Test
    @DisplayName("Reused payment reference is rejected and money moves once")
    void testDuplicatePaymentReference() {
        Loan loan = activeLoan();
        String reference = "MPESA-" + UUID.randomUUID();
        RepaymentReceipt first = repay(loan.getId(), "10000.00", START.plusMonths(1), reference).getOrThrow();
        BigDecimal interestAfterFirst = balance("4100");

        LedgerResult<RepaymentReceipt> second = repay(loan.getId(), "10000.00", START.plusMonths(1), reference);

        assertTrue(second.hasErrorKind(LedgerErrorKind.DUPLICATE_REFERENCE));
        assertEquals(first.getJournalEntryId(), second.getError().detail("existingEntryId"));
        assertEquals(0, interestAfterFirst.compareTo(balance("4100")));
        assertEquals(0, new BigDecimal("10000.00").compareTo(loanService.getSchedule(loan.getId()).get(0).getInterestPaid()));
    }

    @Test
    @DisplayName("Payment above the total outstanding is rejected")
    void testOverpayment() {
        Loan loan = activeLoan();

        LedgerResult<RepaymentReceipt> result = repay(loan.getId(), "1361658.20", START.plusMonths(1), null);

        assertTrue(result.hasErrorKind(LedgerErrorKind.OVERPAYMENT));
        assertEquals(0, new BigDecimal("1361658.19").compareTo((BigDecimal) result.getError().detail("outstanding")));
        assertTrue(loanService.getSchedule(loan.getId()).stream()
            .allMatch(entry -> entry.getStatus() == ScheduleStatus.PENDING));
    }

    @Test
    @DisplayName("Paying off everything closes the loan")
    void testFullPayoffClosesLoan() {
        Loan loan = activeLoan();

        RepaymentReceipt receipt = repay(loan.getId(), "1361658.19", START.plusMonths(2), null).getOrThrow();

        assertEquals(LoanStatus.CLOSED, receipt.getLoanStatus());
        assertEquals(0, new BigDecimal("1200000.00").compareTo(receipt.getPrincipalPortion()));
        assertEquals(0, new BigDecimal("161658.19").compareTo(receipt.getInterestPortion()));
        assertTrue(loanService.getSchedule(loan.getId()).stream()
            .allMatch(entry -> entry.getStatus() == ScheduleStatus.PAID && entry.getPaidDate() != null));
        assertEquals(LoanStatus.CLOSED, loanService.getLoan(loan.getId()).orElseThrow().getStatus());

        assertTrue(repay(loan.getId(), "1.00", START.plusMonths(2), null).hasErrorKind(LedgerErrorKind.INVALID_STATUS));
    }

    @Test
    @DisplayName("Repayment on an undisbursed loan is rejected")
    void testRepayPendingLoan() {
        Loan pending = loanService.createLoan(OFFICER, standardApplication().build()).getOrThrow();

        assertTrue(repay(pending.getId(), "100.00", START, null).hasErrorKind(LedgerErrorKind.INVALID_STATUS));
        assertTrue(repay(UUID.randomUUID(), "100.00", START, null).hasErrorKind(LedgerErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("Overdue installments flip the loan to OVERDUE until they are paid")
    void testOverdueLifecycle() {
        Loan loan = activeLoan();
        LocalDate today = START.plusMonths(3);

        // When: installments 1 and 2 are past due, 3 falls due today
        int marked = loanService.markOverdueInstallments(ActorIdentity.system(), loan.getId(), today).getOrThrow();

        assertEquals(2, marked);
        assertEquals(LoanStatus.OVERDUE, loanService.getLoan(loan.getId()).orElseThrow().getStatus());
        assertFalse(loanService.findLoansWithNewlyOverdueInstallments(today).contains(loan.getId()));

        // Marking again changes nothing
        assertEquals(0, loanService.markOverdueInstallments(ActorIdentity.system(), loan.getId(), today).getOrThrow());

        // A partial payment leaves the first installment OVERDUE
        repay(loan.getId(), "50000.00", today, null).getOrThrow();
        assertEquals(ScheduleStatus.OVERDUE, loanService.getSchedule(loan.getId()).get(0).getStatus());

        // Clearing both overdue installments brings the loan current
        RepaymentReceipt receipt = repay(loan.getId(), "176943.04", today, null).getOrThrow();
        List<ScheduleEntry> schedule = loanService.getSchedule(loan.getId());
        assertEquals(ScheduleStatus.PAID, schedule.get(0).getStatus());
        assertEquals(ScheduleStatus.PAID, schedule.get(1).getStatus());
        assertEquals(ScheduleStatus.PENDING, schedule.get(2).getStatus());
        assertEquals(LoanStatus.ACTIVE, receipt.getLoanStatus());
    }

    @Test
    @DisplayName("Repayment into a hard-closed month leaves loan and schedule untouched")
    void testRepaymentRollsBackWhenPeriodClosed() {
        Loan loan = activeLoan();
        assertTrue(ledgerService.closePeriod(ActorIdentity.of("controller", 5, null), 2018, 1,
            PeriodStatus.HARD_CLOSE, null).isSuccess());

        LedgerResult<RepaymentReceipt> result = repay(loan.getId(), "5000.00", LocalDate.of(2018, 1, 20), "LATE-" + UUID.randomUUID());

        assertTrue(result.hasErrorKind(LedgerErrorKind.PERIOD_CLOSED));
        ScheduleEntry first = loanService.getSchedule(loan.getId()).get(0);
        assertEquals(ScheduleStatus.PENDING, first.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(first.getInterestPaid()));
        assertEquals(0, new BigDecimal("1361658.19").compareTo(loanService.getOutstanding(loan.getId())));
    }
}
