package com.flagship.lending_ledger.deposit;

import com.flagship.lending_ledger.ledger.AccountService;
import com.flagship.lending_ledger.ledger.ActorIdentity;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;
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
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fixed deposit lifecycle with its ledger effect: placement, accrual,
 * premature withdrawal with penalty, maturity pay-out and rollover.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class FixedDepositServiceTest {

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

    private static final ActorIdentity OFFICER = ActorIdentity.of("deposit-officer", 2, null);

    @Autowired
    private FixedDepositService fixedDepositService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private Clock clock;

    private LocalDate today;
    private String customerId;

    @BeforeEach
    void setUp() {
        today = LocalDate.now(clock);
        customerId = "CUST-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private FixedDeposit place(String principal, String rate, int tenureDays, LocalDate startDate,
                               MaturityInstruction instruction) {
        return fixedDepositService.create(OFFICER, FixedDepositApplication.builder()
            .customerId(customerId)
            .principal(new BigDecimal(principal))
            .annualRate(new BigDecimal(rate))
            .tenureDays(tenureDays)
            .startDate(startDate)
            .maturityInstruction(instruction)
            .build()).getOrThrow();
    }

    private BigDecimal balance(String code) {
        return accountService.findByCode(code).orElseThrow().getCurrentBalance();
    }

    @Test
    @DisplayName("Placement fixes the terms and credits the deposit liability")
    void testCreate() {
        BigDecimal cashBefore = balance("1100");
        BigDecimal liabilityBefore = balance("2200");

        FixedDeposit deposit = place("100000", "10", 365, today, MaturityInstruction.PAY_OUT);

        assertEquals(FixedDepositStatus.ACTIVE, deposit.getStatus());
        assertTrue(deposit.getCertificateNumber().startsWith("FD"));
        assertEquals(0, new BigDecimal("10000.00").compareTo(deposit.getInterestAmount()));
        assertEquals(0, new BigDecimal("110000.00").compareTo(deposit.getMaturityAmount()));
        assertEquals(today.plusDays(365), deposit.getMaturityDate());
        assertEquals(0, BigDecimal.ZERO.compareTo(deposit.getAccruedInterest()));

        assertEquals(0, new BigDecimal("100000.00").compareTo(balance("1100").subtract(cashBefore)));
        assertEquals(0, new BigDecimal("100000.00").compareTo(balance("2200").subtract(liabilityBefore)));
    }

    @Test
    @DisplayName("Invalid deposit terms are rejected")
    void testInvalidApplication() {
        FixedDepositApplication.FixedDepositApplicationBuilder valid = FixedDepositApplication.builder()
            .customerId(customerId)
            .principal(new BigDecimal("1000"))
            .annualRate(new BigDecimal("5"))
            .tenureDays(90);

        assertTrue(fixedDepositService.create(OFFICER, valid.principal(BigDecimal.ZERO).build())
            .hasErrorKind(LedgerErrorKind.INVALID_AMOUNT));
        assertTrue(fixedDepositService.create(OFFICER, valid.principal(new BigDecimal("1000")).tenureDays(0).build())
            .hasErrorKind(LedgerErrorKind.INVALID_AMOUNT));
        assertTrue(fixedDepositService.create(OFFICER, valid.tenureDays(90).annualRate(new BigDecimal("-1")).build())
            .hasErrorKind(LedgerErrorKind.INVALID_AMOUNT));
        assertTrue(fixedDepositService.accrueInterest(OFFICER, UUID.randomUUID(), today)
            .hasErrorKind(LedgerErrorKind.NOT_FOUND));
    }

    @Test
    @DisplayName("Accrual posts interest earned so far, and a repeated run posts nothing")
    void testAccrualIsIdempotent() {
        FixedDeposit deposit = place("100000", "10", 365, today.minusDays(10), MaturityInstruction.PAY_OUT);
        BigDecimal payableBefore = balance("2300");
        BigDecimal expenseBefore = balance("5220");

        BigDecimal first = fixedDepositService.accrueInterest(OFFICER, deposit.getId(), today).getOrThrow();
        BigDecimal second = fixedDepositService.accrueInterest(OFFICER, deposit.getId(), today).getOrThrow();

        assertEquals(0, new BigDecimal("273.97").compareTo(first));
        assertEquals(0, BigDecimal.ZERO.compareTo(second));
        FixedDeposit accrued = fixedDepositService.getDeposit(deposit.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("273.97").compareTo(accrued.getAccruedInterest()));
        assertEquals(today, accrued.getLastAccrualDate());
        assertEquals(0, new BigDecimal("273.97").compareTo(balance("2300").subtract(payableBefore)));
        assertEquals(0, new BigDecimal("273.97").compareTo(balance("5220").subtract(expenseBefore)));
        assertFalse(fixedDepositService.findDueForAccrual(today).contains(deposit.getId()));
    }

    @Test
    @DisplayName("Premature withdrawal pays interest for the days held less the penalty")
    void testPrematureWithdrawal() {
        FixedDeposit deposit = place("100000", "10", 365, today.minusDays(100), MaturityInstruction.PAY_OUT);
        BigDecimal cashBefore = balance("1100");
        BigDecimal liabilityBefore = balance("2200");

        PrematureWithdrawal withdrawal = fixedDepositService.withdrawPremature(OFFICER, deposit.getId(), "Customer request")
            .getOrThrow();

        assertEquals(100, withdrawal.getDaysHeld());
        assertEquals(0, new BigDecimal("2739.73").compareTo(withdrawal.getEarnedInterest()));
        assertEquals(0, new BigDecimal("2000.00").compareTo(withdrawal.getPenalty()));
        assertEquals(0, new BigDecimal("739.73").compareTo(withdrawal.getNetInterest()));
        assertEquals(0, new BigDecimal("100739.73").compareTo(withdrawal.getPayout()));
        assertNotNull(withdrawal.getJournalEntryId());

        assertEquals(0, new BigDecimal("-100739.73").compareTo(balance("1100").subtract(cashBefore)));
        assertEquals(0, new BigDecimal("-100000.00").compareTo(balance("2200").subtract(liabilityBefore)));

        FixedDeposit closed = fixedDepositService.getDeposit(deposit.getId()).orElseThrow();
        assertEquals(FixedDepositStatus.PREMATURE_CLOSED, closed.getStatus());
        assertEquals(0, new BigDecimal("100739.73").compareTo(closed.getAmountPaid()));
        assertNotNull(closed.getClosedAt());

        assertTrue(fixedDepositService.withdrawPremature(OFFICER, deposit.getId(), "Again")
            .hasErrorKind(LedgerErrorKind.INVALID_STATUS));
        assertTrue(fixedDepositService.accrueInterest(OFFICER, deposit.getId(), today)
            .hasErrorKind(LedgerErrorKind.INVALID_STATUS));
    }

    @Test
    @DisplayName("Premature withdrawal after the maturity date is refused")
    void testWithdrawalOfMaturedDeposit() {
        FixedDeposit deposit = place("5000", "8", 30, today.minusDays(30), MaturityInstruction.PAY_OUT);

        LedgerResult<PrematureWithdrawal> result = fixedDepositService.withdrawPremature(OFFICER, deposit.getId(), "Late");

        assertTrue(result.hasErrorKind(LedgerErrorKind.INVALID_STATUS));
        assertEquals(FixedDepositStatus.ACTIVE, fixedDepositService.getDeposit(deposit.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Maturity with pay-out instruction accrues to maturity, then pays principal and interest")
    void testMaturityPayOut() {
        FixedDeposit deposit = place("100000", "10", 30, today.minusDays(30), MaturityInstruction.PAY_OUT);
        BigDecimal cashBefore = balance("1100");
        BigDecimal payableBefore = balance("2300");

        assertTrue(fixedDepositService.payOut(OFFICER, deposit.getId()).hasErrorKind(LedgerErrorKind.INVALID_STATUS),
            "An active deposit must mature before pay-out");

        FixedDeposit matured = fixedDepositService.processMaturity(OFFICER, deposit.getId(), today).getOrThrow();
        assertEquals(FixedDepositStatus.MATURED, matured.getStatus());
        assertEquals(0, new BigDecimal("821.92").compareTo(matured.getAccruedInterest()));

        FixedDeposit paid = fixedDepositService.payOut(OFFICER, deposit.getId()).getOrThrow();
        assertEquals(FixedDepositStatus.PAID_OUT, paid.getStatus());
        assertEquals(0, new BigDecimal("100821.92").compareTo(paid.getAmountPaid()));
        assertEquals(0, new BigDecimal("-100821.92").compareTo(balance("1100").subtract(cashBefore)));
        assertEquals(0, payableBefore.compareTo(balance("2300")));

        assertTrue(fixedDepositService.payOut(OFFICER, deposit.getId()).hasErrorKind(LedgerErrorKind.INVALID_STATUS));
    }

    @Test
    @DisplayName("Maturity before the maturity date is refused")
    void testMaturityTooEarly() {
        FixedDeposit deposit = place("5000", "8", 90, today, MaturityInstruction.PAY_OUT);

        assertTrue(fixedDepositService.processMaturity(OFFICER, deposit.getId(), today)
            .hasErrorKind(LedgerErrorKind.INVALID_STATUS));
        assertFalse(fixedDepositService.findMaturedBy(today).contains(deposit.getId()));
    }

    @Test
    @DisplayName("Rollover capitalises interest into a new deposit on the same terms")
    void testRollover() {
        FixedDeposit deposit = place("50000", "12", 30, today.minusDays(30),
            MaturityInstruction.ROLLOVER_PRINCIPAL_AND_INTEREST);
        BigDecimal cashBefore = balance("1100");
        BigDecimal liabilityBefore = balance("2200");

        FixedDeposit rolled = fixedDepositService.processMaturity(OFFICER, deposit.getId(), today).getOrThrow();

        assertEquals(FixedDepositStatus.ROLLED_OVER, rolled.getStatus());
        assertNotNull(rolled.getRolledOverToId());

        FixedDeposit successor = fixedDepositService.getDeposit(rolled.getRolledOverToId()).orElseThrow();
        assertEquals(FixedDepositStatus.ACTIVE, successor.getStatus());
        assertEquals(0, new BigDecimal("50493.15").compareTo(successor.getPrincipalAmount()));
        assertEquals(deposit.getMaturityDate(), successor.getStartDate());
        assertEquals(30, successor.getTenureDays());
        assertEquals(customerId, successor.getCustomerId());
        assertEquals(MaturityInstruction.ROLLOVER_PRINCIPAL_AND_INTEREST, successor.getMaturityInstruction());

        // No cash moves; the liability grows by the capitalised interest
        assertEquals(0, cashBefore.compareTo(balance("1100")));
        assertEquals(0, new BigDecimal("493.15").compareTo(balance("2200").subtract(liabilityBefore)));
    }
}
