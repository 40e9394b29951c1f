package com.flagship.lending_ledger.failure;

import com.flagship.lending_ledger.ledger.AccountService;
import com.flagship.lending_ledger.ledger.AccountType;
import com.flagship.lending_ledger.ledger.ActorIdentity;
import com.flagship.lending_ledger.ledger.JournalEntry;
import com.flagship.lending_ledger.ledger.JournalEntryRequest;
import com.flagship.lending_ledger.ledger.JournalPostingEngine;
import com.flagship.lending_ledger.ledger.LedgerErrorKind;
import com.flagship.lending_ledger.ledger.LedgerResult;
import com.flagship.lending_ledger.ledger.LedgerService;
import com.flagship.lending_ledger.ledger.LedgerTransactionRunner;
import com.flagship.lending_ledger.loan.Loan;
import com.flagship.lending_ledger.loan.LoanApplication;
import com.flagship.lending_ledger.loan.LoanService;
import com.flagship.lending_ledger.loan.RepaymentReceipt;
import com.flagship.lending_ledger.loan.RepaymentRequest;
import com.flagship.lending_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.when;

/**
 * The ledger stays consistent when its collaborators fail.
 *
 * Redis only caches external references; PostgreSQL holds the truth. A unit
 * that fails halfway leaves no entry, no balance change and no event behind.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class FailureScenarioTest {

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

    private static final String REFERENCE_KEY_PREFIX = "ledger:ref:";

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LedgerTransactionRunner transactionRunner;

    @Autowired
    private JournalPostingEngine postingEngine;

    @Autowired
    private LoanService loanService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private String cashCode;
    private String capitalCode;

    @BeforeEach
    void setUp() {
        reset(valueOperations);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        String suffix = UUID.randomUUID().toString().substring(0, 8);
        cashCode = "C-" + suffix;
        capitalCode = "E-" + suffix;
        accountService.createAccount(cashCode, "Test cash " + suffix, AccountType.ASSET);
        accountService.createAccount(capitalCode, "Test capital " + suffix, AccountType.EQUITY);
    }

    private JournalEntryRequest capital(String amount, String description, String externalReference) {
        return JournalEntryRequest.builder()
            .entryDate(LocalDate.of(2022, 5, 10))
            .description(description)
            .externalReference(externalReference)
            .line(JournalEntryRequest.Line.debit(cashCode, new BigDecimal(amount), "Cash"))
            .line(JournalEntryRequest.Line.credit(capitalCode, new BigDecimal(amount), "Capital"))
            .build();
    }

    private BigDecimal cashBalance() {
        return accountService.findByCode(cashCode).orElseThrow().getCurrentBalance();
    }

    private long entriesDescribed(String description) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries WHERE description = ?", Long.class, description);
        return count != null ? count : 0;
    }

    @Nested
    @DisplayName("1. Redis failure scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Duplicate references are still caught when Redis is down")
        void testRedisUnavailable_DatabaseFallback() {
            when(valueOperations.get(anyString()))
                .thenThrow(new RuntimeException("Redis connection refused"));
            doThrow(new RuntimeException("Redis connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any());
            String reference = "BANK-" + UUID.randomUUID();

            JournalEntry first = ledgerService.submit(ActorIdentity.system(),
                capital("100.00", "Redis down " + reference, reference), true).getOrThrow();
            LedgerResult<JournalEntry> second = ledgerService.submit(ActorIdentity.system(),
                capital("100.00", "Redis down " + reference, reference), true);

            assertTrue(second.hasErrorKind(LedgerErrorKind.DUPLICATE_REFERENCE));
            assertEquals(first.getId(), second.getError().detail("existingEntryId"));
            assertEquals(0, new BigDecimal("100.00").compareTo(cashBalance()));
        }

        @Test
        @DisplayName("1.2 A failed cache write does not affect the committed posting")
        void testRedisWriteFails_PostingCommits() {
            when(valueOperations.get(anyString())).thenReturn(null);
            doThrow(new RuntimeException("Redis write failed"))
                .when(valueOperations).set(anyString(), anyString(), any());
            String reference = "BANK-" + UUID.randomUUID();

            JournalEntry entry = ledgerService.submit(ActorIdentity.system(),
                capital("75.00", "Cache write " + reference, reference), true).getOrThrow();

            assertNotNull(ledgerService.findEntry(entry.getId()).orElseThrow().getPostedAt());
            assertEquals(0, new BigDecimal("75.00").compareTo(cashBalance()));
        }

        @Test
        @DisplayName("1.3 A cached reference answers the retry without touching the ledger")
        void testCachedReference_ShortCircuits() {
            String reference = "BANK-" + UUID.randomUUID();
            UUID cachedEntryId = UUID.randomUUID();
            when(valueOperations.get(REFERENCE_KEY_PREFIX + reference)).thenReturn(cachedEntryId.toString());

            LedgerResult<JournalEntry> result = ledgerService.submit(ActorIdentity.system(),
                capital("10.00", "Cached " + reference, reference), true);

            assertTrue(result.hasErrorKind(LedgerErrorKind.DUPLICATE_REFERENCE));
            assertEquals(cachedEntryId, result.getError().detail("existingEntryId"));
            assertEquals(0, entriesDescribed("Cached " + reference));
        }
    }

    @Nested
    @DisplayName("2. Database transaction scenarios")
    class TransactionFailureTests {

        @Test
        @DisplayName("2.1 A crash after posting rolls back the entry, the balances and the event")
        void testCrashAfterPosting_LeavesNoTrace() {
            String description = "Crash " + UUID.randomUUID();
            long unpublishedBefore = outboxService.countUnpublished();

            assertThrows(IllegalStateException.class, () -> transactionRunner.execute(ActorIdentity.system(), context -> {
                LedgerResult<JournalEntry> posted = postingEngine.submit(context, capital("500.00", description, null), true);
                assertTrue(posted.isSuccess());
                throw new IllegalStateException("Simulated crash after posting");
            }));

            assertEquals(0, entriesDescribed(description));
            assertEquals(0, BigDecimal.ZERO.compareTo(cashBalance()));
            assertEquals(unpublishedBefore, outboxService.countUnpublished());
        }

        @Test
        @DisplayName("2.2 A rejected second step rolls back the first")
        void testRejectedStep_RollsBackUnit() {
            String description = "Two steps " + UUID.randomUUID();

            LedgerResult<JournalEntry> result = transactionRunner.execute(ActorIdentity.system(), context -> {
                LedgerResult<JournalEntry> first = postingEngine.submit(context, capital("20.00", description, null), true);
                if (first.isFailure()) {
                    return first;
                }
                return postingEngine.submit(context, JournalEntryRequest.builder()
                    .entryDate(LocalDate.of(2022, 5, 10))
                    .description(description)
                    .line(JournalEntryRequest.Line.debit(cashCode, new BigDecimal("5.00"), "Cash"))
                    .line(JournalEntryRequest.Line.credit("9999", new BigDecimal("5.00"), "Unknown"))
                    .build(), true);
            });

            assertTrue(result.hasErrorKind(LedgerErrorKind.INVALID_ACCOUNT));
            assertEquals(0, entriesDescribed(description));
            assertEquals(0, BigDecimal.ZERO.compareTo(cashBalance()));
        }
    }

    @Nested
    @DisplayName("3. Double repayment protection")
    class DoubleRepaymentTests {

        @Test
        @DisplayName("3.1 Concurrent repayments with the same reference post once")
        void testConcurrentSameReference_OnlyOneSucceeds() throws InterruptedException {
            LocalDate start = LocalDate.of(2025, 2, 1);
            Loan pending = loanService.createLoan(ActorIdentity.system(), LoanApplication.builder()
                .customerId("CUST-" + UUID.randomUUID().toString().substring(0, 8))
                .principal(new BigDecimal("100000"))
                .annualRate(new BigDecimal("18"))
                .tenureMonths(6)
                .processingFee(BigDecimal.ZERO)
                .startDate(start)
                .build()).getOrThrow();
            Loan loan = loanService.disburse(ActorIdentity.system(), pending.getId(), start).getOrThrow();
            BigDecimal outstandingBefore = loanService.getOutstanding(loan.getId());
            String paymentReference = "MPESA-" + UUID.randomUUID();

            int threadCount = 4;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            List<LedgerResult<RepaymentReceipt>> results = new ArrayList<>();
            ExecutorService executor = Executors.newFixedThreadPool(threadCount);

            for (int i = 0; i < threadCount; i++) {
                executor.submit(() -> {
                    try {
                        startLatch.await();
                        LedgerResult<RepaymentReceipt> result = loanService.repay(ActorIdentity.system(),
                            RepaymentRequest.builder()
                                .loanId(loan.getId())
                                .amount(new BigDecimal("10000.00"))
                                .paymentDate(start.plusDays(20))
                                .paymentReference(paymentReference)
                                .build());
                        synchronized (results) {
                            results.add(result);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        doneLatch.countDown();
                    }
                });
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(threadCount, results.size());
            assertEquals(1, results.stream().filter(LedgerResult::isSuccess).count());
            assertEquals(threadCount - 1, results.stream()
                .filter(result -> result.hasErrorKind(LedgerErrorKind.DUPLICATE_REFERENCE))
                .count());
            assertEquals(0, new BigDecimal("10000.00").compareTo(
                outstandingBefore.subtract(loanService.getOutstanding(loan.getId()))));
        }
    }
}
