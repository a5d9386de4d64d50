package com.flagship.escrow_ledger.failure;

import com.flagship.escrow_ledger.escrow.AllocationStatus;
import com.flagship.escrow_ledger.escrow.EscrowPayment;
import com.flagship.escrow_ledger.escrow.EscrowService;
import com.flagship.escrow_ledger.escrow.SellerShare;
import com.flagship.escrow_ledger.exception.InvalidArgumentException;
import com.flagship.escrow_ledger.ledger.EscrowLedgerService;
import com.flagship.escrow_ledger.outbox.OutboxEvent;
import com.flagship.escrow_ledger.outbox.OutboxService;
import com.flagship.escrow_ledger.settlement.PeriodCloseResult;
import com.flagship.escrow_ledger.settlement.Settlement;
import com.flagship.escrow_ledger.settlement.SettlementExport;
import com.flagship.escrow_ledger.settlement.SettlementService;
import com.flagship.escrow_ledger.settlement.SettlementStatus;
import com.flagship.escrow_ledger.settlement.SettlementSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Failure scenarios for escrow and settlement.
 *
 * Invariants checked:
 * 1. Released plus refunded never exceeds what an allocation holds
 * 2. An order is escrowed once, whatever Redis does
 * 3. Every committed state change has its ledger entry and outbox event
 * 4. A period is settled once per store
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class FailureScenarioTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("escrow_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private EscrowService escrowService;

    @Autowired
    private EscrowLedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private SettlementService settlementService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    @MockBean
    private Clock clock;

    private YearMonth currentMonth;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        // Movements are written now; settle them as if the month had already ended
        currentMonth = YearMonth.now(ZoneOffset.UTC);
        when(clock.instant()).thenReturn(afterMonthEnds());
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
    }

    private Instant afterMonthEnds() {
        return Settlement.periodEnd(currentMonth.getYear(), currentMonth.getMonthValue()).plusSeconds(3600);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSection(String sectionName) {
        System.out.println("\n--- " + sectionName + " ---");
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private EscrowPayment escrow(UUID orderId, UUID storeId, String amount) {
        SellerShare share = new SellerShare(storeId, UUID.randomUUID(), new BigDecimal(amount), BigDecimal.ZERO,
            new BigDecimal("10"));
        return escrowService.onOrderPaymentConfirmed(orderId, "ORD-" + orderId.toString().substring(0, 8),
            UUID.randomUUID(), new BigDecimal(amount), "USD", "txn-" + orderId, List.of(share), "test");
    }

    @Nested
    @DisplayName("1. Redis Failure Scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Escrow creation works and stays idempotent when Redis is down")
        void testRedisUnavailable_DatabaseFallback() {
            printTestHeader("Redis Completely Unavailable");

            when(valueOperations.get(anyString())).thenThrow(new IllegalStateException("Redis connection refused"));
            doThrow(new IllegalStateException("Redis connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any());

            UUID orderId = UUID.randomUUID();
            EscrowPayment first = escrow(orderId, UUID.randomUUID(), "80.00");
            EscrowPayment second = escrow(orderId, UUID.randomUUID(), "80.00");

            printSection("Result");
            System.out.println("First: " + first.getId() + ", second: " + second.getId());

            assertEquals(first.getId(), second.getId());
            assertEquals(2, ledgerService.countByEscrowPaymentId(first.getId()),
                "Replay must not append ledger entries");

            printSuccess("Order escrowed once via the order_id lookup");
        }

        @Test
        @DisplayName("1.2 A stale Redis entry does not block escrow creation")
        void testStaleRedisEntry() {
            printTestHeader("Stale Redis Entry");

            when(valueOperations.get(anyString())).thenReturn(UUID.randomUUID().toString());

            UUID orderId = UUID.randomUUID();
            EscrowPayment payment = escrow(orderId, UUID.randomUUID(), "15.00");

            assertEquals(orderId, payment.getOrderId());
            assertTrue(escrowService.findByOrderId(orderId).isPresent());

            printSuccess("Unknown cached ID ignored, escrow created from the database state");
        }
    }

    @Nested
    @DisplayName("2. Concurrency Scenarios")
    class ConcurrencyTests {

        @Test
        @DisplayName("2.1 Concurrent full releases of one allocation: exactly one succeeds")
        void testConcurrentFullRelease_OnlyOneSucceeds() throws Exception {
            printTestHeader("Concurrent Full Releases");

            EscrowPayment payment = escrow(UUID.randomUUID(), UUID.randomUUID(), "50.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);

            int threads = 5;
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            for (int i = 0; i < threads; i++) {
                String reference = "payout-" + i;
                executor.submit(() -> {
                    try {
                        start.await();
                        escrowService.requestRelease(allocationId, null, reference);
                        succeeded.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (RuntimeException e) {
                        System.out.println("Rejected: " + e.getClass().getSimpleName() + " " + e.getMessage());
                        rejected.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            EscrowPayment after = escrowService.getEscrowPayment(payment.getId());

            printSection("Result");
            System.out.println("Succeeded: " + succeeded.get() + ", rejected: " + rejected.get());
            System.out.println("Released: " + after.getReleasedAmount());

            assertEquals(1, succeeded.get());
            assertEquals(threads - 1, rejected.get());
            assertEquals(0, new BigDecimal("50.00").compareTo(after.getReleasedAmount().getAmount()));
            assertEquals(AllocationStatus.RELEASED, after.getAllocation(allocationId).getStatus());
            assertTrue(escrowService.reconcile(payment.getId()).isConsistent());

            printSuccess("Funds released once, ledger reconciles");
        }

        @Test
        @DisplayName("2.2 Concurrent confirmations of one order create one escrow payment")
        void testConcurrentCreation_SingleEscrow() throws Exception {
            printTestHeader("Concurrent Order Confirmations");

            UUID orderId = UUID.randomUUID();
            UUID storeId = UUID.randomUUID();
            int threads = 5;
            Set<UUID> ids = ConcurrentHashMap.newKeySet();
            AtomicInteger failures = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        ids.add(escrow(orderId, storeId, "42.00").getId());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (RuntimeException e) {
                        failures.incrementAndGet();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            executor.shutdown();

            System.out.println("Distinct escrow IDs: " + ids + ", failures: " + failures.get());

            assertEquals(1, ids.size());
            assertEquals(0, failures.get());

            printSuccess("One escrow payment per order");
        }
    }

    @Nested
    @DisplayName("3. Atomicity Scenarios")
    class AtomicityTests {

        @Test
        @DisplayName("3.1 Rejected release leaves balance, ledger and outbox unchanged")
        void testRejectedRelease_NoPartialState() {
            printTestHeader("Rejected Release - No Partial State");

            EscrowPayment payment = escrow(UUID.randomUUID(), UUID.randomUUID(), "30.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);

            long ledgerBefore = ledgerService.countByEscrowPaymentId(payment.getId());
            int eventsBefore = outboxService.getEventsForAggregate(EscrowService.AGGREGATE_TYPE, payment.getId()).size();

            assertThrows(IllegalArgumentException.class,
                () -> escrowService.requestRelease(allocationId, new BigDecimal("30.01"), "too-much"));

            EscrowPayment after = escrowService.getEscrowPayment(payment.getId());
            assertEquals(ledgerBefore, ledgerService.countByEscrowPaymentId(payment.getId()));
            assertEquals(eventsBefore,
                outboxService.getEventsForAggregate(EscrowService.AGGREGATE_TYPE, payment.getId()).size());
            assertEquals(0, new BigDecimal("30.00").compareTo(after.getRemainingBalance().getAmount()));

            printSuccess("Nothing committed for the rejected release");
        }

        @Test
        @DisplayName("3.2 Every committed change has a ledger entry and an outbox event")
        void testLedgerAndOutboxMatchChanges() {
            printTestHeader("Ledger and Outbox Match Committed Changes");

            EscrowPayment payment = escrow(UUID.randomUUID(), UUID.randomUUID(), "60.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);
            escrowService.requestRelease(allocationId, new BigDecimal("20.00"), "payout-1");
            escrowService.requestRefund(allocationId, new BigDecimal("40.00"), "refund-1");

            List<OutboxEvent> events = outboxService.getEventsForAggregate(EscrowService.AGGREGATE_TYPE, payment.getId());
            events.forEach(e -> System.out.println("  - " + e.getEventType()));

            // created + allocation + eligible + release + refund
            assertEquals(5, ledgerService.countByEscrowPaymentId(payment.getId()));
            // created + eligible + released + refunded
            assertEquals(4, events.size());
            assertTrue(escrowService.reconcile(payment.getId()).isConsistent());

            printSuccess("Ledger, outbox and stored totals agree");
        }

        @Test
        @DisplayName("3.3 Cancelling an order refunds what is still held in one step")
        void testOrderCancelled_RemainderRefunded() {
            printTestHeader("Order Cancelled After Partial Release");

            UUID orderId = UUID.randomUUID();
            EscrowPayment payment = escrow(orderId, UUID.randomUUID(), "60.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);
            escrowService.requestRelease(allocationId, new BigDecimal("20.00"), "payout-1");

            EscrowPayment refunded = escrowService.refundOrder(orderId, "re-cancel-1", "test");
            EscrowPayment again = escrowService.refundOrder(orderId, "re-cancel-1", "test");

            assertEquals(AllocationStatus.REFUNDED, refunded.getAllocation(allocationId).getStatus());
            assertEquals(0, new BigDecimal("40.00").compareTo(refunded.getRefundedAmount().getAmount()));
            assertTrue(again.getRemainingBalance().isZero());
            // created + allocation + eligible + release + refund
            assertEquals(5, ledgerService.countByEscrowPaymentId(payment.getId()));
            assertTrue(escrowService.reconcile(payment.getId()).isConsistent());

            printSuccess("Remaining 40.00 refunded once, ledger consistent");
        }
    }

    @Nested
    @DisplayName("4. Settlement Scenarios")
    class SettlementTests {

        @Test
        @DisplayName("4.1 Closing a period twice returns the same settlement")
        void testDoubleClose_ReturnsExisting() {
            printTestHeader("Double Period Close");

            UUID storeId = UUID.randomUUID();
            EscrowPayment payment = escrow(UUID.randomUUID(), storeId, "100.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);
            escrowService.requestRelease(allocationId, null, "payout-1");

            PeriodCloseResult first = settlementService.closeSettlementPeriod(storeId, currentMonth.getYear(),
                currentMonth.getMonthValue());
            PeriodCloseResult second = settlementService.closeSettlementPeriod(storeId, currentMonth.getYear(),
                currentMonth.getMonthValue());

            Settlement settlement = first.getSettlement();
            System.out.println("Settlement: " + settlement.getSettlementNumber() + " net " + settlement.getItemsNet());

            assertEquals(PeriodCloseResult.Outcome.CLOSED, first.getOutcome());
            assertEquals(PeriodCloseResult.Outcome.ALREADY_CLOSED, second.getOutcome());
            assertEquals(settlement.getId(), second.getSettlement().getId());
            assertEquals(0, new BigDecimal("100.00").compareTo(settlement.getGrossSales().getAmount()));
            assertEquals(0, new BigDecimal("10.00").compareTo(settlement.getTotalCommission().getAmount()));
            assertEquals(0, new BigDecimal("90.00").compareTo(settlement.getItemsNet().getAmount()));

            printSuccess("Period settled once");
        }

        @Test
        @DisplayName("4.2 A store without movements is skipped")
        void testNoMovements_NoSettlement() {
            printTestHeader("Period Without Movements");

            PeriodCloseResult result = settlementService.closeSettlementPeriod(UUID.randomUUID(),
                currentMonth.getYear(), currentMonth.getMonthValue());

            assertEquals(PeriodCloseResult.Outcome.NO_DATA, result.getOutcome());
            assertTrue(result.getSettlementIfPresent().isEmpty());

            printSuccess("No settlement for a store without activity");
        }

        @Test
        @DisplayName("4.3 The running month cannot be closed and later releases are settled")
        void testRunningMonth_RejectedThenSettledInFull() {
            printTestHeader("Close Attempt Before Month End");

            UUID storeId = UUID.randomUUID();
            EscrowPayment payment = escrow(UUID.randomUUID(), storeId, "100.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);
            escrowService.requestRelease(allocationId, new BigDecimal("40.00"), "payout-1");

            printSection("Close while the month is running");
            when(clock.instant()).thenReturn(Instant.now());
            assertThrows(InvalidArgumentException.class, () -> settlementService.closeSettlementPeriod(
                storeId, currentMonth.getYear(), currentMonth.getMonthValue()));
            printSuccess("Close rejected before the period ended");

            printSection("Release the rest later in the same month");
            escrowService.requestRelease(allocationId, new BigDecimal("60.00"), "payout-2");

            printSection("Close after the month ended");
            when(clock.instant()).thenReturn(afterMonthEnds());
            Settlement settlement = settlementService.closeSettlementPeriod(
                storeId, currentMonth.getYear(), currentMonth.getMonthValue()).getSettlement();
            System.out.println("Settlement: " + settlement.getSettlementNumber() + " net " + settlement.getItemsNet());

            assertEquals(0, new BigDecimal("100.00").compareTo(settlement.getGrossSales().getAmount()));
            assertEquals(0, new BigDecimal("90.00").compareTo(settlement.getItemsNet().getAmount()));

            printSuccess("Both releases reached the statement");
        }

        @Test
        @DisplayName("4.4 Stores sharing an ID prefix are settled independently")
        void testSharedStorePrefix_BothSettle() {
            printTestHeader("Settlement Number Per Store");

            String suffix = UUID.randomUUID().toString().substring(8);
            UUID firstStore = UUID.fromString("abcd0000" + suffix);
            UUID secondStore = UUID.fromString("abcd9999" + suffix);

            for (UUID storeId : List.of(firstStore, secondStore)) {
                EscrowPayment payment = escrow(UUID.randomUUID(), storeId, "50.00");
                UUID allocationId = payment.getAllocations().get(0).getId();
                escrowService.onShipmentDelivered(allocationId);
                escrowService.requestRelease(allocationId, null, "payout-" + storeId);
            }

            PeriodCloseResult first = settlementService.closeSettlementPeriod(
                firstStore, currentMonth.getYear(), currentMonth.getMonthValue());
            PeriodCloseResult second = settlementService.closeSettlementPeriod(
                secondStore, currentMonth.getYear(), currentMonth.getMonthValue());
            System.out.println("Numbers: " + first.getSettlement().getSettlementNumber()
                + ", " + second.getSettlement().getSettlementNumber());

            assertEquals(PeriodCloseResult.Outcome.CLOSED, first.getOutcome());
            assertEquals(PeriodCloseResult.Outcome.CLOSED, second.getOutcome());
            assertNotEquals(first.getSettlement().getSettlementNumber(), second.getSettlement().getSettlementNumber());

            printSuccess("Both stores settled for the same month");
        }

        @Test
        @DisplayName("4.5 Export rows and the period summary reflect approval and export")
        void testExportAndSummary() {
            printTestHeader("Settlement Export and Period Summary");

            int year = currentMonth.getYear();
            int month = currentMonth.getMonthValue();
            SettlementSummary before = settlementService.getSummary(year, month);

            UUID storeId = UUID.randomUUID();
            EscrowPayment payment = escrow(UUID.randomUUID(), storeId, "80.00");
            UUID allocationId = payment.getAllocations().get(0).getId();
            escrowService.onShipmentDelivered(allocationId);
            escrowService.requestRelease(allocationId, null, "payout-1");
            Settlement settlement = settlementService.closeSettlementPeriod(storeId, year, month).getSettlement();
            settlementService.approve(settlement.getId(), "finance");

            printSection("Export rows");
            SettlementExport export = settlementService.getExport(settlement.getId());
            assertEquals(SettlementStatus.APPROVED, export.getStatus());
            assertEquals(1, export.getLines().size());
            assertEquals(payment.getOrderNumber(), export.getLines().get(0).getOrderNumber());
            assertEquals(0, new BigDecimal("72.00").compareTo(export.getNetPayable().getAmount()));
            settlementService.markExported(settlement.getId());

            printSection("Period summary");
            SettlementSummary after = settlementService.getSummary(year, month);
            System.out.println("Summary: " + after);
            assertEquals(before.getTotalSettlements() + 1, after.getTotalSettlements());
            assertEquals(before.getCount(SettlementStatus.EXPORTED) + 1, after.getCount(SettlementStatus.EXPORTED));
            BigDecimal usdBefore = before.getNetPayableByCurrency().containsKey("USD")
                ? before.getNetPayableByCurrency().get("USD").getAmount()
                : BigDecimal.ZERO;
            assertEquals(0, usdBefore.add(new BigDecimal("72.00"))
                .compareTo(after.getNetPayableByCurrency().get("USD").getAmount()));

            printSuccess("Export and summary agree with the settlement");
        }
    }
}
