package com.tradeguard.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.AuditProperties;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.DiscrepancyType;
import com.tradeguard.domain.enums.OrderSide;
import com.tradeguard.domain.model.Discrepancy;
import com.tradeguard.domain.model.ExternalTrade;
import com.tradeguard.domain.model.ReconciliationReport;
import com.tradeguard.entity.FillEntity;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.reconciliation.ExternalTradeSource;
import com.tradeguard.reconciliation.TradeReconciliationService;
import com.tradeguard.repository.jpa.FillJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

/** Unit tests for TradeReconciliationService. */
@ExtendWith(MockitoExtension.class)
class TradeReconciliationServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");
    private static final Instant DAY_START = Instant.parse("2026-03-02T00:00:00Z");

    @Mock
    private FillJpaRepository fillJpaRepository;

    @Mock
    private AuditLog auditLog;

    @Mock
    private AnomalyMonitor anomalyMonitor;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private ObjectProvider<ExternalTradeSource> externalTradeSource;

    @Mock
    private ExternalTradeSource source;

    private TradeReconciliationService service;

    @BeforeEach
    void setUp() {
        service = new TradeReconciliationService(
                fillJpaRepository,
                auditLog,
                anomalyMonitor,
                eventPublisherHelper,
                new AuditProperties(),
                externalTradeSource,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static FillEntity fill(String id, OrderSide side, String price, String quantity) {
        return FillEntity.builder()
                .id(id)
                .orderId("o-1")
                .symbol("BTCUSDT")
                .side(side)
                .price(new BigDecimal(price))
                .quantity(new BigDecimal(quantity))
                .timestamp(NOW.minusSeconds(60))
                .build();
    }

    private static ExternalTrade trade(String id, OrderSide side, String price, String quantity) {
        return ExternalTrade.builder()
                .tradeId(id)
                .symbol("BTCUSDT")
                .side(side)
                .price(new BigDecimal(price))
                .quantity(new BigDecimal(quantity))
                .timestamp(NOW.minusSeconds(60))
                .build();
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("Identical records pass within tolerance")
        void identicalRecords_pass() {
            when(fillJpaRepository.findByTimestampGreaterThanEqualOrderByTimestampAsc(DAY_START))
                    .thenReturn(List.of(fill("t-1", OrderSide.BUY, "100.00", "1.0"), fill("t-2", OrderSide.SELL, "101", "0.5")));

            ReconciliationReport report = service.reconcile(
                    List.of(trade("t-1", OrderSide.BUY, "100.005", "1.00005"), trade("t-2", OrderSide.SELL, "101", "0.5")),
                    null,
                    true);

            assertThat(report.passed()).isTrue();
            assertThat(report.getMatchedCount()).isEqualTo(2);
            assertThat(report.getSince()).isEqualTo(DAY_START);
            verify(auditLog).append(AuditEventType.RECONCILIATION, report);
            verify(eventPublisherHelper).publishReconciliation(service, report, true);
            verify(anomalyMonitor, never()).reportFatal(any(), anyString(), anyDouble(), anyString());
        }

        @Test
        @DisplayName("Every kind of discrepancy is reported and raises RECONCILIATION_FAIL")
        void discrepancies_reportedAndFatal() {
            when(fillJpaRepository.findByTimestampGreaterThanEqualOrderByTimestampAsc(DAY_START)).thenReturn(List.of(
                    fill("t-1", OrderSide.BUY, "100", "1"),
                    fill("t-2", OrderSide.BUY, "100", "1"),
                    fill("t-3", OrderSide.BUY, "100", "1")));

            ReconciliationReport report = service.reconcile(
                    List.of(
                            trade("t-1", OrderSide.BUY, "100.02", "1"),
                            trade("t-2", OrderSide.SELL, "100", "1.001"),
                            trade("t-9", OrderSide.BUY, "100", "1")),
                    null,
                    false);

            assertThat(report.passed()).isFalse();
            assertThat(report.getMatchedCount()).isZero();
            assertThat(report.getDiscrepancies()).extracting(Discrepancy::getTradeId, Discrepancy::getType)
                    .containsExactly(
                            tuple("t-1", DiscrepancyType.PRICE_MISMATCH),
                            tuple("t-2", DiscrepancyType.SIDE_MISMATCH),
                            tuple("t-2", DiscrepancyType.QUANTITY_MISMATCH),
                            tuple("t-3", DiscrepancyType.MISSING_EXTERNAL),
                            tuple("t-9", DiscrepancyType.UNKNOWN_EXTERNAL));
            verify(anomalyMonitor).reportFatal(
                    eq(AnomalyType.RECONCILIATION_FAIL), eq("reconciliation"), eq(5.0), anyString());
        }

        @Test
        @DisplayName("External trades before the window are ignored")
        void externalBeforeWindow_ignored() {
            when(fillJpaRepository.findByTimestampGreaterThanEqualOrderByTimestampAsc(DAY_START)).thenReturn(List.of());
            ExternalTrade yesterday = ExternalTrade.builder()
                    .tradeId("old")
                    .symbol("BTCUSDT")
                    .side(OrderSide.BUY)
                    .price(BigDecimal.ONE)
                    .quantity(BigDecimal.ONE)
                    .timestamp(DAY_START.minusSeconds(1))
                    .build();

            ReconciliationReport report = service.reconcile(List.of(yesterday), null, true);

            assertThat(report.passed()).isTrue();
            assertThat(report.getExternalCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Scheduled Run")
    class ScheduledRun {

        @Test
        @DisplayName("Without a trade source the scheduled run does nothing")
        void noSource_skipped() {
            when(externalTradeSource.getIfAvailable()).thenReturn(null);

            service.scheduledReconciliation();

            verifyNoInteractions(fillJpaRepository, auditLog);
        }

        @Test
        @DisplayName("Scheduled run reconciles the day's venue trades")
        void withSource_reconcilesToday() {
            when(externalTradeSource.getIfAvailable()).thenReturn(source);
            when(source.tradesSince(DAY_START)).thenReturn(List.of(trade("t-1", OrderSide.BUY, "100", "1")));
            when(fillJpaRepository.findByTimestampGreaterThanEqualOrderByTimestampAsc(DAY_START))
                    .thenReturn(List.of(fill("t-1", OrderSide.BUY, "100", "1")));

            service.scheduledReconciliation();

            verify(eventPublisherHelper).publishReconciliation(eq(service), any(ReconciliationReport.class), eq(false));
        }

        @Test
        @DisplayName("A failing trade source skips the run")
        void failingSource_skipped() {
            when(externalTradeSource.getIfAvailable()).thenReturn(source);
            when(source.tradesSince(DAY_START)).thenThrow(new IllegalStateException("venue offline"));

            service.scheduledReconciliation();

            verifyNoInteractions(auditLog, anomalyMonitor);
        }
    }
}
