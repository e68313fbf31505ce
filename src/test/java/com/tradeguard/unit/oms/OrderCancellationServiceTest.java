package com.tradeguard.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
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
import com.tradeguard.config.KillSwitchProperties;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.model.Order;
import com.tradeguard.event.RiskEvent;
import com.tradeguard.event.RiskEventType;
import com.tradeguard.event.RiskLevel;
import com.tradeguard.oms.CancelAllReport;
import com.tradeguard.oms.ExecutionVenue;
import com.tradeguard.oms.OrderCancellationService;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Unit tests for OrderCancellationService. */
@ExtendWith(MockitoExtension.class)
class OrderCancellationServiceTest {

    @Mock
    private ExecutionVenue executionVenue;

    @Mock
    private AuditLog auditLog;

    @Mock
    private AnomalyMonitor anomalyMonitor;

    private OrderCancellationService service;

    @BeforeEach
    void setUp() {
        KillSwitchProperties properties = new KillSwitchProperties();
        properties.setCancelDeadlineMs(100);
        service = new OrderCancellationService(executionVenue, auditLog, anomalyMonitor, properties);
    }

    private static Order open(String id) {
        return Order.builder().id(id).intentId("i-" + id).status(OrderStatus.PARTIALLY_FILLED).build();
    }

    @Test
    @DisplayName("Single cancel confirmed by the venue returns true")
    void singleCancel_confirmed() {
        when(executionVenue.requestCancel("o-1")).thenReturn(CompletableFuture.completedFuture(true));

        assertThat(service.cancel("o-1")).isTrue();
        verify(anomalyMonitor, never()).reportFatal(any(), anyString(), anyDouble(), anyString());
    }

    @Test
    @DisplayName("Single cancel the venue never confirms returns false at the deadline and raises CANCEL_TIMEOUT")
    void singleCancel_unconfirmed_boundedByDeadline() {
        when(executionVenue.requestCancel("o-1")).thenReturn(new CompletableFuture<>());

        boolean canceled = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> service.cancel("o-1"));

        assertThat(canceled).isFalse();
        verify(anomalyMonitor).reportFatal(eq(AnomalyType.CANCEL_TIMEOUT), eq("o-1"), eq(1.0), anyString());
    }

    @Test
    @DisplayName("All cancels confirmed in time: audited, no anomaly")
    void allConfirmed_complete() {
        when(executionVenue.openOrders()).thenReturn(List.of(open("o-1"), open("o-2")));
        when(executionVenue.requestCancel("o-1")).thenReturn(CompletableFuture.completedFuture(true));
        when(executionVenue.requestCancel("o-2")).thenReturn(CompletableFuture.completedFuture(false));

        CancelAllReport report = service.cancelAll("test");

        assertThat(report.isComplete()).isTrue();
        assertThat(report.getRequested()).isEqualTo(2);
        assertThat(report.getCanceled()).isEqualTo(1);
        assertThat(report.getFinishedOtherwise()).isEqualTo(1);
        verify(auditLog).append(AuditEventType.CANCEL_ALL, report);
        verify(anomalyMonitor, never()).reportFatal(eq(AnomalyType.CANCEL_TIMEOUT), anyString(), anyDouble(), anyString());
    }

    @Test
    @DisplayName("Cancel not confirmed by the deadline raises CANCEL_TIMEOUT")
    void unconfirmedCancel_raisesFatalAnomaly() {
        when(executionVenue.openOrders()).thenReturn(List.of(open("o-1"), open("o-2")));
        when(executionVenue.requestCancel("o-1")).thenReturn(CompletableFuture.completedFuture(true));
        when(executionVenue.requestCancel("o-2")).thenReturn(new CompletableFuture<>());

        CancelAllReport report = service.cancelAll("test");

        assertThat(report.isComplete()).isFalse();
        assertThat(report.getUnconfirmedOrderIds()).containsExactly("o-2");
        verify(auditLog).append(AuditEventType.CANCEL_ALL, report);
        verify(anomalyMonitor).reportFatal(eq(AnomalyType.CANCEL_TIMEOUT), eq("cancel-all"), eq(1.0), anyString());
    }

    @Test
    @DisplayName("Failed cancel request counts as unconfirmed")
    void failedCancel_unconfirmed() {
        when(executionVenue.openOrders()).thenReturn(List.of(open("o-1")));
        when(executionVenue.requestCancel("o-1"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("venue unreachable")));

        CancelAllReport report = service.cancelAll("test");

        assertThat(report.getUnconfirmedOrderIds()).containsExactly("o-1");
    }

    @Test
    @DisplayName("Only KILL_SWITCH_TRIPPED triggers a sweep")
    void otherRiskEvents_ignored() {
        service.onRiskEvent(new RiskEvent(this, RiskEventType.TRADE_LIMIT_BREACH, RiskLevel.WARNING, "limit"));

        verifyNoInteractions(executionVenue, auditLog);
    }

    @Test
    @DisplayName("Trip with nothing open still audits an empty sweep")
    void tripWithNoOpenOrders_auditsEmptySweep() {
        when(executionVenue.openOrders()).thenReturn(List.of());

        service.onRiskEvent(new RiskEvent(this, RiskEventType.KILL_SWITCH_TRIPPED, RiskLevel.CRITICAL, "MANUAL"));

        verify(auditLog).append(eq(AuditEventType.CANCEL_ALL), any());
    }
}
