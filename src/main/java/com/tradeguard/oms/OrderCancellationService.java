package com.tradeguard.oms;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.KillSwitchProperties;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.model.Order;
import com.tradeguard.event.RiskEvent;
import com.tradeguard.event.RiskEventType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Cancels open orders: one on request, or all of them when the kill switch trips.
 *
 * <p>Cancels are requested in parallel and awaited together for at most
 * {@code tradeguard.kill-switch.cancel-deadline-ms}. Orders whose cancellation was not
 * confirmed in time are reported as a fatal CANCEL_TIMEOUT anomaly. Every sweep is audited
 * as CANCEL_ALL.
 */
@Service
public class OrderCancellationService {

    private static final Logger log = LoggerFactory.getLogger(OrderCancellationService.class);

    private final ExecutionVenue executionVenue;
    private final AuditLog auditLog;
    private final AnomalyMonitor anomalyMonitor;
    private final KillSwitchProperties properties;

    public OrderCancellationService(
            ExecutionVenue executionVenue,
            AuditLog auditLog,
            AnomalyMonitor anomalyMonitor,
            KillSwitchProperties properties) {
        this.executionVenue = executionVenue;
        this.auditLog = auditLog;
        this.anomalyMonitor = anomalyMonitor;
        this.properties = properties;
    }

    @Async("eventExecutor")
    @EventListener
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() != RiskEventType.KILL_SWITCH_TRIPPED) {
            return;
        }
        cancelAll("kill switch: " + event.getMessage());
    }

    /**
     * Cancels one order and waits up to the cancel deadline for the venue to confirm.
     *
     * @return true when the order ended CANCELED; false when it ended otherwise, is not open,
     *         or was not confirmed in time (reported as a fatal CANCEL_TIMEOUT anomaly)
     */
    public boolean cancel(String orderId) {
        CompletableFuture<Boolean> future = executionVenue.requestCancel(orderId);
        try {
            boolean canceled = future.get(properties.getCancelDeadlineMs(), TimeUnit.MILLISECONDS);
            log.info("Cancel of order {}: {}", orderId, canceled ? "canceled" : "already finished or not open");
            return canceled;
        } catch (TimeoutException e) {
            log.error("Cancel of order {} not confirmed within {}ms", orderId, properties.getCancelDeadlineMs());
            anomalyMonitor.reportFatal(
                    AnomalyType.CANCEL_TIMEOUT,
                    orderId,
                    1,
                    "cancel not confirmed after " + properties.getCancelDeadlineMs() + "ms");
            return false;
        } catch (ExecutionException e) {
            log.error("Cancel of order {} failed: {}", orderId,
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while canceling order {}", orderId);
            return false;
        }
    }

    /** Requests cancellation of every open order and waits up to the cancel deadline. */
    public CancelAllReport cancelAll(String trigger) {
        long startNanos = System.nanoTime();
        List<Order> open = executionVenue.openOrders();
        log.warn("Canceling {} open orders ({})", open.size(), trigger);

        Map<String, CompletableFuture<Boolean>> futures = new LinkedHashMap<>();
        for (Order order : open) {
            futures.put(order.getId(), executionVenue.requestCancel(order.getId()));
        }

        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                    .get(properties.getCancelDeadlineMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Cancel deadline of {}ms passed with orders still open", properties.getCancelDeadlineMs());
        } catch (ExecutionException e) {
            log.error("Cancel request failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for cancellations");
        }

        int canceled = 0;
        int finishedOtherwise = 0;
        List<String> unconfirmed = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<Boolean>> entry : futures.entrySet()) {
            CompletableFuture<Boolean> future = entry.getValue();
            if (!future.isDone() || future.isCompletedExceptionally()) {
                unconfirmed.add(entry.getKey());
            } else if (future.join()) {
                canceled++;
            } else {
                finishedOtherwise++;
            }
        }

        CancelAllReport report = CancelAllReport.builder()
                .trigger(trigger)
                .requested(open.size())
                .canceled(canceled)
                .finishedOtherwise(finishedOtherwise)
                .unconfirmedOrderIds(List.copyOf(unconfirmed))
                .elapsedMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                .build();
        auditLog.append(AuditEventType.CANCEL_ALL, report);

        if (report.isComplete()) {
            log.info("Cancel-all done in {}ms: {} canceled, {} finished otherwise",
                    report.getElapsedMs(), canceled, finishedOtherwise);
        } else {
            anomalyMonitor.reportFatal(
                    AnomalyType.CANCEL_TIMEOUT,
                    "cancel-all",
                    unconfirmed.size(),
                    "unconfirmed cancels after " + properties.getCancelDeadlineMs() + "ms: " + unconfirmed);
        }
        return report;
    }
}
