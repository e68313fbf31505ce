package com.tradeguard.event;

import com.tradeguard.domain.enums.OrderStatus;
import com.tradeguard.domain.model.AnomalyEvent;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.Order;
import com.tradeguard.domain.model.ReconciliationReport;
import com.tradeguard.oms.IntentOutcome;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}, so call sites read
 * {@code eventPublisherHelper.publishOrderFilled(this, order, previous)} instead of
 * constructing events inline.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Market data ----

    public void publishMarketData(Object source, MarketContext context) {
        applicationEventPublisher.publishEvent(new MarketDataEvent(source, context));
    }

    // ---- Order ----

    public void publishOrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousStatus));
    }

    public void publishOrderAccepted(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.ACCEPTED));
    }

    // ---- Intent ----

    public void publishIntentProcessed(Object source, IntentOutcome outcome, long startedNanos) {
        applicationEventPublisher.publishEvent(new IntentProcessedEvent(source, outcome, startedNanos));
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message));
    }

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }

    // ---- Anomaly ----

    public void publishAnomaly(Object source, AnomalyEvent anomaly) {
        applicationEventPublisher.publishEvent(new AnomalyDetectedEvent(source, anomaly));
    }

    // ---- Reconciliation ----

    public void publishReconciliation(Object source, ReconciliationReport report, boolean manual) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, report, manual));
    }
}
