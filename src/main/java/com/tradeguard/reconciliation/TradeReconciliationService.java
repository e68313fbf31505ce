package com.tradeguard.reconciliation;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.config.AuditProperties;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.enums.DiscrepancyType;
import com.tradeguard.domain.model.Discrepancy;
import com.tradeguard.domain.model.ExternalTrade;
import com.tradeguard.domain.model.ReconciliationReport;
import com.tradeguard.event.EventPublisherHelper;
import com.tradeguard.mapper.FillMapper;
import com.tradeguard.repository.jpa.FillJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Compares internal fills with the venue's trade records by trade id.
 *
 * <p>Discrepancies:
 * <ul>
 *   <li>MISSING_EXTERNAL: an internal fill the venue does not know</li>
 *   <li>UNKNOWN_EXTERNAL: a venue trade with no internal fill</li>
 *   <li>SYMBOL/SIDE_MISMATCH: fields differ</li>
 *   <li>PRICE/QUANTITY_MISMATCH: absolute difference above the configured tolerance</li>
 * </ul>
 *
 * <p>Every run is audited and published. A run with any discrepancy is reported as a fatal
 * RECONCILIATION_FAIL anomaly, which trips the kill switch through the risk engine.
 */
@Service
public class TradeReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(TradeReconciliationService.class);

    private final FillJpaRepository fillJpaRepository;
    private final AuditLog auditLog;
    private final AnomalyMonitor anomalyMonitor;
    private final EventPublisherHelper eventPublisherHelper;
    private final AuditProperties properties;
    private final ObjectProvider<ExternalTradeSource> externalTradeSource;
    private final Clock clock;
    private final FillMapper fillMapper = Mappers.getMapper(FillMapper.class);

    public TradeReconciliationService(
            FillJpaRepository fillJpaRepository,
            AuditLog auditLog,
            AnomalyMonitor anomalyMonitor,
            EventPublisherHelper eventPublisherHelper,
            AuditProperties properties,
            ObjectProvider<ExternalTradeSource> externalTradeSource,
            Clock clock) {
        this.fillJpaRepository = fillJpaRepository;
        this.auditLog = auditLog;
        this.anomalyMonitor = anomalyMonitor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.properties = properties;
        this.externalTradeSource = externalTradeSource;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${tradeguard.audit.reconciliation-interval-ms:300000}",
            fixedDelayString = "${tradeguard.audit.reconciliation-interval-ms:300000}")
    public void scheduledReconciliation() {
        ExternalTradeSource source = externalTradeSource.getIfAvailable();
        if (source == null) {
            return;
        }
        Instant since = startOfDay();
        List<ExternalTrade> external;
        try {
            external = source.tradesSince(since);
        } catch (RuntimeException e) {
            log.error("Could not fetch venue trades for reconciliation: {}", e.getMessage());
            return;
        }
        reconcile(external, since, false);
    }

    /**
     * Reconciles fills recorded at or after {@code since} (start of the current UTC day when
     * null) against {@code externalTrades}.
     */
    public ReconciliationReport reconcile(List<ExternalTrade> externalTrades, Instant since, boolean manual) {
        Instant windowStart = since != null ? since : startOfDay();
        List<ExternalTrade> internal = fillMapper.toTradeList(
                fillJpaRepository.findByTimestampGreaterThanEqualOrderByTimestampAsc(windowStart));

        Map<String, ExternalTrade> externalById = new LinkedHashMap<>();
        for (ExternalTrade trade : externalTrades) {
            if (trade.getTimestamp() == null || !trade.getTimestamp().isBefore(windowStart)) {
                externalById.put(trade.getTradeId(), trade);
            }
        }
        int externalCount = externalById.size();

        List<Discrepancy> discrepancies = new ArrayList<>();
        int matched = 0;
        for (ExternalTrade mine : internal) {
            ExternalTrade theirs = externalById.remove(mine.getTradeId());
            if (theirs == null) {
                discrepancies.add(discrepancy(mine.getTradeId(), DiscrepancyType.MISSING_EXTERNAL, "present", "absent"));
                continue;
            }
            int before = discrepancies.size();
            compare(mine, theirs, discrepancies);
            if (discrepancies.size() == before) {
                matched++;
            }
        }
        for (ExternalTrade unknown : externalById.values()) {
            discrepancies.add(discrepancy(unknown.getTradeId(), DiscrepancyType.UNKNOWN_EXTERNAL, "absent", "present"));
        }

        ReconciliationReport report = ReconciliationReport.builder()
                .runId(UUID.randomUUID().toString())
                .runAt(clock.instant())
                .since(windowStart)
                .internalCount(internal.size())
                .externalCount(externalCount)
                .matchedCount(matched)
                .discrepancies(List.copyOf(discrepancies))
                .build();

        auditLog.append(AuditEventType.RECONCILIATION, report);
        if (report.passed()) {
            log.info("Reconciliation {} passed: {} fills matched since {}", report.getRunId(), matched, windowStart);
        } else {
            log.error(
                    "Reconciliation {} failed: {} discrepancies ({} internal, {} external)",
                    report.getRunId(),
                    discrepancies.size(),
                    internal.size(),
                    externalCount);
            anomalyMonitor.reportFatal(
                    AnomalyType.RECONCILIATION_FAIL,
                    "reconciliation",
                    discrepancies.size(),
                    "run " + report.getRunId() + ": " + summarize(discrepancies));
        }
        eventPublisherHelper.publishReconciliation(this, report, manual);
        return report;
    }

    private void compare(ExternalTrade mine, ExternalTrade theirs, List<Discrepancy> out) {
        String id = mine.getTradeId();
        if (!Objects.equals(mine.getSymbol(), theirs.getSymbol())) {
            out.add(discrepancy(id, DiscrepancyType.SYMBOL_MISMATCH, mine.getSymbol(), theirs.getSymbol()));
        }
        if (mine.getSide() != theirs.getSide()) {
            out.add(discrepancy(id, DiscrepancyType.SIDE_MISMATCH, String.valueOf(mine.getSide()), String.valueOf(theirs.getSide())));
        }
        if (exceeds(mine.getPrice(), theirs.getPrice(), properties.getPriceTolerance())) {
            out.add(discrepancy(id, DiscrepancyType.PRICE_MISMATCH, plain(mine.getPrice()), plain(theirs.getPrice())));
        }
        if (exceeds(mine.getQuantity(), theirs.getQuantity(), properties.getQuantityTolerance())) {
            out.add(discrepancy(
                    id, DiscrepancyType.QUANTITY_MISMATCH, plain(mine.getQuantity()), plain(theirs.getQuantity())));
        }
    }

    private boolean exceeds(BigDecimal internal, BigDecimal external, double tolerance) {
        if (internal == null || external == null) {
            return internal != external;
        }
        return internal.subtract(external).abs().compareTo(BigDecimal.valueOf(tolerance)) > 0;
    }

    private Discrepancy discrepancy(String tradeId, DiscrepancyType type, String internal, String external) {
        return Discrepancy.builder()
                .tradeId(tradeId)
                .type(type)
                .internalValue(internal)
                .externalValue(external)
                .build();
    }

    private String summarize(List<Discrepancy> discrepancies) {
        Map<DiscrepancyType, Integer> counts = new LinkedHashMap<>();
        for (Discrepancy discrepancy : discrepancies) {
            counts.merge(discrepancy.getType(), 1, Integer::sum);
        }
        return counts.toString();
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    private Instant startOfDay() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
