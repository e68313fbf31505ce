package com.tradeguard.oms;

import com.tradeguard.anomaly.AnomalyMonitor;
import com.tradeguard.audit.AuditLog;
import com.tradeguard.domain.enums.AnomalyType;
import com.tradeguard.domain.enums.AuditEventType;
import com.tradeguard.domain.model.AuditEntry;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.LedgerUpdate;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.Order;
import com.tradeguard.exception.FxRateUnavailableException;
import com.tradeguard.ledger.FxRateService;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.mapper.FillMapper;
import com.tradeguard.marketdata.MarketContextProvider;
import com.tradeguard.repository.jpa.FillJpaRepository;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskStateUpdate;
import java.math.BigDecimal;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Books fills for every execution venue.
 *
 * <p>{@link #record} runs inside the kill-switch token guard: it audits the fill, persists it,
 * folds it into the order and applies it to the ledger. {@link #afterFill} runs after the guard
 * is released and pushes the realized P&L and new exposure into the risk engine in the base
 * currency. The split keeps risk evaluation (which may trip the switch and cancel the token)
 * out of the token's read lock.
 */
@Component
public class FillProcessor {

    private static final Logger log = LoggerFactory.getLogger(FillProcessor.class);

    private final AuditLog auditLog;
    private final FillJpaRepository fillJpaRepository;
    private final PositionLedger positionLedger;
    private final FxRateService fxRateService;
    private final MarketContextProvider marketContextProvider;
    private final RiskEngine riskEngine;
    private final AnomalyMonitor anomalyMonitor;
    private final FillMapper fillMapper = Mappers.getMapper(FillMapper.class);

    public FillProcessor(
            AuditLog auditLog,
            FillJpaRepository fillJpaRepository,
            PositionLedger positionLedger,
            FxRateService fxRateService,
            MarketContextProvider marketContextProvider,
            RiskEngine riskEngine,
            AnomalyMonitor anomalyMonitor) {
        this.auditLog = auditLog;
        this.fillJpaRepository = fillJpaRepository;
        this.positionLedger = positionLedger;
        this.fxRateService = fxRateService;
        this.marketContextProvider = marketContextProvider;
        this.riskEngine = riskEngine;
        this.anomalyMonitor = anomalyMonitor;
    }

    /** Audits, persists and applies one fill. The caller transitions the order afterwards. */
    public LedgerUpdate record(Order order, Fill fill) {
        AuditEntry entry = auditLog.append(AuditEventType.FILL, fill);
        fillJpaRepository.save(fillMapper.toEntity(fill));
        order.applyFill(fill);
        LedgerUpdate update = positionLedger.apply(fill, entry.getSequence());

        log.info(
                "Fill {} on order {}: {} {} {} @ {} (fee {}), net position {}",
                fill.getId(),
                order.getId(),
                fill.getSide(),
                fill.getQuantity(),
                fill.getSymbol(),
                fill.getPrice(),
                fill.getFee(),
                update.getNetQuantity());
        return update;
    }

    /**
     * Converts the update to the base currency and hands it to the risk engine. A missing FX
     * rate cannot be valued, so it is reported as a fatal anomaly instead.
     */
    public void afterFill(LedgerUpdate update) {
        BigDecimal mark = marketContextProvider.current(update.getSymbol())
                .map(MarketContext::markPrice)
                .orElse(update.getFillPrice());
        try {
            BigDecimal realized = fxRateService.toBase(update.getRealizedPnl(), update.getCurrency());
            BigDecimal exposure = fxRateService.toBase(update.getNetQuantity().abs().multiply(mark), update.getCurrency());
            riskEngine.evaluate(RiskStateUpdate.ledger(update.getSymbol(), realized, exposure, update.getAuditSequence()));
        } catch (FxRateUnavailableException e) {
            log.error("Cannot value fill {} in base currency: {}", update.getFillId(), e.getMessage());
            anomalyMonitor.reportFatal(AnomalyType.FX_UNAVAILABLE, update.getSymbol(), 1, e.getMessage());
        }
    }
}
