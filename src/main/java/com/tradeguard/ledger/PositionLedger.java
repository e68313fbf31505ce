package com.tradeguard.ledger;

import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.LedgerUpdate;
import com.tradeguard.domain.model.Lot;
import com.tradeguard.domain.model.PositionView;
import com.tradeguard.domain.vo.FxQuote;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * FIFO lot ledger: one position per symbol, each an ordered queue of open lots.
 *
 * <p>Fill handling ({@link #apply}):
 * <ol>
 *   <li>A fill on the side opposite to the open lots consumes the oldest lots first. Each
 *       consumed portion realizes {@code (fillPrice - entryPrice) x quantity x lotSign}.</li>
 *   <li>Whatever the fill has left after the opposing lots are gone opens a new lot on the
 *       fill's side (a long position flips short and vice versa).</li>
 *   <li>A fill on the same side as the open lots simply appends a lot.</li>
 * </ol>
 *
 * <p>Amounts stay in the position's own currency; conversion to the base currency happens
 * at valuation time through {@link FxRateService}. Updates for one symbol are serialized on
 * the position; different symbols never contend.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final FxRateService fxRateService;

    public PositionLedger(FxRateService fxRateService) {
        this.fxRateService = fxRateService;
    }

    // ========================
    // FILL APPLICATION
    // ========================

    /**
     * Applies {@code fill} to its symbol's position.
     *
     * @param auditSequence sequence of the FILL audit entry, remembered so restart replay can
     *                      skip fills a snapshot already contains
     */
    public LedgerUpdate apply(Fill fill, long auditSequence) {
        Position position = positions.computeIfAbsent(fill.getSymbol(), s -> new Position(s, fill.getCurrency()));

        synchronized (position) {
            if (fill.getCurrency() != null && !fill.getCurrency().equals(position.currency())) {
                throw new IllegalStateException("Fill " + fill.getId() + " in " + fill.getCurrency()
                        + " does not match position currency " + position.currency());
            }

            Deque<Lot> lots = position.lots();
            BigDecimal remaining = fill.signedQuantity();
            BigDecimal realized = BigDecimal.ZERO;
            int consumed = 0;

            while (remaining.signum() != 0 && !lots.isEmpty() && lots.peekFirst().getQuantity().signum() != remaining.signum()) {
                Lot oldest = lots.pollFirst();
                BigDecimal lotSign = BigDecimal.valueOf(oldest.getQuantity().signum());
                BigDecimal matched = oldest.getQuantity().abs().min(remaining.abs());

                realized = realized.add(fill.getPrice().subtract(oldest.getEntryPrice()).multiply(matched).multiply(lotSign));

                BigDecimal left = oldest.getQuantity().subtract(matched.multiply(lotSign));
                if (left.signum() == 0) {
                    consumed++;
                } else {
                    lots.offerFirst(oldest.withQuantity(left));
                }
                remaining = remaining.add(matched.multiply(lotSign));
            }

            boolean opened = false;
            if (remaining.signum() != 0) {
                lots.offerLast(Lot.builder()
                        .symbol(fill.getSymbol())
                        .quantity(remaining)
                        .entryPrice(fill.getPrice())
                        .currency(position.currency())
                        .openedAt(fill.getTimestamp())
                        .fillId(fill.getId())
                        .build());
                opened = true;
            }

            position.addRealized(realized);
            position.addFee(fill.getFee());
            position.markApplied(auditSequence);

            BigDecimal net = position.netQuantity();
            log.debug(
                    "Ledger {} fill {} {} @ {}: realized {} net {} lots {}",
                    fill.getSymbol(),
                    fill.getId(),
                    fill.signedQuantity(),
                    fill.getPrice(),
                    realized,
                    net,
                    lots.size());

            return LedgerUpdate.builder()
                    .symbol(fill.getSymbol())
                    .fillId(fill.getId())
                    .currency(position.currency())
                    .fillPrice(fill.getPrice())
                    .realizedPnl(realized)
                    .positionRealizedPnl(position.realizedPnl())
                    .fee(fill.getFee())
                    .netQuantity(net)
                    .lotsConsumed(consumed)
                    .lotOpened(opened)
                    .auditSequence(auditSequence)
                    .build();
        }
    }

    // ========================
    // QUERIES
    // ========================

    public BigDecimal netQuantity(String symbol) {
        Position position = positions.get(symbol);
        if (position == null) {
            return BigDecimal.ZERO;
        }
        synchronized (position) {
            return position.netQuantity();
        }
    }

    public Optional<PositionView> position(String symbol) {
        Position position = positions.get(symbol);
        if (position == null) {
            return Optional.empty();
        }
        synchronized (position) {
            return Optional.of(position.toView());
        }
    }

    /** Unrealized P&L of one symbol at {@code markPrice}, in the position's currency. */
    public BigDecimal unrealized(String symbol, BigDecimal markPrice) {
        Position position = positions.get(symbol);
        if (position == null || markPrice == null) {
            return BigDecimal.ZERO;
        }
        synchronized (position) {
            return unrealizedOf(position, markPrice);
        }
    }

    /**
     * Values every position in the base currency. FX rates are looked up now, never reused
     * from an earlier valuation.
     *
     * @param markPrices mark price per symbol; a missing mark values that position at zero
     *                   unrealized P&L and zero exposure
     */
    public LedgerValuation valuation(Function<String, BigDecimal> markPrices) {
        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal gross = BigDecimal.ZERO;
        boolean stale = false;
        Map<String, BigDecimal> exposure = new LinkedHashMap<>();

        for (PositionView view : snapshot()) {
            FxQuote fx = fxRateService.rateToBase(view.getCurrency());
            stale |= fx.isStale();
            realized = realized.add(fx.convert(view.getRealizedPnl()));

            BigDecimal mark = markPrices.apply(view.getSymbol());
            if (mark != null) {
                BigDecimal symbolUnrealized = view.getLots().stream()
                        .map(lot -> mark.subtract(lot.getEntryPrice()).multiply(lot.getQuantity()))
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                BigDecimal symbolExposure = fx.convert(view.getNetQuantity().abs().multiply(mark));
                unrealized = unrealized.add(fx.convert(symbolUnrealized));
                gross = gross.add(symbolExposure);
                exposure.put(view.getSymbol(), symbolExposure);
            }
        }

        return LedgerValuation.builder()
                .baseCurrency(fxRateService.baseCurrency())
                .realizedPnl(realized)
                .unrealizedPnl(unrealized)
                .grossExposure(gross)
                .exposureBySymbol(exposure)
                .staleRates(stale)
                .build();
    }

    // ========================
    // SNAPSHOT / RESTORE
    // ========================

    public List<PositionView> snapshot() {
        return positions.values().stream()
                .map(position -> {
                    synchronized (position) {
                        return position.toView();
                    }
                })
                .sorted(Comparator.comparing(PositionView::getSymbol))
                .toList();
    }

    /** Replaces all positions. Only used during startup recovery, before intake opens. */
    public void restore(List<PositionView> views) {
        positions.clear();
        for (PositionView view : views) {
            positions.put(view.getSymbol(), Position.restore(view));
        }
        log.info("Ledger restored with {} positions", views.size());
    }

    /** Sequence of the last fill applied to {@code symbol}, or -1. */
    public long lastAppliedSequence(String symbol) {
        Position position = positions.get(symbol);
        if (position == null) {
            return -1;
        }
        synchronized (position) {
            return position.lastAppliedSequence();
        }
    }

    private BigDecimal unrealizedOf(Position position, BigDecimal markPrice) {
        return position.lots().stream()
                .map(lot -> markPrice.subtract(lot.getEntryPrice()).multiply(lot.getQuantity()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
