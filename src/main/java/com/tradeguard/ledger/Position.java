package com.tradeguard.ledger;

import com.tradeguard.domain.model.Lot;
import com.tradeguard.domain.model.PositionView;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable per-symbol position owned by {@link PositionLedger}. Every access goes through the
 * ledger, which synchronizes on the instance.
 *
 * <p>Invariant: all lots share one sign, and their sum is the net position.
 */
class Position {

    private final String symbol;
    private final String currency;
    private final Deque<Lot> lots = new ArrayDeque<>();
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal feesAccrued = BigDecimal.ZERO;
    private long lastAppliedSequence = -1;

    Position(String symbol, String currency) {
        this.symbol = symbol;
        this.currency = currency;
    }

    static Position restore(PositionView view) {
        Position position = new Position(view.getSymbol(), view.getCurrency());
        position.lots.addAll(view.getLots());
        position.realizedPnl = view.getRealizedPnl();
        position.feesAccrued = view.getFeesAccrued();
        position.lastAppliedSequence = view.getLastAppliedSequence();
        return position;
    }

    String symbol() {
        return symbol;
    }

    String currency() {
        return currency;
    }

    Deque<Lot> lots() {
        return lots;
    }

    BigDecimal netQuantity() {
        return lots.stream().map(Lot::getQuantity).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    BigDecimal realizedPnl() {
        return realizedPnl;
    }

    BigDecimal feesAccrued() {
        return feesAccrued;
    }

    long lastAppliedSequence() {
        return lastAppliedSequence;
    }

    void addRealized(BigDecimal amount) {
        realizedPnl = realizedPnl.add(amount);
    }

    void addFee(BigDecimal fee) {
        if (fee != null) {
            feesAccrued = feesAccrued.add(fee);
        }
    }

    void markApplied(long sequence) {
        lastAppliedSequence = Math.max(lastAppliedSequence, sequence);
    }

    PositionView toView() {
        return PositionView.builder()
                .symbol(symbol)
                .currency(currency)
                .netQuantity(netQuantity())
                .lots(List.copyOf(new ArrayList<>(lots)))
                .realizedPnl(realizedPnl)
                .feesAccrued(feesAccrued)
                .lastAppliedSequence(lastAppliedSequence)
                .build();
    }
}
