package com.tradeguard.fee;

import com.tradeguard.config.FeeScheduleProperties;
import com.tradeguard.config.FeeScheduleProperties.JurisdictionTax;
import com.tradeguard.config.FeeScheduleProperties.VenueFee;
import com.tradeguard.domain.enums.LiquidityRole;
import com.tradeguard.domain.vo.FeeTaxEstimate;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Converts venue fee schedules and jurisdictional tax rules into net-cost estimates.
 *
 * <p>Pure function of its configuration: no I/O, no mutable state. Cost model per trade:
 * <ul>
 *   <li><b>Fees:</b> maker or taker bps of the venue, less the campaign discount</li>
 *   <li><b>Transaction taxes:</b> sum of the venue jurisdiction's per-leg tax components</li>
 *   <li><b>Legs:</b> a cross-venue intent pays one leg on each of its two venues; a single-venue
 *       intent pays a round trip (entry and exit) on the same venue</li>
 * </ul>
 *
 * <p>Profit withholding is charged on realized gains only and is therefore not part of the
 * pre-trade estimate; see {@link #profitTax(String, BigDecimal)}.
 */
@Service
public class FeeTaxModel {

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 10;

    private final FeeScheduleProperties properties;

    public FeeTaxModel(FeeScheduleProperties properties) {
        this.properties = properties;
    }

    /**
     * Estimates fees and taxes for trading {@code notional} across {@code venues}.
     *
     * @param venues   one venue (round trip) or two venues (one leg each)
     * @param notional trade notional in quote currency, always positive
     * @param role     liquidity role assumed for every leg
     */
    public FeeTaxEstimate estimate(List<String> venues, BigDecimal notional, LiquidityRole role) {
        if (venues == null || venues.isEmpty()) {
            throw new IllegalArgumentException("At least one venue is required for a fee estimate");
        }

        List<String> legs = venues.size() >= 2 ? venues.subList(0, 2) : List.of(venues.get(0), venues.get(0));

        BigDecimal feeBps = BigDecimal.ZERO;
        BigDecimal taxBps = BigDecimal.ZERO;
        for (String venue : legs) {
            feeBps = feeBps.add(feeBps(venue, role));
            taxBps = taxBps.add(transactionTaxBps(venue));
        }

        return FeeTaxEstimate.builder()
                .notional(notional)
                .fees(applyBps(notional, feeBps))
                .taxes(applyBps(notional, taxBps))
                .feeBps(feeBps)
                .taxBps(taxBps)
                .legs(legs.size())
                .build();
    }

    /** Fee charged on a single fill. */
    public BigDecimal fillFee(String venue, LiquidityRole role, BigDecimal notional) {
        return applyBps(notional, feeBps(venue, role)).setScale(8, RoundingMode.HALF_UP);
    }

    /** Effective fee rate for one leg on {@code venue}, after the campaign discount. */
    public BigDecimal feeBps(String venue, LiquidityRole role) {
        VenueFee schedule = properties.getVenues().get(normalize(venue));
        BigDecimal base;
        if (schedule == null) {
            base = role == LiquidityRole.MAKER ? properties.getDefaultMakerBps() : properties.getDefaultTakerBps();
        } else {
            base = role == LiquidityRole.MAKER ? schedule.getMakerBps() : schedule.getTakerBps();
        }
        BigDecimal discount = properties.getCampaignDiscountPct().divide(HUNDRED, SCALE, RoundingMode.HALF_UP);
        return base.multiply(BigDecimal.ONE.subtract(discount));
    }

    /** Sum of per-leg transaction tax components of the venue's jurisdiction. */
    public BigDecimal transactionTaxBps(String venue) {
        JurisdictionTax tax = properties.getJurisdictions().get(jurisdictionOf(venue));
        if (tax == null) {
            return BigDecimal.ZERO;
        }
        return tax.getTransactionTaxBps().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Withholding owed on a realized result. Zero for losses. */
    public BigDecimal profitTax(String venue, BigDecimal realizedPnl) {
        if (realizedPnl == null || realizedPnl.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        JurisdictionTax tax = properties.getJurisdictions().get(jurisdictionOf(venue));
        if (tax == null) {
            return BigDecimal.ZERO;
        }
        return applyBps(realizedPnl, tax.getProfitWithholdingBps()).setScale(8, RoundingMode.HALF_UP);
    }

    public String jurisdictionOf(String venue) {
        VenueFee schedule = properties.getVenues().get(normalize(venue));
        if (schedule != null && schedule.getJurisdiction() != null) {
            return schedule.getJurisdiction();
        }
        return properties.getDefaultJurisdiction();
    }

    private BigDecimal applyBps(BigDecimal amount, BigDecimal bps) {
        return amount.multiply(bps).divide(BPS, SCALE, RoundingMode.HALF_UP);
    }

    private String normalize(String venue) {
        return venue == null ? "" : venue.toLowerCase(Locale.ROOT);
    }
}
