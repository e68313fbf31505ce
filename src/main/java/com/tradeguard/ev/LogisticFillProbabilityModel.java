package com.tradeguard.ev;

import com.tradeguard.config.EvGateProperties;
import com.tradeguard.config.EvGateProperties.FillModel;
import com.tradeguard.domain.model.MarketContext;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Logistic fill-probability model over four normalized features:
 * <ul>
 *   <li>recent maker fill rate (0..1)</li>
 *   <li>depth balance {@code 1 / (1 + |1 - depthRatio|)}: 1.0 for a balanced book</li>
 *   <li>spread tightness {@code 1 / (1 + spreadBps / 10)}</li>
 *   <li>speed {@code 1 / (1 + latencyMs / 100)}</li>
 * </ul>
 * The weighted score s gives {@code p = 1 / (1 + e^(-k (s - 0.5)))}, clamped to the configured
 * bounds so the gate never assumes a certain or impossible fill.
 */
@Component
public class LogisticFillProbabilityModel implements FillProbabilityModel {

    private final EvGateProperties properties;

    public LogisticFillProbabilityModel(EvGateProperties properties) {
        this.properties = properties;
    }

    @Override
    public BigDecimal estimate(MarketContext context, BigDecimal spreadBps) {
        FillModel model = properties.getFillModel();

        double fillRate = context.getMakerFillRate() != null
                ? context.getMakerFillRate().doubleValue()
                : model.getDefaultFillRate();
        double depthRatio = context.getDepthRatio() != null ? context.getDepthRatio().doubleValue() : 1.0;
        double spread = spreadBps != null ? Math.abs(spreadBps.doubleValue()) : 0.0;

        double depthBalance = 1.0 / (1.0 + Math.abs(1.0 - depthRatio));
        double spreadTightness = 1.0 / (1.0 + spread / 10.0);
        double speed = 1.0 / (1.0 + Math.max(0, context.getLatencyMs()) / 100.0);

        double score = model.getFillRateWeight() * fillRate
                + model.getDepthWeight() * depthBalance
                + model.getSpreadWeight() * spreadTightness
                + model.getSpeedWeight() * speed;

        double p = 1.0 / (1.0 + Math.exp(-model.getSteepness() * (score - 0.5)));
        p = Math.max(model.getMinProbability(), Math.min(model.getMaxProbability(), p));

        return BigDecimal.valueOf(p).setScale(6, RoundingMode.HALF_UP);
    }
}
