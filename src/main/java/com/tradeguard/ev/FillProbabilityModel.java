package com.tradeguard.ev;

import com.tradeguard.domain.model.MarketContext;
import java.math.BigDecimal;

/** Estimates the probability that an intent's order fills at the quoted edge. */
public interface FillProbabilityModel {

    BigDecimal estimate(MarketContext context, BigDecimal spreadBps);
}
