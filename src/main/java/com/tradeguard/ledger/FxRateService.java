package com.tradeguard.ledger;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tradeguard.config.LedgerProperties;
import com.tradeguard.domain.vo.FxQuote;
import com.tradeguard.exception.FxRateUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Looks up FX rates into the ledger's base currency.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>base currency: identity rate, no lookup</li>
 *   <li>{@link FxRateProvider} with a per-attempt timeout, retried with bounded backoff
 *       (a rate lookup is an idempotent read)</li>
 *   <li>last-known rate, flagged stale, if it is younger than the configured max staleness</li>
 *   <li>otherwise {@link FxRateUnavailableException}</li>
 * </ol>
 *
 * <p>Last-known rates live in a Caffeine cache that expires entries after the max staleness, so
 * an old rate can never be served.
 */
@Service
public class FxRateService {

    private static final Logger log = LoggerFactory.getLogger(FxRateService.class);

    private final LedgerProperties properties;
    private final FxRateProvider fxRateProvider;
    private final Clock clock;
    private final Retry retry;
    private final Cache<String, FxQuote> lastKnown;

    @Autowired
    public FxRateService(LedgerProperties properties, ObjectProvider<FxRateProvider> fxRateProvider, Clock clock) {
        this(properties, fxRateProvider.getIfAvailable(), clock);
    }

    /** Direct wiring; {@code fxRateProvider} may be null when only the base currency is traded. */
    public FxRateService(LedgerProperties properties, FxRateProvider fxRateProvider, Clock clock) {
        this.properties = properties;
        this.fxRateProvider = fxRateProvider;
        this.clock = clock;
        this.retry = Retry.of(
                "fx-lookup",
                RetryConfig.custom()
                        .maxAttempts(properties.getFxRetryAttempts())
                        .waitDuration(Duration.ofMillis(properties.getFxRetryBackoffMs()))
                        .build());
        this.lastKnown = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMillis(properties.getFxMaxStalenessMs()))
                .build();
    }

    public String baseCurrency() {
        return properties.getBaseCurrency();
    }

    /** Rate converting one unit of {@code currency} into the base currency. */
    public FxQuote rateToBase(String currency) {
        String base = properties.getBaseCurrency();
        if (currency == null || currency.equalsIgnoreCase(base)) {
            return FxQuote.identity(base, clock.instant());
        }

        if (fxRateProvider != null) {
            try {
                BigDecimal rate = retry.executeCallable(() -> lookupWithTimeout(currency, base));
                FxQuote quote = new FxQuote(currency, rate, clock.instant(), false);
                lastKnown.put(currency, quote);
                return quote;
            } catch (Exception e) {
                log.warn("FX lookup {}->{} failed after retries: {}", currency, base, e.getMessage());
            }
        }

        FxQuote fallback = lastKnown.getIfPresent(currency);
        if (fallback != null) {
            log.warn("Using stale FX rate {}->{} from {}", currency, base, fallback.getAsOf());
            return new FxQuote(currency, fallback.getRate(), fallback.getAsOf(), true);
        }
        throw new FxRateUnavailableException(currency);
    }

    public BigDecimal toBase(BigDecimal amount, String currency) {
        return rateToBase(currency).convert(amount);
    }

    private BigDecimal lookupWithTimeout(String currency, String base) throws Exception {
        try {
            BigDecimal rate = CompletableFuture.supplyAsync(() -> fxRateProvider.rate(currency, base))
                    .get(properties.getFxTimeoutMs(), TimeUnit.MILLISECONDS);
            if (rate == null || rate.signum() <= 0) {
                throw new IllegalStateException("Invalid FX rate " + rate + " for " + currency);
            }
            return rate;
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
        } catch (TimeoutException e) {
            throw new TimeoutException("FX lookup for " + currency + " exceeded " + properties.getFxTimeoutMs() + "ms");
        }
    }
}
