package com.tradeguard.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradeguard.config.LedgerProperties;
import com.tradeguard.domain.vo.FxQuote;
import com.tradeguard.exception.FxRateUnavailableException;
import com.tradeguard.ledger.FxRateProvider;
import com.tradeguard.ledger.FxRateService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FxRateServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private FxRateProvider fxRateProvider;

    private FxRateService fxRateService;

    @BeforeEach
    void setUp() {
        LedgerProperties properties = new LedgerProperties();
        properties.setBaseCurrency("USDT");
        properties.setFxRetryAttempts(2);
        properties.setFxRetryBackoffMs(1);
        fxRateService = new FxRateService(properties, fxRateProvider, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Base currency converts at 1 without a lookup")
    void baseCurrency_isIdentity() {
        FxQuote quote = fxRateService.rateToBase("USDT");

        assertThat(quote.getRate()).isEqualByComparingTo("1");
        assertThat(quote.isStale()).isFalse();
        verifyNoInteractions(fxRateProvider);
    }

    @Test
    @DisplayName("Transient failure is retried")
    void transientFailure_isRetried() {
        when(fxRateProvider.rate("TRY", "USDT"))
                .thenThrow(new IllegalStateException("feed hiccup"))
                .thenReturn(new BigDecimal("0.03"));

        assertThat(fxRateService.toBase(new BigDecimal("1000"), "TRY")).isEqualByComparingTo("30");
        verify(fxRateProvider, times(2)).rate("TRY", "USDT");
    }

    @Test
    @DisplayName("Provider outage falls back to the last known rate flagged stale")
    void outage_fallsBackToStaleRate() {
        when(fxRateProvider.rate("TRY", "USDT"))
                .thenReturn(new BigDecimal("0.03"))
                .thenThrow(new IllegalStateException("down"));

        fxRateService.rateToBase("TRY");
        FxQuote fallback = fxRateService.rateToBase("TRY");

        assertThat(fallback.getRate()).isEqualByComparingTo("0.03");
        assertThat(fallback.isStale()).isTrue();
    }

    @Test
    @DisplayName("No provider rate and no last known rate fails loudly")
    void noRate_throws() {
        when(fxRateProvider.rate("EUR", "USDT")).thenThrow(new IllegalStateException("down"));

        assertThatThrownBy(() -> fxRateService.rateToBase("EUR")).isInstanceOf(FxRateUnavailableException.class);
    }

    @Test
    @DisplayName("Non-positive rate is treated as a failed lookup")
    void nonPositiveRate_rejected() {
        when(fxRateProvider.rate("EUR", "USDT")).thenReturn(BigDecimal.ZERO);

        assertThatThrownBy(() -> fxRateService.rateToBase("EUR")).isInstanceOf(FxRateUnavailableException.class);
    }
}
