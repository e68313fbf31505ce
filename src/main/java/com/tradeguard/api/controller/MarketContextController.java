package com.tradeguard.api.controller;

import com.tradeguard.api.dto.request.MarketContextRequest;
import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.marketdata.InMemoryMarketContextProvider;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Collection;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Push endpoint for an out-of-process market-data feed.
 *
 * <ul>
 *   <li>POST /api/market-context -- replaces the context for one symbol</li>
 *   <li>GET /api/market-context -- latest context per symbol</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/market-context")
public class MarketContextController {

    private final InMemoryMarketContextProvider marketContextProvider;
    private final Clock clock;

    public MarketContextController(InMemoryMarketContextProvider marketContextProvider, Clock clock) {
        this.marketContextProvider = marketContextProvider;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<MarketContext> update(@Valid @RequestBody MarketContextRequest request) {
        MarketContext context = request.toDomain(clock.instant());
        marketContextProvider.update(context);
        return ResponseEntity.ok(context);
    }

    @GetMapping
    public ResponseEntity<Collection<MarketContext>> all() {
        return ResponseEntity.ok(marketContextProvider.all());
    }
}
