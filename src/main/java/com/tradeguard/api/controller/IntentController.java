package com.tradeguard.api.controller;

import com.tradeguard.api.dto.request.TradeIntentRequest;
import com.tradeguard.oms.IntentOutcome;
import com.tradeguard.oms.TradeIntentPipeline;
import java.time.Clock;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/intents -- submits a trade intent and returns its outcome. Resubmitting an intent
 * id returns the first outcome with {@code duplicate} set.
 */
@RestController
@RequestMapping("/api/intents")
public class IntentController {

    private final TradeIntentPipeline tradeIntentPipeline;
    private final Clock clock;

    public IntentController(TradeIntentPipeline tradeIntentPipeline, Clock clock) {
        this.tradeIntentPipeline = tradeIntentPipeline;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<IntentOutcome> submit(@RequestBody TradeIntentRequest request) {
        return ResponseEntity.ok(tradeIntentPipeline.submit(request.toDomain(clock.instant())));
    }
}
