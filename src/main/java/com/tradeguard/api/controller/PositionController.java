package com.tradeguard.api.controller;

import com.tradeguard.domain.model.MarketContext;
import com.tradeguard.domain.model.PositionView;
import com.tradeguard.exception.ResourceNotFoundException;
import com.tradeguard.ledger.LedgerValuation;
import com.tradeguard.ledger.PositionLedger;
import com.tradeguard.marketdata.MarketContextProvider;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger views.
 *
 * <ul>
 *   <li>GET /api/positions -- every position plus a base-currency valuation at current marks</li>
 *   <li>GET /api/positions/{symbol} -- one position with its open lots</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final PositionLedger positionLedger;
    private final MarketContextProvider marketContextProvider;

    public PositionController(PositionLedger positionLedger, MarketContextProvider marketContextProvider) {
        this.positionLedger = positionLedger;
        this.marketContextProvider = marketContextProvider;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getPositions() {
        List<PositionView> positions = positionLedger.snapshot();
        LedgerValuation valuation = positionLedger.valuation(
                symbol -> marketContextProvider.current(symbol).map(MarketContext::markPrice).orElse(null));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("positions", positions);
        body.put("valuation", valuation);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<PositionView> getPosition(@PathVariable String symbol) {
        return positionLedger
                .position(symbol)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Position", symbol));
    }
}
