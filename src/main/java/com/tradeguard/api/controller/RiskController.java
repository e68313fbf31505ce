package com.tradeguard.api.controller;

import com.tradeguard.api.dto.request.KillSwitchRequest;
import com.tradeguard.api.dto.request.OperatorConfirmationRequest;
import com.tradeguard.risk.KillSwitchResult;
import com.tradeguard.risk.KillSwitchService;
import com.tradeguard.risk.OperatorConfirmation;
import com.tradeguard.risk.RiskEngine;
import com.tradeguard.risk.RiskLimits;
import com.tradeguard.risk.RiskStateSnapshot;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk state and the kill switch.
 *
 * <ul>
 *   <li>GET /api/risk/state -- kill switch, daily P&L, exposure and limits</li>
 *   <li>POST /api/risk/kill -- manual trip, two operator confirmations</li>
 *   <li>POST /api/risk/reset -- re-arm, two operator confirmations</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskEngine riskEngine;
    private final KillSwitchService killSwitchService;

    public RiskController(RiskEngine riskEngine, KillSwitchService killSwitchService) {
        this.riskEngine = riskEngine;
        this.killSwitchService = killSwitchService;
    }

    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> getState() {
        RiskStateSnapshot state = riskEngine.state();
        RiskLimits limits = riskEngine.limits();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("killSwitchState", state.getKillSwitchState());
        body.put("killSwitchActive", state.isKillSwitchActive());
        body.put("tripReason", state.getTripReason());
        body.put("tripDetail", state.getTripDetail());
        body.put("trippedAt", state.getTrippedAt());
        body.put("tradingDay", state.getTradingDay());
        body.put("dailyRealizedPnl", state.getDailyRealizedPnl());
        body.put("unrealizedPnl", state.getUnrealizedPnl());
        body.put("dailyPnl", state.getDailyPnl());
        body.put("grossExposure", state.getGrossExposure());
        body.put("exposureBySymbol", state.getExposureBySymbol());
        body.put("consecutiveAnomalies", state.getConsecutiveAnomalies());
        body.put("limits", limits);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/kill")
    public ResponseEntity<KillSwitchResult> kill(@Valid @RequestBody KillSwitchRequest request) {
        log.warn("Manual kill switch requested by {}", operatorIds(request));
        KillSwitchResult result =
                killSwitchService.manualTrip(request.getNonce(), confirmations(request), request.getDetail());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/reset")
    public ResponseEntity<KillSwitchResult> reset(@Valid @RequestBody KillSwitchRequest request) {
        log.warn("Kill switch reset requested by {}", operatorIds(request));
        KillSwitchResult result = killSwitchService.reset(request.getNonce(), confirmations(request), request.getDetail());
        return ResponseEntity.ok(result);
    }

    private List<OperatorConfirmation> confirmations(KillSwitchRequest request) {
        return request.getConfirmations().stream()
                .map(OperatorConfirmationRequest::toConfirmation)
                .toList();
    }

    private List<String> operatorIds(KillSwitchRequest request) {
        return request.getConfirmations().stream()
                .map(OperatorConfirmationRequest::getOperatorId)
                .toList();
    }
}
