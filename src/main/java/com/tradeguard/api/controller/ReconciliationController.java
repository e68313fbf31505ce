package com.tradeguard.api.controller;

import com.tradeguard.api.dto.request.ExternalTradeRequest;
import com.tradeguard.api.dto.request.ReconcileRequest;
import com.tradeguard.domain.model.ExternalTrade;
import com.tradeguard.domain.model.ReconciliationReport;
import com.tradeguard.exception.ReconciliationMismatchException;
import com.tradeguard.reconciliation.TradeReconciliationService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/reconcile -- reconciles internal fills against a posted venue trade list.
 *
 * <p>A clean run returns the report. A run with discrepancies answers 409 with the report in
 * the error details; by then the kill switch has already tripped.
 */
@RestController
@RequestMapping("/api/reconcile")
public class ReconciliationController {

    private final TradeReconciliationService tradeReconciliationService;

    public ReconciliationController(TradeReconciliationService tradeReconciliationService) {
        this.tradeReconciliationService = tradeReconciliationService;
    }

    @PostMapping
    public ResponseEntity<ReconciliationReport> reconcile(@Valid @RequestBody ReconcileRequest request) {
        List<ExternalTrade> trades =
                request.getTrades().stream().map(ExternalTradeRequest::toDomain).toList();
        ReconciliationReport report = tradeReconciliationService.reconcile(trades, request.getSince(), true);
        if (!report.passed()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("runId", report.getRunId());
            details.put("matchedCount", report.getMatchedCount());
            details.put("discrepancies", report.getDiscrepancies());
            throw new ReconciliationMismatchException(
                    "Reconciliation found " + report.getDiscrepancies().size() + " discrepancies", details);
        }
        return ResponseEntity.ok(report);
    }
}
