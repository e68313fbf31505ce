package com.tradeguard.api.controller;

import com.tradeguard.simulator.PaperExecutionSimulator;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Venue outage injection for paper trading: POST /api/simulator/venues/{venue}/down|up. */
@RestController
@RequestMapping("/api/simulator/venues")
@ConditionalOnBean(PaperExecutionSimulator.class)
public class SimulatorController {

    private final PaperExecutionSimulator paperExecutionSimulator;

    public SimulatorController(PaperExecutionSimulator paperExecutionSimulator) {
        this.paperExecutionSimulator = paperExecutionSimulator;
    }

    @PostMapping("/{venue}/down")
    public ResponseEntity<Map<String, Object>> markDown(@PathVariable String venue) {
        paperExecutionSimulator.markVenueDown(venue);
        return ResponseEntity.ok(Map.of("venue", venue, "down", true));
    }

    @PostMapping("/{venue}/up")
    public ResponseEntity<Map<String, Object>> markUp(@PathVariable String venue) {
        paperExecutionSimulator.markVenueUp(venue);
        return ResponseEntity.ok(Map.of("venue", venue, "down", false));
    }
}
