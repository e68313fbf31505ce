package com.tradeguard.risk;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Outcome of a pre-trade check: allowed, or denied with every violated limit. The check
 * never shrinks a trade; resizing is the EV gate's job.
 */
@Getter
public class RiskDecision {

    private final boolean allowed;
    private final List<RiskViolation> violations;

    private RiskDecision(boolean allowed, List<RiskViolation> violations) {
        this.allowed = allowed;
        this.violations = violations;
    }

    public static RiskDecision allow() {
        return new RiskDecision(true, Collections.emptyList());
    }

    public static RiskDecision deny(List<RiskViolation> violations) {
        return new RiskDecision(false, List.copyOf(violations));
    }

    public boolean isDenied() {
        return !allowed;
    }

    public boolean hasViolation(String code) {
        return violations.stream().anyMatch(v -> v.getCode().equals(code));
    }

    /** Comma-separated violation codes, for logs and audit bodies. */
    public String reasonCodes() {
        return violations.stream().map(RiskViolation::getCode).collect(Collectors.joining(","));
    }
}
