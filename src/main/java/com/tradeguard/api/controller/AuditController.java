package com.tradeguard.api.controller;

import com.tradeguard.audit.AuditLog;
import com.tradeguard.domain.model.ChainVerificationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** GET /api/audit/verify -- re-walks the hash chain from genesis. */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditLog auditLog;

    public AuditController(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @GetMapping("/verify")
    public ResponseEntity<ChainVerificationResult> verify() {
        return ResponseEntity.ok(auditLog.verifyChain());
    }
}
