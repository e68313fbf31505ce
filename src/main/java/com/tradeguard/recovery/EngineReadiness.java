package com.tradeguard.recovery;

import com.tradeguard.domain.enums.ReadinessState;
import com.tradeguard.exception.BusinessException;
import com.tradeguard.exception.ChainIntegrityException;
import com.tradeguard.exception.ErrorCode;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Intake gate for trade intents. Starts RECOVERING, becomes READY once startup recovery has
 * rebuilt state, and goes HALTED for good when the audit chain fails verification.
 */
@Component
public class EngineReadiness {

    private static final Logger log = LoggerFactory.getLogger(EngineReadiness.class);

    private volatile ReadinessState state = ReadinessState.RECOVERING;
    private volatile String haltReason;

    public ReadinessState state() {
        return state;
    }

    public String haltReason() {
        return haltReason;
    }

    public void markReady() {
        if (state == ReadinessState.HALTED) {
            log.error("Engine is halted ({}), refusing to mark ready", haltReason);
            return;
        }
        state = ReadinessState.READY;
        log.info("Engine ready, accepting trade intents");
    }

    public void halt(String reason) {
        this.haltReason = reason;
        this.state = ReadinessState.HALTED;
        log.error("Engine halted: {}", reason);
    }

    /** Throws unless intents may be accepted. */
    public void requireReady() {
        ReadinessState current = state;
        if (current == ReadinessState.HALTED) {
            throw new ChainIntegrityException(
                    "Engine halted, operator intervention required: " + haltReason,
                    Map.<String, Object>of("state", current.name()));
        }
        if (current == ReadinessState.RECOVERING) {
            throw new BusinessException(ErrorCode.ENGINE_NOT_READY, "Engine is still recovering state");
        }
    }
}
