package com.tradeguard.risk;

import com.tradeguard.domain.enums.KillSwitchState;
import com.tradeguard.domain.enums.TripReason;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a trip or reset request. {@code changed} is false when the switch was already
 * in the requested state.
 */
@Data
@Builder
public class KillSwitchResult {

    private boolean changed;
    private KillSwitchState state;
    private TripReason reason;
    private String detail;
    private Instant at;

    @Builder.Default
    private List<String> operators = new ArrayList<>();

    public static KillSwitchResult unchanged(KillSwitchState state, TripReason reason, String detail) {
        return KillSwitchResult.builder()
                .changed(false)
                .state(state)
                .reason(reason)
                .detail(detail)
                .build();
    }
}
