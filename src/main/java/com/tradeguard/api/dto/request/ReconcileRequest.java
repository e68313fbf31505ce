package com.tradeguard.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Venue trade list to reconcile against. {@code since} defaults to the start of the UTC day. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileRequest {

    @Valid
    @NotNull(message = "trades is required")
    @Builder.Default
    private List<ExternalTradeRequest> trades = new ArrayList<>();

    private Instant since;
}
