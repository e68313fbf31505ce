package com.tradeguard.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a manual trip or a reset. Each confirmation signs the same action and nonce; a nonce
 * is accepted once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KillSwitchRequest {

    @NotBlank(message = "nonce is required")
    private String nonce;

    private String detail;

    @Valid
    @NotEmpty(message = "at least one operator confirmation is required")
    @Builder.Default
    private List<OperatorConfirmationRequest> confirmations = new ArrayList<>();
}
