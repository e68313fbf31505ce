package com.tradeguard.api.dto.request;

import com.tradeguard.risk.OperatorConfirmation;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperatorConfirmationRequest {

    @NotBlank(message = "operatorId is required")
    private String operatorId;

    /** Hex HMAC-SHA256 of "ACTION:nonce" under the operator's secret. */
    @NotBlank(message = "token is required")
    private String token;

    public OperatorConfirmation toConfirmation() {
        return OperatorConfirmation.builder().operatorId(operatorId).token(token).build();
    }
}
