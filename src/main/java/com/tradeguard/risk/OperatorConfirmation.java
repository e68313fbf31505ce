package com.tradeguard.risk;

import lombok.Builder;
import lombok.Value;

/** One operator's signature over an action and nonce. */
@Value
@Builder
public class OperatorConfirmation {
    String operatorId;
    String token;
}
