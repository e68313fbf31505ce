package com.tradeguard.domain.model;

import com.tradeguard.domain.enums.DiscrepancyType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Discrepancy {

    String tradeId;
    DiscrepancyType type;
    String internalValue;
    String externalValue;
}
