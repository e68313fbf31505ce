package com.tradeguard.mapper;

import com.tradeguard.entity.RiskStateEntity;
import com.tradeguard.risk.RiskStateSnapshot;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the risk state snapshot and the single risk_state row.
 * Exposure is rebuilt from the ledger on restart, so it is not stored.
 */
@Mapper
public interface RiskStateMapper {

    @Mapping(target = "id", expression = "java(com.tradeguard.entity.RiskStateEntity.SINGLETON_ID)")
    @Mapping(target = "updatedAt", ignore = true)
    RiskStateEntity toEntity(RiskStateSnapshot snapshot);

    @Mapping(target = "exposureBySymbol", ignore = true)
    @Mapping(target = "grossExposure", ignore = true)
    RiskStateSnapshot toSnapshot(RiskStateEntity entity);
}
