package com.tradeguard.mapper;

import com.tradeguard.domain.model.ExternalTrade;
import com.tradeguard.domain.model.Fill;
import com.tradeguard.entity.FillEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for fills. Also projects a stored fill into the {@link ExternalTrade} shape
 * so reconciliation compares like with like; the fill id becomes the trade id.
 */
@Mapper
public interface FillMapper {

    FillEntity toEntity(Fill fill);

    Fill toDomain(FillEntity entity);

    List<Fill> toDomainList(List<FillEntity> entities);

    @Mapping(source = "id", target = "tradeId")
    ExternalTrade toTrade(FillEntity entity);

    List<ExternalTrade> toTradeList(List<FillEntity> entities);
}
