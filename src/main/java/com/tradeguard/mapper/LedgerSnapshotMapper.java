package com.tradeguard.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tradeguard.domain.model.LedgerSnapshot;
import com.tradeguard.domain.model.PositionView;
import com.tradeguard.entity.LedgerSnapshotEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between LedgerSnapshot and LedgerSnapshotEntity.
 *
 * <p>Positions are a list in the domain model but a JSON string in the entity; the
 * conversion goes through {@link JsonHelper}.
 */
@Mapper
public interface LedgerSnapshotMapper {

    @Mapping(source = "positions", target = "positionsJson", qualifiedByName = "positionsToJson")
    LedgerSnapshotEntity toEntity(LedgerSnapshot snapshot);

    @Mapping(source = "positionsJson", target = "positions", qualifiedByName = "jsonToPositions")
    LedgerSnapshot toDomain(LedgerSnapshotEntity entity);

    @Named("positionsToJson")
    default String positionsToJson(List<PositionView> positions) {
        return JsonHelper.toJson(positions);
    }

    @Named("jsonToPositions")
    default List<PositionView> jsonToPositions(String json) {
        List<PositionView> positions = JsonHelper.fromJson(json, new TypeReference<List<PositionView>>() {});
        return positions != null ? positions : List.of();
    }
}
