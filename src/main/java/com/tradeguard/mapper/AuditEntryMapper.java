package com.tradeguard.mapper;

import com.tradeguard.domain.model.AuditEntry;
import com.tradeguard.entity.AuditEntryEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between AuditEntry and AuditEntryEntity. Field names match one to one. */
@Mapper
public interface AuditEntryMapper {

    AuditEntryEntity toEntity(AuditEntry entry);

    AuditEntry toDomain(AuditEntryEntity entity);

    List<AuditEntry> toDomainList(List<AuditEntryEntity> entities);
}
