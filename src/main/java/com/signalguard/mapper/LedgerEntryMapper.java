package com.signalguard.mapper;

import com.signalguard.domain.model.LedgerEntry;
import com.signalguard.entity.LedgerEntryEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the LedgerEntry domain model and LedgerEntryEntity.
 *
 * <p>The payload is a Map in the domain model and a JSON string column in the entity.
 */
@Mapper
public interface LedgerEntryMapper {

    @Mapping(source = "payload", target = "payload", qualifiedByName = "mapToJson")
    LedgerEntryEntity toEntity(LedgerEntry entry);

    @Mapping(source = "payload", target = "payload", qualifiedByName = "jsonToMap")
    LedgerEntry toDomain(LedgerEntryEntity entity);

    List<LedgerEntry> toDomainList(List<LedgerEntryEntity> entities);

    @Named("mapToJson")
    default String mapToJson(Map<String, Object> payload) {
        return payload == null || payload.isEmpty() ? null : JsonHelper.toJson(payload);
    }

    @Named("jsonToMap")
    default Map<String, Object> jsonToMap(String json) {
        return JsonHelper.toMap(json);
    }
}
