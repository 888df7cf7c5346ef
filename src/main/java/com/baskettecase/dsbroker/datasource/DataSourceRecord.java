package com.baskettecase.dsbroker.datasource;

import com.baskettecase.dsbroker.metadata.MetadataRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant-visible data source: a named remote endpoint plus a reference to its credential.
 * Carries no secret material, so it is safe to list and return to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceRecord {

    public static final String TYPE = "data-source";

    private String id;
    private String title;
    private String engineType;
    private String endpoint;
    private String credentialId;
    private String namespace;

    public static DataSourceRecord fromMetadata(MetadataRecord record) {
        return DataSourceRecord.builder()
            .id(record.getId())
            .title(record.getAttribute("title"))
            .engineType(record.getAttribute("type"))
            .endpoint(record.getAttribute("endpoint"))
            .credentialId(record.getAttribute("credentialId"))
            .namespace(record.getNamespace())
            .build();
    }

    public MetadataRecord toMetadata() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("title", title);
        attributes.put("type", engineType);
        attributes.put("endpoint", endpoint);
        attributes.put("credentialId", credentialId);
        return MetadataRecord.builder()
            .type(TYPE)
            .id(id)
            .namespace(namespace != null ? namespace : "default")
            .attributes(attributes)
            .build();
    }
}
