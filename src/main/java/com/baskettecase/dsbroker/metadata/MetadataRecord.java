package com.baskettecase.dsbroker.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic typed record held by the metadata store.
 *
 * The store treats attributes as opaque; typed views such as
 * {@code DataSourceRecord} map to and from this envelope.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetadataRecord {

    private String type;
    private String id;

    @Builder.Default
    private String namespace = "default";

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    // Starts at 1, incremented by the store on every update
    private long version;

    private Instant createdAt;
    private Instant updatedAt;

    /**
     * String-valued attribute, or null when absent
     */
    public String getAttribute(String name) {
        Object value = attributes == null ? null : attributes.get(name);
        return value == null ? null : value.toString();
    }
}
