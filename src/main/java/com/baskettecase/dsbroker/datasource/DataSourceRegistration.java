package com.baskettecase.dsbroker.datasource;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request to register a new data source together with its credential.
 *
 * {@code secret} is plaintext only until the credential write interceptor encrypts it.
 */
@Data
public class DataSourceRegistration {

    // Optional; generated when absent
    private String id;

    @NotBlank
    private String title;

    private String engineType = "opensearch";

    @NotBlank
    private String endpoint;

    private String namespace = "default";

    @NotBlank
    private String authScheme;

    // String or JSON object, e.g. {"user":"admin","pass":"..."}
    private Object secret;

    @Override
    public String toString() {
        return "DataSourceRegistration[id=" + id + ", title=" + title + ", endpoint=" + endpoint + "]";
    }
}
