package com.baskettecase.dsbroker.api;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Client-facing failure to obtain a data source client.
 * The message names the data source; it never carries credential detail.
 */
@Getter
public class DataSourceClientException extends RuntimeException {

    private final String dataSourceId;
    private final HttpStatus status;

    public DataSourceClientException(String dataSourceId, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.dataSourceId = dataSourceId;
        this.status = status;
    }
}
