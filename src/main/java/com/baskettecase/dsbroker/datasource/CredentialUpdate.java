package com.baskettecase.dsbroker.datasource;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request to replace a data source's credential.
 */
@Data
public class CredentialUpdate {

    @NotBlank
    private String authScheme;

    private Object secret;

    @Override
    public String toString() {
        return "CredentialUpdate[authScheme=" + authScheme + "]";
    }
}
