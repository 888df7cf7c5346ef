package com.baskettecase.dsbroker.metadata;

import lombok.Getter;

/**
 * A referenced metadata record does not exist.
 */
@Getter
public class NotFoundException extends RuntimeException {

    private final String type;
    private final String id;

    public NotFoundException(String type, String id) {
        super("Saved object [" + type + "/" + id + "] not found");
        this.type = type;
        this.id = id;
    }
}
