package com.baskettecase.dsbroker.metadata;

import java.util.List;

/**
 * Read side of the metadata store.
 * Callers that only need to resolve records are handed this narrower contract.
 */
public interface MetadataReader {

    /**
     * @throws NotFoundException if no record of that type and id exists
     */
    MetadataRecord get(String type, String id);

    List<MetadataRecord> find(String type);
}
