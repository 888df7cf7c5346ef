package com.baskettecase.dsbroker.metadata;

/**
 * Read/write contract of the metadata store.
 */
public interface MetadataStore extends MetadataReader {

    /**
     * Persist a new record. An id is assigned when the record has none.
     */
    MetadataRecord create(MetadataRecord record);

    /**
     * Replace the attributes of an existing record and bump its version.
     *
     * @throws NotFoundException if the record does not exist
     */
    MetadataRecord update(MetadataRecord record);

    /**
     * @throws NotFoundException if the record does not exist
     */
    void delete(String type, String id);
}
