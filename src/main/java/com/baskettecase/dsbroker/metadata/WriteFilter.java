package com.baskettecase.dsbroker.metadata;

/**
 * Transforms records on the write path of the metadata store.
 *
 * A filter that throws aborts the write; the underlying store is never invoked.
 */
public interface WriteFilter {

    boolean supports(String type);

    MetadataRecord beforeWrite(MetadataRecord record);
}
