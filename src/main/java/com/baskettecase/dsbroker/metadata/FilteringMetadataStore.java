package com.baskettecase.dsbroker.metadata;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Applies registered {@link WriteFilter}s before create/update reaches the delegate store.
 * Reads pass straight through.
 */
@Slf4j
public class FilteringMetadataStore implements MetadataStore {

    private final MetadataStore delegate;
    private final List<WriteFilter> filters;

    public FilteringMetadataStore(MetadataStore delegate, List<WriteFilter> filters) {
        this.delegate = delegate;
        this.filters = List.copyOf(filters);
        log.info("Metadata store write path has {} filter(s)", this.filters.size());
    }

    @Override
    public MetadataRecord get(String type, String id) {
        return delegate.get(type, id);
    }

    @Override
    public List<MetadataRecord> find(String type) {
        return delegate.find(type);
    }

    @Override
    public MetadataRecord create(MetadataRecord record) {
        return delegate.create(applyFilters(record));
    }

    @Override
    public MetadataRecord update(MetadataRecord record) {
        return delegate.update(applyFilters(record));
    }

    @Override
    public void delete(String type, String id) {
        delegate.delete(type, id);
    }

    private MetadataRecord applyFilters(MetadataRecord record) {
        MetadataRecord current = record;
        for (WriteFilter filter : filters) {
            if (filter.supports(current.getType())) {
                current = filter.beforeWrite(current);
            }
        }
        return current;
    }
}
