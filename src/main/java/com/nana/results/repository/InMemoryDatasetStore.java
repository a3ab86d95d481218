package com.nana.results.repository;

import com.nana.results.domain.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * InMemoryDatasetStore - Session-Scoped {@link DatasetStore}
 *
 * <p>A synchronised insertion-ordered map. Datasets are immutable, so
 * handing out the stored instance needs no copying.
 */
public class InMemoryDatasetStore implements DatasetStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDatasetStore.class);

    private final Map<String, Dataset> datasets = new LinkedHashMap<>();

    public InMemoryDatasetStore() {
        log.debug("InMemoryDatasetStore instantiated.");
    }

    @Override
    public synchronized void put(Dataset dataset) {
        if (dataset == null) {
            throw new StoreException("Dataset must not be null.");
        }
        if (dataset.getName().isBlank()) {
            throw new StoreException("Dataset must have a name to be stored.");
        }
        Dataset previous = datasets.put(dataset.getName(), dataset);
        if (previous != null) {
            log.info("Dataset '{}' replaced ({} -> {} rows).",
                    dataset.getName(), previous.getRowCount(), dataset.getRowCount());
        } else {
            log.info("Dataset '{}' stored with {} rows.", dataset.getName(), dataset.getRowCount());
        }
    }

    @Override
    public synchronized Dataset get(String name) {
        Dataset dataset = datasets.get(name);
        if (dataset == null) {
            log.warn("Lookup of unknown dataset '{}'.", name);
            throw new StoreException("No dataset named '" + name + "' has been loaded.");
        }
        return dataset;
    }

    @Override
    public synchronized Optional<Dataset> find(String name) {
        return Optional.ofNullable(datasets.get(name));
    }

    @Override
    public synchronized List<String> names() {
        return new ArrayList<>(datasets.keySet());
    }

    @Override
    public synchronized boolean remove(String name) {
        boolean removed = datasets.remove(name) != null;
        if (removed) {
            log.info("Dataset '{}' removed.", name);
        }
        return removed;
    }

    @Override
    public synchronized int size() {
        return datasets.size();
    }
}
