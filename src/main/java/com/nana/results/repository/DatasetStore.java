package com.nana.results.repository;

import com.nana.results.domain.Dataset;

import java.util.List;
import java.util.Optional;

/**
 * DatasetStore - Repository Layer Interface for Uploaded Mark Sheets
 *
 * <p>Holds the decoded {@link Dataset} snapshots of the current session,
 * keyed by a display name (usually the file name or a branch label).
 * The engine receives the store through its constructor; there is no
 * global dataset.
 *
 * <p>Nothing is persisted across sessions.
 *
 * <p>EXCEPTION STRATEGY:
 * Lookups by name that must succeed throw {@link StoreException}, an
 * unchecked exception, when the name is unknown. Optional lookups return
 * {@link Optional}.
 */
public interface DatasetStore {

    /**
     * Stores a dataset under its own name, replacing any earlier dataset
     * with the same name.
     *
     * @param dataset the snapshot; must not be null and must have a
     *                non-blank name
     * @throws StoreException if the dataset has no name
     */
    void put(Dataset dataset);

    /**
     * Returns the dataset stored under {@code name}.
     *
     * @param name dataset name
     * @return the dataset
     * @throws StoreException if no dataset has that name
     */
    Dataset get(String name);

    /**
     * @param name dataset name
     * @return the dataset, or empty if unknown
     */
    Optional<Dataset> find(String name);

    /** @return stored dataset names in insertion order */
    List<String> names();

    /**
     * Removes a dataset.
     *
     * @param name dataset name
     * @return true if a dataset was removed
     */
    boolean remove(String name);

    /** @return number of stored datasets */
    int size();

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * StoreException - Unchecked Dataset Store Failure
     *
     * <p>Thrown for lookups of unknown dataset names and for datasets that
     * cannot be stored.
     */
    class StoreException extends RuntimeException {

        public StoreException(String message) {
            super(message);
        }

        public StoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
