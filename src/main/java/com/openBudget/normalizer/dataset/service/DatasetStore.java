package com.openBudget.normalizer.dataset.service;

import com.openBudget.normalizer.dataset.exception.DatasetStoreException;
import com.openBudget.normalizer.dataset.model.Dataset;

import java.util.List;

/**
 * Read-only access to reference datasets by identifier.
 */
public interface DatasetStore {

    /**
     * Loads a dataset.
     *
     * @param id Dataset identifier
     * @return The parsed dataset
     * @throws DatasetStoreException if the dataset is missing or cannot be parsed
     */
    Dataset getById(String id) throws DatasetStoreException;

    /**
     * Lists the identifiers of every dataset the store can serve.
     */
    List<String> listAvailable() throws DatasetStoreException;
}
