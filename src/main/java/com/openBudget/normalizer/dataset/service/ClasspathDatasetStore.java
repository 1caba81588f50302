package com.openBudget.normalizer.dataset.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openBudget.normalizer.dataset.exception.DatasetStoreException;
import com.openBudget.normalizer.dataset.exception.DatasetStoreException.ErrorType;
import com.openBudget.normalizer.dataset.model.Dataset;
import com.openBudget.normalizer.dataset.model.DatasetFile;
import com.openBudget.normalizer.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dataset store backed by JSON files on the classpath.
 *
 * The directory is described by an index file listing the dataset file names.
 * The index (dataset id -> file) is built on first use; a failed build is not
 * remembered, so the next call retries. Parsed datasets are cached with Caffeine.
 */
@Slf4j
public class ClasspathDatasetStore implements DatasetStore {

    private final String rootDir;
    private final String indexFile;
    private final DatasetParser parser = new DatasetParser();
    private final Cache<String, Dataset> cache;

    private volatile Map<String, String> index;

    public ClasspathDatasetStore(String rootDir, String indexFile, long cacheMaxSize, Duration cacheTtl) {
        this.rootDir = rootDir;
        this.indexFile = indexFile;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheMaxSize)
                .expireAfterWrite(cacheTtl)
                .build();
    }

    @Override
    public Dataset getById(String id) throws DatasetStoreException {
        Dataset cached = cache.getIfPresent(id);
        if (cached != null) {
            return cached;
        }

        String path = ensureIndex().get(id);
        if (path == null) {
            throw new DatasetStoreException(ErrorType.NOT_FOUND,
                    "Dataset id '" + id + "' not found under " + rootDir);
        }

        DatasetFile file = readDatasetFile(path);
        if (!id.equals(file.getMetadata().getId())) {
            throw new DatasetStoreException(ErrorType.ID_MISMATCH,
                    "metadata.id '" + file.getMetadata().getId() + "' does not match requested id '" + id + "'");
        }

        Dataset dataset = parser.parse(file, path);
        cache.put(id, dataset);
        log.debug("Loaded dataset - id: {}, points: {}, frequency: {}",
                id, dataset.getPoints().size(), dataset.getFrequency());
        return dataset;
    }

    @Override
    public List<String> listAvailable() throws DatasetStoreException {
        return new ArrayList<>(ensureIndex().keySet());
    }

    private Map<String, String> ensureIndex() throws DatasetStoreException {
        Map<String, String> current = index;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (index == null) {
                index = buildIndex();
                log.info("Indexed datasets - root: {}, count: {}", rootDir, index.size());
            }
            return index;
        }
    }

    private Map<String, String> buildIndex() throws DatasetStoreException {
        String indexPath = rootDir + "/" + indexFile;
        String[] fileNames;
        try {
            fileNames = JsonFileLoader.loadAsObject(indexPath, String[].class);
        } catch (JsonFileLoader.ResourceNotFoundException e) {
            throw new DatasetStoreException(ErrorType.NOT_FOUND,
                    "Datasets index not found at " + indexPath, e);
        } catch (IOException e) {
            throw new DatasetStoreException(ErrorType.READ_ERROR,
                    "Failed to read datasets index at " + indexPath + ": " + e.getMessage(), e);
        }

        Map<String, String> idToPath = new LinkedHashMap<>();
        for (String fileName : fileNames) {
            String path = rootDir + "/" + fileName;
            DatasetFile file = readDatasetFile(path);
            String id = file.getMetadata() != null ? file.getMetadata().getId() : null;
            if (id == null || id.isBlank()) {
                throw new DatasetStoreException(ErrorType.SCHEMA_VALIDATION,
                        "Dataset file " + path + " has no metadata.id");
            }
            String existing = idToPath.putIfAbsent(id, path);
            if (existing != null) {
                throw new DatasetStoreException(ErrorType.DUPLICATE_ID,
                        "Dataset id '" + id + "' is defined in multiple files: " + existing + " and " + path);
            }
        }
        return Collections.unmodifiableMap(idToPath);
    }

    private DatasetFile readDatasetFile(String path) throws DatasetStoreException {
        String contents;
        try {
            contents = JsonFileLoader.loadAsString(path);
        } catch (JsonFileLoader.ResourceNotFoundException e) {
            throw new DatasetStoreException(ErrorType.NOT_FOUND, "Dataset file not found at " + path, e);
        } catch (IOException e) {
            throw new DatasetStoreException(ErrorType.READ_ERROR,
                    "Failed to read dataset file at " + path + ": " + e.getMessage(), e);
        }

        try {
            DatasetFile file = JsonFileLoader.parse(contents, DatasetFile.class);
            if (file == null) {
                throw new DatasetStoreException(ErrorType.SCHEMA_VALIDATION, "Empty dataset file at " + path);
            }
            return file;
        } catch (JsonProcessingException e) {
            throw new DatasetStoreException(ErrorType.PARSE_ERROR,
                    "Failed to parse JSON at " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DatasetStoreException(ErrorType.READ_ERROR,
                    "Failed to read dataset file at " + path + ": " + e.getMessage(), e);
        }
    }
}
