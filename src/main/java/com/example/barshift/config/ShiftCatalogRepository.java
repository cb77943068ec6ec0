package com.example.barshift.config;

import com.example.barshift.storage.JsonDocumentStore;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shift catalog document: {@code { "start-end": active }}.
 */
@Repository
public class ShiftCatalogRepository {

    static final String FILE_NAME = "shifts.json";

    private static final Logger logger = LoggerFactory.getLogger(ShiftCatalogRepository.class);
    private static final TypeReference<LinkedHashMap<String, Boolean>> TYPE = new TypeReference<>() {
    };

    private final JsonDocumentStore store;

    public ShiftCatalogRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public LinkedHashMap<String, Boolean> load() {
        LinkedHashMap<String, Boolean> raw = store.load(FILE_NAME, TYPE, LinkedHashMap::new);
        LinkedHashMap<String, Boolean> catalog = new LinkedHashMap<>();
        raw.forEach((label, active) -> {
            if (!ShiftDefinition.isValid(label)) {
                logger.warn("Dropping invalid shift label from {}: {}", FILE_NAME, label);
                return;
            }
            catalog.put(ShiftDefinition.parse(label).label(), Boolean.TRUE.equals(active));
        });
        return catalog;
    }

    public void save(Map<String, Boolean> catalog) {
        store.save(FILE_NAME, catalog);
    }
}
