package com.example.barshift.worker;

import com.example.barshift.storage.JsonDocumentStore;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Worker constraints document: {@code { name: { allowedShifts, restrictedDays, restrictedShifts, maxShifts } }}.
 */
@Repository
public class WorkerConstraintRepository {

    static final String FILE_NAME = "workers.json";

    private static final TypeReference<LinkedHashMap<String, WorkerConstraint>> TYPE = new TypeReference<>() {
    };

    private final JsonDocumentStore store;

    public WorkerConstraintRepository(JsonDocumentStore store) {
        this.store = store;
    }

    public LinkedHashMap<String, WorkerConstraint> load() {
        LinkedHashMap<String, WorkerConstraint> workers = store.load(FILE_NAME, TYPE, LinkedHashMap::new);
        workers.replaceAll((name, constraint) -> constraint == null ? WorkerConstraint.defaults() : constraint);
        return workers;
    }

    public void save(Map<String, WorkerConstraint> workers) {
        store.save(FILE_NAME, workers);
    }
}
