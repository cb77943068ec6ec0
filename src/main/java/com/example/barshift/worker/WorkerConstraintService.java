package com.example.barshift.worker;

import com.example.barshift.exception.BusinessException;
import com.example.barshift.schedule.WeekSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the worker roster and each worker's constraint record. Iteration order is the order
 * workers were added.
 */
@Service
public class WorkerConstraintService {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConstraintService.class);

    private final WorkerConstraintRepository repository;
    private final ConstraintTextParser parser;
    private final LinkedHashMap<String, WorkerConstraint> workers;

    public WorkerConstraintService(WorkerConstraintRepository repository, ConstraintTextParser parser) {
        this.repository = repository;
        this.parser = parser;
        this.workers = repository.load();
        logger.info("Loaded constraints for {} workers", workers.size());
    }

    public Map<String, WorkerConstraint> list() {
        return Collections.unmodifiableMap(workers);
    }

    public List<String> names() {
        return new ArrayList<>(workers.keySet());
    }

    public Optional<WorkerConstraint> find(String name) {
        return Optional.ofNullable(workers.get(name));
    }

    /**
     * @throws BusinessException {@code UNKNOWN_WORKER} when no record exists for {@code name}
     */
    public WorkerConstraint get(String name) {
        return workers.get(requireKnown(name));
    }

    public WorkerConstraint add(String name, WorkerConstraint constraint) {
        String key = requireName(name);
        if (workers.containsKey(key)) {
            throw new BusinessException(BusinessException.DUPLICATE_WORKER, "Worker already exists: " + key, key);
        }
        WorkerConstraint record = constraint == null ? WorkerConstraint.defaults() : constraint;
        workers.put(key, record);
        repository.save(workers);
        logger.info("Added worker {}", key);
        return record;
    }

    public void remove(String name) {
        String key = requireKnown(name);
        workers.remove(key);
        repository.save(workers);
        logger.info("Removed worker {}", key);
    }

    /**
     * Renames a worker in place, keeping its position and constraints.
     */
    public void rename(String oldName, String newName) {
        String from = requireKnown(oldName);
        String to = requireName(newName);
        if (from.equals(to)) {
            return;
        }
        if (workers.containsKey(to)) {
            throw new BusinessException(BusinessException.DUPLICATE_WORKER, "Worker already exists: " + to, to);
        }
        LinkedHashMap<String, WorkerConstraint> renamed = new LinkedHashMap<>();
        workers.forEach((name, constraint) -> renamed.put(name.equals(from) ? to : name, constraint));
        workers.clear();
        workers.putAll(renamed);
        repository.save(workers);
        logger.info("Renamed worker {} -> {}", from, to);
    }

    public WorkerConstraint update(String name, WorkerConstraint constraint) {
        String key = requireKnown(name);
        if (constraint == null) {
            throw new BusinessException(BusinessException.INVALID_CONSTRAINT, "Constraint record is required for " + key, key);
        }
        workers.put(key, constraint);
        repository.save(workers);
        logger.info("Updated constraints of {}: {}", key, constraint);
        return constraint;
    }

    /**
     * Replaces the worker's constraints with the ones read from {@code text}.
     */
    public ConstraintTextParser.ParsedConstraints applyText(String name, String text) {
        String key = requireKnown(name);
        ConstraintTextParser.ParsedConstraints parsed = parser.parse(text);
        workers.put(key, parsed.constraint());
        repository.save(workers);
        logger.info("Updated constraints of {} from text: {}", key, parsed.constraint());
        return parsed;
    }

    public ConstraintTextParser.ParsedConstraints preview(String text) {
        return parser.parse(text);
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessException(BusinessException.INVALID_WORKER_NAME, "Worker name is required");
        }
        String trimmed = name.trim();
        if (WeekSchedule.UNASSIGNED.equalsIgnoreCase(trimmed)) {
            throw new BusinessException(BusinessException.INVALID_WORKER_NAME,
                    "'" + WeekSchedule.UNASSIGNED + "' is reserved for open slots", trimmed);
        }
        return trimmed;
    }

    private String requireKnown(String name) {
        String key = requireName(name);
        if (!workers.containsKey(key)) {
            throw new BusinessException(BusinessException.UNKNOWN_WORKER, "Unknown worker: " + key, key);
        }
        return key;
    }
}
