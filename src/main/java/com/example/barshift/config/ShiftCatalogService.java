package com.example.barshift.config;

import com.example.barshift.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

@Service
public class ShiftCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftCatalogService.class);
    private static final Comparator<ShiftDefinition> BY_START = Comparator
            .comparingInt(ShiftDefinition::startHour)
            .thenComparingInt(ShiftDefinition::endHour)
            .thenComparing(ShiftDefinition::label);

    private final ShiftCatalogRepository repository;
    private final LinkedHashMap<String, Boolean> shifts;

    public ShiftCatalogService(ShiftCatalogRepository repository) {
        this.repository = repository;
        this.shifts = repository.load();
        logger.info("Loaded {} shift definitions", shifts.size());
    }

    public List<ShiftDefinition> list() {
        return shifts.entrySet().stream()
                .map(e -> ShiftDefinition.parse(e.getKey()).withActive(e.getValue()))
                .sorted(BY_START)
                .toList();
    }

    /**
     * Active shifts, parsed from the current catalog on every call.
     */
    public List<ShiftDefinition> activeShifts() {
        return list().stream().filter(ShiftDefinition::active).toList();
    }

    public boolean isEmpty() {
        return shifts.isEmpty();
    }

    public ShiftDefinition add(String label, boolean active) {
        ShiftDefinition definition = ShiftDefinition.parse(label).withActive(active);
        if (shifts.containsKey(definition.label())) {
            throw new BusinessException(BusinessException.DUPLICATE_SHIFT,
                    "Shift already exists: " + definition.label(), definition.label());
        }
        shifts.put(definition.label(), active);
        repository.save(shifts);
        logger.info("Added shift {} (active={})", definition.label(), active);
        return definition;
    }

    public ShiftDefinition setActive(String label, boolean active) {
        String key = requireKnown(label);
        shifts.put(key, active);
        repository.save(shifts);
        logger.info("Shift {} active -> {}", key, active);
        return ShiftDefinition.parse(key).withActive(active);
    }

    public ShiftDefinition toggle(String label) {
        String key = requireKnown(label);
        return setActive(key, !shifts.get(key));
    }

    public void remove(String label) {
        String key = requireKnown(label);
        shifts.remove(key);
        repository.save(shifts);
        logger.info("Removed shift {}", key);
    }

    private String requireKnown(String label) {
        String key = ShiftDefinition.parse(label).label();
        if (!shifts.containsKey(key)) {
            throw new BusinessException(BusinessException.UNKNOWN_SHIFT, "Unknown shift: " + key, key);
        }
        return key;
    }
}
