package com.example.barshift.archive;

import com.example.barshift.exception.BusinessException;
import com.example.barshift.schedule.WeekSchedule;
import com.example.barshift.storage.JsonDocumentStore;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Archive of published weeks: {@code { "yyyy-MM-dd": { dayLabel: { shift: worker } } }}.
 * Entries are only ever added.
 */
@Repository
public class PublishedWeekRepository {

    static final String FILE_NAME = "published.json";

    private static final Logger logger = LoggerFactory.getLogger(PublishedWeekRepository.class);
    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, String>>>> TYPE =
            new TypeReference<>() {
            };

    private final JsonDocumentStore store;
    private final LinkedHashMap<String, LinkedHashMap<String, LinkedHashMap<String, String>>> weeks;

    public PublishedWeekRepository(JsonDocumentStore store) {
        this.store = store;
        this.weeks = store.load(FILE_NAME, TYPE, LinkedHashMap::new);
        logger.info("Loaded {} published weeks", weeks.size());
    }

    public boolean contains(LocalDate weekStart) {
        return weeks.containsKey(weekStart.toString());
    }

    public Optional<WeekSchedule> find(LocalDate weekStart) {
        LinkedHashMap<String, LinkedHashMap<String, String>> rows = weeks.get(weekStart.toString());
        return rows == null ? Optional.empty() : Optional.of(WeekSchedule.fromRows(weekStart, rows));
    }

    /**
     * Archived weeks in ascending date order. Keys that are not ISO dates are skipped.
     */
    public TreeMap<LocalDate, WeekSchedule> findAllChronological() {
        TreeMap<LocalDate, WeekSchedule> result = new TreeMap<>();
        weeks.forEach((key, rows) -> {
            try {
                LocalDate weekStart = LocalDate.parse(key);
                result.put(weekStart, WeekSchedule.fromRows(weekStart, rows));
            } catch (DateTimeParseException e) {
                logger.warn("Skipping archived week with unreadable key '{}': {}", key, e.getMessage());
            }
        });
        return result;
    }

    public List<String> keys() {
        return weeks.keySet().stream().sorted().toList();
    }

    /**
     * Adds a week to the archive and writes the document.
     *
     * @throws BusinessException when the week is already archived
     */
    public void save(WeekSchedule schedule) {
        String key = schedule.getWeekStart().toString();
        if (weeks.containsKey(key)) {
            throw new BusinessException(BusinessException.WEEK_ALREADY_PUBLISHED,
                    "Week " + key + " is already published", key);
        }
        weeks.put(key, schedule.toRows());
        try {
            store.save(FILE_NAME, weeks);
        } catch (BusinessException e) {
            weeks.remove(key);
            throw e;
        }
    }
}
