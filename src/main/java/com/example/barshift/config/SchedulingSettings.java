package com.example.barshift.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class SchedulingSettings {

    private final Path storageDirectory;
    private final int minRestHours;
    private final int saturdayStreakLimit;
    private final int publishStreakLimit;
    private final boolean seedDefaults;

    public SchedulingSettings(
            @Value("${barshift.storage.directory:data}") String storageDirectory,
            @Value("${barshift.rules.min-rest-hours:8}") int minRestHours,
            @Value("${barshift.rules.saturday-streak-limit:3}") int saturdayStreakLimit,
            @Value("${barshift.rules.publish-streak-limit:4}") int publishStreakLimit,
            @Value("${barshift.seed-defaults:true}") boolean seedDefaults) {
        this.storageDirectory = Path.of(storageDirectory);
        this.minRestHours = minRestHours;
        this.saturdayStreakLimit = saturdayStreakLimit;
        this.publishStreakLimit = publishStreakLimit;
        this.seedDefaults = seedDefaults;
    }

    /** Settings with the stock rule values, stored under {@code storageDirectory}. */
    public static SchedulingSettings defaults(Path storageDirectory) {
        return new SchedulingSettings(storageDirectory.toString(), 8, 3, 4, false);
    }

    public Path getStorageDirectory() { return storageDirectory; }

    /** Minimum hours between the end of one shift and the start of the worker's next one. */
    public int getMinRestHours() { return minRestHours; }

    /** Workers at or above this many consecutive Saturdays are skipped on Saturday when possible. */
    public int getSaturdayStreakLimit() { return saturdayStreakLimit; }

    /** Publishing is refused once any worker would reach this many consecutive Saturdays. */
    public int getPublishStreakLimit() { return publishStreakLimit; }

    public boolean isSeedDefaults() { return seedDefaults; }
}
