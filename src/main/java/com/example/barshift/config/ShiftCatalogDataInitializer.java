package com.example.barshift.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ShiftCatalogDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ShiftCatalogDataInitializer.class);

    static final List<String> DEFAULT_SHIFTS = List.of("10-18", "14-22", "18-2");

    private final ShiftCatalogService catalogService;
    private final SchedulingSettings settings;

    public ShiftCatalogDataInitializer(ShiftCatalogService catalogService, SchedulingSettings settings) {
        this.catalogService = catalogService;
        this.settings = settings;
    }

    @Override
    public void run(String... args) {
        if (!settings.isSeedDefaults() || !catalogService.isEmpty()) {
            return;
        }
        DEFAULT_SHIFTS.forEach(label -> catalogService.add(label, true));
        logger.info("Seeded empty shift catalog with {}", DEFAULT_SHIFTS);
    }
}
