package com.example.barshift.storage;

import com.example.barshift.config.SchedulingSettings;
import com.example.barshift.exception.BusinessException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Reads and writes the flat JSON documents kept in the storage directory.
 * <p>
 * A missing or unreadable document loads as empty state. An unreadable document is only
 * reported as a warning, so its previous content is lost on the next save.
 */
@Component
public class JsonDocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final Path directory;
    private final ObjectMapper mapper;

    @Autowired
    public JsonDocumentStore(SchedulingSettings settings) {
        this(settings.getStorageDirectory());
    }

    public JsonDocumentStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public <T> T load(String fileName, TypeReference<T> type, Supplier<T> empty) {
        Path path = directory.resolve(fileName);
        if (!Files.exists(path)) {
            logger.info("{} not found, starting empty", path);
            return empty.get();
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            T value = json.isBlank() ? null : mapper.readValue(json, type);
            if (value == null) {
                logger.warn("{} is empty, starting empty", path);
                return empty.get();
            }
            return value;
        } catch (IOException e) {
            logger.warn("Could not read {}, starting empty: {}", path, e.getMessage());
            return empty.get();
        }
    }

    public void save(String fileName, Object value) {
        Path path = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            Files.writeString(path, mapper.writeValueAsString(value), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BusinessException(BusinessException.PERSISTENCE_ERROR,
                    "Could not write " + path, e, path);
        }
    }
}
