package com.example.barshift.storage;

import com.example.barshift.exception.BusinessException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonDocumentStoreTest {

    private static final TypeReference<LinkedHashMap<String, Boolean>> TYPE = new TypeReference<>() {
    };

    @TempDir
    Path dir;

    @Test
    void load_missingFile_returnsEmptyState() {
        JsonDocumentStore store = new JsonDocumentStore(dir.resolve("not-yet-created"));

        assertThat(store.load("shifts.json", TYPE, LinkedHashMap::new)).isEmpty();
    }

    @Test
    void load_malformedOrBlankFile_returnsEmptyState() throws Exception {
        Files.writeString(dir.resolve("broken.json"), "{ \"10-18\": tru");
        Files.writeString(dir.resolve("blank.json"), "   ");
        Files.writeString(dir.resolve("null.json"), "null");
        JsonDocumentStore store = new JsonDocumentStore(dir);

        assertThat(store.load("broken.json", TYPE, LinkedHashMap::new)).isEmpty();
        assertThat(store.load("blank.json", TYPE, LinkedHashMap::new)).isEmpty();
        assertThat(store.load("null.json", TYPE, LinkedHashMap::new)).isEmpty();
    }

    @Test
    void save_createsDirectoryAndKeepsKeyOrder() {
        JsonDocumentStore store = new JsonDocumentStore(dir.resolve("nested/data"));
        Map<String, Boolean> shifts = new LinkedHashMap<>();
        shifts.put("18-26", true);
        shifts.put("10-18", false);

        store.save("shifts.json", shifts);

        assertThat(Files.exists(dir.resolve("nested/data/shifts.json"))).isTrue();
        assertThat(store.load("shifts.json", TYPE, LinkedHashMap::new))
                .containsExactly(Map.entry("18-26", true), Map.entry("10-18", false));
    }

    @Test
    void save_unwritableLocation_raisesPersistenceError() throws Exception {
        Path blocker = dir.resolve("occupied");
        Files.writeString(blocker, "a file, not a directory");
        JsonDocumentStore store = new JsonDocumentStore(blocker);

        assertThatThrownBy(() -> store.save("shifts.json", Map.of("10-18", true)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(BusinessException.PERSISTENCE_ERROR);
    }
}
