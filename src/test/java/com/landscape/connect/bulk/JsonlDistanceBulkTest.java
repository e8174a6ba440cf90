package com.landscape.connect.bulk;

import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.storage.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;

import static com.landscape.connect.testutil.LandscapeFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class JsonlDistanceBulkTest {

    private InMemoryEntityStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
    }

    @Nested
    @DisplayName("Import")
    class ImportTests {

        @Test
        @DisplayName("Should import valid rows and write them in chunks")
        void importValidRows() {
            String jsonl = """
                    {"minimum1":1,"minimum2":2,"distance":0.75}
                    {"minimum1":3,"minimum2":1,"distance":1.5}

                    {"minimum1":2,"minimum2":3,"distance":2.0}
                    """;
            JsonlDistanceImporter importer = new JsonlDistanceImporter(store, new ObjectMapper(), 2);

            ImportResult result = importer.importDistances(new StringReader(jsonl), null);

            assertEquals(3, result.totalRecords());
            assertEquals(3, result.distancesWritten());
            assertFalse(result.hasErrors());
            assertEquals(Optional.of(1.5), store.committedDistance(id(1), id(3)));
            assertEquals(2, store.bulkWriteCount());
        }

        @Test
        @DisplayName("Should report malformed rows and keep going")
        void malformedRows() {
            String jsonl = """
                    {"minimum1":1,"minimum2":2,"distance":0.75}
                    not json
                    {"minimum1":1,"distance":0.5}
                    {"minimum1":4,"minimum2":4,"distance":0.5}
                    {"minimum1":4,"minimum2":5,"distance":-1.0}
                    {"minimum1":4,"minimum2":5,"distance":3.0}
                    """;
            List<String> progress = new ArrayList<>();
            JsonlDistanceImporter importer = new JsonlDistanceImporter(store);

            ImportResult result = importer.importDistances(
                    new ByteArrayInputStream(jsonl.getBytes(StandardCharsets.UTF_8)),
                    (processed, total, message) -> progress.add(message));

            assertEquals(6, result.totalRecords());
            assertEquals(2, result.distancesWritten());
            assertEquals(4, result.errorCount());
            assertEquals(List.of(2L, 3L, 4L, 5L),
                    result.errors().stream().map(ImportResult.ImportError::lineNumber).toList());
            assertEquals(2, store.committedDistanceCount());
            assertEquals(List.of("import complete"), progress);
        }

        @Test
        @DisplayName("Should reject a non-positive chunk size")
        void chunkSizeValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> new JsonlDistanceImporter(store, new ObjectMapper(), 0));
        }
    }

    @Nested
    @DisplayName("Export")
    class ExportTests {

        @Test
        @DisplayName("Should write one JSON object per persisted distance")
        void exportRows() {
            store.bulkWriteDistances(List.of(
                    DistanceEntry.of(id(2), id(1), 0.75),
                    DistanceEntry.of(id(1), id(3), 1.5)));
            StringWriter writer = new StringWriter();

            ExportResult result = new JsonlDistanceExporter(store).exportDistances(writer, null);

            assertEquals(2, result.totalDistances());
            String[] lines = writer.toString().split("\\R");
            assertEquals(2, lines.length);
            assertEquals("{\"minimum1\":1,\"minimum2\":2,\"distance\":0.75}", lines[0]);
        }

        @Test
        @DisplayName("Exported distances can be loaded into another store")
        void exportThenImport() {
            store.bulkWriteDistances(List.of(
                    DistanceEntry.of(id(1), id(2), 0.75),
                    DistanceEntry.of(id(1), id(3), 1.5),
                    DistanceEntry.of(id(2), id(3), 2.25)));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            new JsonlDistanceExporter(store).exportDistances(out, ProgressCallback.NOOP);

            InMemoryEntityStore target = new InMemoryEntityStore();
            ImportResult result = new JsonlDistanceImporter(target)
                    .importDistances(new ByteArrayInputStream(out.toByteArray()), ProgressCallback.NOOP);

            assertEquals(3, result.distancesWritten());
            assertEquals(store.allDistances(), target.allDistances());
        }
    }
}
