package com.landscape.connect.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.storage.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads JSON Lines distance rows into the store in bulk chunks.
 * Malformed lines are skipped and reported in the {@link ImportResult}.
 */
public class JsonlDistanceImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonlDistanceImporter.class);
    private static final int DEFAULT_CHUNK_SIZE = 300;

    private final EntityStore store;
    private final ObjectMapper mapper;
    private final int chunkSize;

    public JsonlDistanceImporter(EntityStore store) {
        this(store, new ObjectMapper(), DEFAULT_CHUNK_SIZE);
    }

    public JsonlDistanceImporter(EntityStore store, ObjectMapper mapper, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        this.store = Objects.requireNonNull(store, "store is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
        this.chunkSize = chunkSize;
    }

    public ImportResult importDistances(InputStream input, ProgressCallback callback) {
        return importDistances(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ImportResult importDistances(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<ImportResult.ImportError> errors = new ArrayList<>();
        List<DistanceEntry> chunk = new ArrayList<>(chunkSize);
        long totalRecords = 0;
        long written = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                totalRecords++;
                try {
                    chunk.add(mapper.readValue(line, DistanceRecord.class).toEntry());
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, line, e.getMessage()));
                    continue;
                }
                if (chunk.size() >= chunkSize) {
                    written += writeChunk(chunk);
                    cb.onProgress(totalRecords, -1, "importing distances");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Distance import failed after " + totalRecords + " records", e);
        }
        written += writeChunk(chunk);
        cb.onProgress(totalRecords, totalRecords, "import complete");

        ImportResult result = new ImportResult(totalRecords, written, errors);
        log.info("bulk.imported records={} written={} errors={}", totalRecords, written, errors.size());
        return result;
    }

    private int writeChunk(List<DistanceEntry> chunk) {
        if (chunk.isEmpty()) {
            return 0;
        }
        int size = chunk.size();
        store.bulkWriteDistances(new ArrayList<>(chunk));
        chunk.clear();
        return size;
    }
}
