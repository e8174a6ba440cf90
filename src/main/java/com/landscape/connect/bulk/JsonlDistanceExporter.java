package com.landscape.connect.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.storage.EntityStore;
import com.landscape.connect.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Writes every persisted distance as JSON Lines.
 *
 * <pre>
 * {"minimum1":1,"minimum2":2,"distance":0.75}
 * {"minimum1":1,"minimum2":3,"distance":1.2}
 * </pre>
 */
public class JsonlDistanceExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonlDistanceExporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    private final EntityStore store;
    private final ObjectMapper mapper;

    public JsonlDistanceExporter(EntityStore store) {
        this(store, new ObjectMapper());
    }

    public JsonlDistanceExporter(EntityStore store, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.mapper = Objects.requireNonNull(mapper, "mapper is required");
    }

    public ExportResult exportDistances(OutputStream output, ProgressCallback callback) {
        return exportDistances(new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    public ExportResult exportDistances(Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<DistanceEntry> entries = store.allDistances();
        long written = 0;
        try {
            BufferedWriter out = writer instanceof BufferedWriter b ? b : new BufferedWriter(writer);
            for (DistanceEntry entry : entries) {
                out.write(mapper.writeValueAsString(DistanceRecord.from(entry)));
                out.newLine();
                written++;
                if (written % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(written, entries.size(), "exporting distances");
                }
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Distance export failed after " + written + " entries", e);
        } catch (StoreException e) {
            log.error("Distance export aborted: {}", e.getMessage());
            throw e;
        }
        cb.onProgress(written, entries.size(), "export complete");
        log.info("bulk.exported distances={}", written);
        return new ExportResult(written);
    }
}
