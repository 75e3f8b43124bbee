package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.error.SinkWriteException;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import com.netsim.telemetry.shared.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one JSON object per line to a file. The file is created (or
 * truncated) when the sink opens, so a zero-row table still leaves an empty
 * file behind.
 */
public class JsonLinesFileSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesFileSink.class);

    private final Path file;
    private BufferedWriter writer;
    private long rows;

    public JsonLinesFileSink(Path file) {
        this.file = file;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SinkWriteException("Cannot open " + file, e);
        }
    }

    @Override
    public void emit(List<? extends TelemetryRecord> batch) {
        if (writer == null) {
            throw new SinkWriteException("Sink for " + file + " is already closed", new IllegalStateException("closed"));
        }
        try {
            for (TelemetryRecord record : batch) {
                writer.write(JsonUtil.toJsonLine(record));
                writer.newLine();
            }
            writer.flush();
            rows += batch.size();
        } catch (IOException e) {
            throw new SinkWriteException("Failed writing to " + file, e);
        }
    }

    @Override
    public void finish(String tableName) {
        close();
        log.info("Wrote {} {} rows to {}", rows, tableName, file);
    }

    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            throw new SinkWriteException("Failed closing " + file, e);
        } finally {
            writer = null;
        }
    }

    public Path getFile() {
        return file;
    }
}
