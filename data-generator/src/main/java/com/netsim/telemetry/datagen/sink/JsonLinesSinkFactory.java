package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.model.record.TableType;

import java.nio.file.Path;

/**
 * One {@code <outputName>.jsonl} file per table under a base directory. Names
 * that already carry an extension are used as given.
 */
public class JsonLinesSinkFactory implements SinkFactory {

    private final Path outputDir;

    public JsonLinesSinkFactory(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public RecordSink open(TableType table, String outputName) {
        return new JsonLinesFileSink(resolve(outputName));
    }

    public Path resolve(String outputName) {
        String fileName = outputName.contains(".") ? outputName : outputName + ".jsonl";
        return outputDir.resolve(fileName);
    }
}
