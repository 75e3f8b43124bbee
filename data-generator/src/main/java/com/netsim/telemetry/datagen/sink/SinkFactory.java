package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.model.record.TableType;

/**
 * Opens one sink per table. The output name is forwarded from the request
 * untouched; what it means (file name, topic) is up to the factory.
 */
public interface SinkFactory {

    RecordSink open(TableType table, String outputName);
}
