package com.netsim.telemetry.datagen.synth;

import java.util.List;

/**
 * Read access to the recent DDM observations of a module, oldest first.
 */
public interface DdmHistoryView {

    List<DdmObservation> recent(String moduleId);
}
