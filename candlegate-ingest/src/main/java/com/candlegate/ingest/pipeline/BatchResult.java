package com.candlegate.ingest.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-symbol outcomes of a batch run. Every requested symbol is in exactly one of the maps.
 */
public record BatchResult(Map<String, PipelineResult> succeeded, Map<String, Exception> failed) {

    public BatchResult {
        succeeded = Collections.unmodifiableMap(new LinkedHashMap<>(succeeded));
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    public int size() {
        return succeeded.size() + failed.size();
    }
}
