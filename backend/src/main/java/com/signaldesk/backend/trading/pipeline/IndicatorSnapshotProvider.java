package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.model.IndicatorSnapshot;

import java.util.Optional;

public interface IndicatorSnapshotProvider {
    Optional<IndicatorSnapshot> getSnapshot(String symbol);
}
