package com.agropulse.core.model;

import java.time.Instant;
import java.util.List;

public interface Timestamped {
    Instant generatedAt();

    int size();

    default List<String> degradedSources() {
        return List.of();
    }
}
