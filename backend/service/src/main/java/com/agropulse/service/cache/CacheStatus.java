package com.agropulse.service.cache;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public record CacheStatus(
        String name,
        CacheState state,
        Instant generatedAt,
        int itemCount,
        List<String> degradedSources,
        long ttlSeconds,
        Instant lastFailureAt,
        String lastErrorMessage
) {
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("name", name);
        map.put("state", state.name());
        map.put("generatedAt", generatedAt == null ? null : generatedAt.toString());
        map.put("itemCount", itemCount);
        map.put("degradedSources", degradedSources);
        map.put("ttlSeconds", ttlSeconds);
        map.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
        map.put("lastErrorMessage", lastErrorMessage);
        return map;
    }
}
