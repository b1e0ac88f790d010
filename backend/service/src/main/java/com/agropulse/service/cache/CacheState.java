package com.agropulse.service.cache;

public enum CacheState {
    EMPTY,
    POPULATING,
    FRESH,
    STALE
}
