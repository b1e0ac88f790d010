package com.agropulse.collectors.api;

import com.agropulse.core.model.Timestamped;

import java.util.concurrent.CompletableFuture;

public interface Collector<T extends Timestamped> {
    String name();

    CompletableFuture<T> collect(CollectorContext ctx);
}
