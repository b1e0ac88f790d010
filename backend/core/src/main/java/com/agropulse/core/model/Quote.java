package com.agropulse.core.model;

public record Quote(
        String key,
        String label,
        String value,
        String change,
        String unit,
        String source
) {
    public Quote {
        value = value == null ? "" : value;
        change = change == null ? "" : change;
    }
}
