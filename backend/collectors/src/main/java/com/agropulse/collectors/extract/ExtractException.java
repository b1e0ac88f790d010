package com.agropulse.collectors.extract;

public class ExtractException extends Exception {
    public enum Kind {
        UNPARSEABLE,
        MISSING_REQUIRED_FIELD
    }

    private final Kind kind;

    public ExtractException(Kind kind, String message) {
        this(kind, message, null);
    }

    public ExtractException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ExtractException missing(String field, String url) {
        return new ExtractException(Kind.MISSING_REQUIRED_FIELD, "Missing " + field + " for " + url);
    }

    public Kind kind() {
        return kind;
    }
}
