package com.agropulse.collectors.fetch;

import java.net.URI;

public class FetchException extends Exception {
    public enum Kind {
        UNREACHABLE,
        BAD_STATUS,
        TIMEOUT
    }

    private final Kind kind;
    private final URI uri;
    private final int statusCode;

    public FetchException(Kind kind, URI uri, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.uri = uri;
        this.statusCode = statusCode;
    }

    public static FetchException badStatus(URI uri, int statusCode) {
        return new FetchException(Kind.BAD_STATUS, uri, statusCode, "HTTP status " + statusCode + " from " + uri, null);
    }

    public Kind kind() {
        return kind;
    }

    public URI uri() {
        return uri;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean transientFailure() {
        return switch (kind) {
            case UNREACHABLE, TIMEOUT -> true;
            case BAD_STATUS -> statusCode >= 500;
        };
    }
}
