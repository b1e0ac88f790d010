package com.agropulse.collectors.fetch;

import com.agropulse.collectors.config.FetchSettings;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

public class HttpSourceFetcher implements SourceFetcher {
    private static final Logger LOGGER = Logger.getLogger(HttpSourceFetcher.class.getName());

    private final HttpClient httpClient;
    private final FetchSettings settings;
    private final Clock clock;

    public HttpSourceFetcher(HttpClient httpClient, FetchSettings settings, Clock clock) {
        this.httpClient = httpClient;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<RawDocument> fetch(URI uri) {
        return attempt(uri, 0);
    }

    private CompletableFuture<RawDocument> attempt(URI uri, int attempt) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(settings.timeout())
                .header("User-Agent", settings.userAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .orTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> error != null ? Attempt.failed(classify(uri, error)) : toAttempt(uri, response))
                .thenCompose(outcome -> {
                    if (outcome.document() != null) {
                        return CompletableFuture.completedFuture(outcome.document());
                    }
                    FetchException failure = outcome.failure();
                    if (failure.transientFailure() && attempt < settings.retries()) {
                        LOGGER.log(Level.FINE, "Retrying " + uri + " after " + failure.getMessage());
                        return attempt(uri, attempt + 1);
                    }
                    return CompletableFuture.failedFuture(failure);
                });
    }

    private Attempt toAttempt(URI uri, HttpResponse<byte[]> response) {
        if (response.statusCode() != 200) {
            return Attempt.failed(FetchException.badStatus(uri, response.statusCode()));
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        try {
            String body = decode(response.body(), charsetOf(contentType));
            String finalUrl = response.uri() == null ? uri.toString() : response.uri().toString();
            return Attempt.succeeded(new RawDocument(finalUrl, clock.instant(), body));
        } catch (CharacterCodingException | IllegalCharsetNameException | UnsupportedCharsetException e) {
            return Attempt.failed(new FetchException(
                    FetchException.Kind.BAD_STATUS,
                    uri,
                    response.statusCode(),
                    "Undecodable body from " + uri + " (" + contentType + ")",
                    e
            ));
        }
    }

    static Charset charsetOf(String contentType) {
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                return Charset.forName(name);
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String decode(byte[] bytes, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static FetchException classify(URI uri, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        if (root instanceof HttpTimeoutException || root instanceof TimeoutException) {
            return new FetchException(FetchException.Kind.TIMEOUT, uri, 0, "Request timed out while fetching " + uri, root);
        }
        if (root instanceof UnknownHostException) {
            return new FetchException(FetchException.Kind.UNREACHABLE, uri, 0, "DNS/unknown host while fetching " + uri + ": " + rootText, root);
        }
        if (root instanceof ConnectException) {
            return new FetchException(FetchException.Kind.UNREACHABLE, uri, 0, "Connection refused while fetching " + uri, root);
        }
        return new FetchException(FetchException.Kind.UNREACHABLE, uri, 0, "Fetch failure for " + uri + ": " + rootText, root);
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record Attempt(RawDocument document, FetchException failure) {
        private static Attempt succeeded(RawDocument document) {
            return new Attempt(document, null);
        }

        private static Attempt failed(FetchException failure) {
            return new Attempt(null, failure);
        }
    }
}
