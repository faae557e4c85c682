package com.civilworks.carbon.service.ingest;

import java.net.URI;

/**
 * Every attempt of a GET failed at the transport level. Terminates the ingestion run.
 */
public class FetchExhaustedException extends RuntimeException {
    private final URI uri;
    private final int attempts;

    public FetchExhaustedException(URI uri, int attempts, Throwable lastFailure) {
        super("Max retries exceeded (" + attempts + ") fetching " + uri + ", aborting request", lastFailure);
        this.uri = uri;
        this.attempts = attempts;
    }

    public URI getUri() {
        return uri;
    }

    public int getAttempts() {
        return attempts;
    }
}
