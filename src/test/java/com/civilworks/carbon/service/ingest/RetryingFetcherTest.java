package com.civilworks.carbon.service.ingest;

import com.civilworks.carbon.config.AppProperties;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RetryingFetcherTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryingFetcher fetcher(StubExchange stub, int maxAttempts) {
        AppProperties props = new AppProperties();
        props.getFetch().setMaxAttempts(maxAttempts);
        props.getFetch().setBackoffBaseSeconds(2);
        return new RetryingFetcher(stub.client(), props, sleeps::add);
    }

    @Test
    public void exhaustedRetriesAbortWithFatalError() {
        StubExchange stub = new StubExchange().thenConnectionRefused(10);
        RetryingFetcher f = fetcher(stub, 3);

        FetchExhaustedException ex = assertThrows(FetchExhaustedException.class,
                () -> f.fetch(URI.create("https://catalog.test/page")));

        assertEquals(3, ex.getAttempts());
        assertEquals(3, stub.requests.size(), "one request per attempt, then stop");
        // linear backoff between attempts, no wait after the last one
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    public void transientFailureIsRetriedUntilSuccess() {
        StubExchange stub = new StubExchange()
                .thenConnectionRefused(2)
                .thenJson(200, "{\"releases\":[]}");

        FetchResponse r = fetcher(stub, 5).fetch(URI.create("https://catalog.test/page"));

        assertTrue(r.isOk());
        assertEquals("{\"releases\":[]}", r.getBody());
        assertEquals(3, stub.requests.size());
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    public void httpErrorStatusIsReturnedWithoutRetry() {
        StubExchange stub = new StubExchange().thenJson(503, "{\"error\":\"busy\"}");

        FetchResponse r = fetcher(stub, 5).fetch(URI.create("https://catalog.test/page"));

        assertEquals(503, r.getStatus());
        assertFalse(r.isOk());
        assertEquals(1, stub.requests.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void queryParamsAreAppendedToUrl() {
        StubExchange stub = new StubExchange().thenJson(200, "{}");

        fetcher(stub, 1).fetch("https://catalog.test/Search", Map.of("limit", 100));

        assertEquals("https://catalog.test/Search?limit=100", stub.requests.get(0).toString());
    }
}
