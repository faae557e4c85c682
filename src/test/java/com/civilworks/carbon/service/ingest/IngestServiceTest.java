package com.civilworks.carbon.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.IngestDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.service.IngestService;
import com.civilworks.carbon.service.TableStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class IngestServiceTest {

    @TempDir
    Path dir;

    private AppProperties props;
    private TableStore store;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        props.setDataDir(dir.toString());
        props.getIngest().setBaseUrl("https://catalog.test");
        store = new TableStore(new CsvMapper(), props);
    }

    private IngestService service(StubExchange stub) {
        Sleeper noWait = d -> { };
        return new IngestService(new RetryingFetcher(stub.client(), props, noWait), new CursorStore(props),
                new ObjectMapper(), props, noWait, store);
    }

    @Test
    public void abortedRunStillWritesWhatWasCollected() {
        StubExchange stub = new StubExchange()
                .thenJson(200, "{\"releases\":[{\"ocid\":\"ocds-1\",\"tender\":{\"title\":\"Road\","
                        + "\"classification\":{\"id\":\"45233140\"}}}],"
                        + "\"links\":{\"next\":\"https://catalog.test/next?cursor=2\"}}")
                .thenJson(500, "oops");

        IngestDtos.IngestReport report = service(stub).ingest();

        assertEquals(IngestDtos.Outcome.ABORTED, report.getOutcome());
        assertNotNull(report.getOutput_path());
        List<ContractRecord> saved = store.readContracts(Path.of(report.getOutput_path()));
        assertEquals(1, saved.size());
        assertEquals("Road", saved.get(0).getTitle());
        assertEquals("UK Contracts Finder", saved.get(0).getSource());
    }

    private static String page(String next, String... ocids) {
        StringBuilder sb = new StringBuilder("{\"releases\":[");
        for (int i = 0; i < ocids.length; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"ocid\":\"").append(ocids[i]).append("\",\"tender\":{\"title\":\"Road\",")
                    .append("\"classification\":{\"id\":\"45233140\"}}}");
        }
        sb.append(']');
        if (next != null) {
            sb.append(",\"links\":{\"next\":\"").append(next).append("\"}");
        }
        return sb.append('}').toString();
    }

    private List<String> savedIds() {
        return store.readContracts(store.resolve(props.getFiles().getIngested())).stream()
                .map(ContractRecord::getOcid).collect(Collectors.toList());
    }

    @Test
    public void resumedRunAppendsToPreviousTable() {
        service(new StubExchange()
                .thenJson(200, page("https://catalog.test/next?cursor=2", "ocds-1", "ocds-2"))
                .thenConnectionRefused(10)).ingest();
        assertEquals(List.of("ocds-1", "ocds-2"), savedIds());

        StubExchange resumed = new StubExchange().thenJson(200, page(null, "ocds-2", "ocds-3"));
        IngestDtos.IngestReport report = service(resumed).ingest();

        assertTrue(report.isResumed());
        assertEquals("https://catalog.test/next?cursor=2", resumed.requests.get(0).toString());
        assertEquals(List.of("ocds-1", "ocds-2", "ocds-3"), savedIds());
    }

    @Test
    public void freshRunReplacesPreviousTable() {
        service(new StubExchange().thenJson(200, page(null, "ocds-old"))).ingest();

        service(new StubExchange().thenJson(200, page(null, "ocds-new"))).ingest();

        assertEquals(List.of("ocds-new"), savedIds());
    }

    @Test
    public void nothingIsWrittenWhenNoContractMatched() {
        StubExchange stub = new StubExchange().thenJson(200, "{\"releases\":[]}");

        IngestDtos.IngestReport report = service(stub).ingest();

        assertEquals(IngestDtos.Outcome.DONE, report.getOutcome());
        assertNull(report.getOutput_path());
        assertFalse(Files.exists(store.resolve(props.getFiles().getIngested())));
    }
}
