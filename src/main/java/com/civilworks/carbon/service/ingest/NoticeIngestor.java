package com.civilworks.carbon.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.civilworks.carbon.config.AppProperties;
import com.civilworks.carbon.dto.IngestDtos;
import com.civilworks.carbon.model.ContractRecord;
import com.civilworks.carbon.util.CpvCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One paginated ingestion run over the OCDS notice search.
 *
 * <p>An instance owns the run's dedup set and accumulated records and is used once:
 * construct it, call {@link #run()}, read {@link #getRecords()}, discard it. Only the cursor
 * outlives the run.
 *
 * <h3>Run states</h3>
 * <ol>
 *   <li><strong>START</strong> - resume from the persisted cursor if any, else build the initial query</li>
 *   <li><strong>FETCHING</strong> - one GET through {@link RetryingFetcher}</li>
 *   <li><strong>FILTERING</strong> - CPV check, dedup, normalization of each release</li>
 *   <li><strong>ADVANCING</strong> - persist {@code links.next}, wait, loop</li>
 *   <li><strong>DONE</strong> / <strong>ABORTED</strong> - terminal; records gathered so far are kept in both</li>
 * </ol>
 */
public class NoticeIngestor {
    private static final Logger log = LoggerFactory.getLogger(NoticeIngestor.class);

    public enum State { START, FETCHING, FILTERING, ADVANCING, DONE, ABORTED }

    private final RetryingFetcher fetcher;
    private final CursorStore cursorStore;
    private final ObjectMapper objectMapper;
    private final AppProperties.Ingest config;
    private final Sleeper sleeper;

    private final Set<String> seenIds = new HashSet<>();
    private final List<ContractRecord> records = new ArrayList<>();
    private final IngestDtos.IngestReport report = new IngestDtos.IngestReport();
    private State state = State.START;

    public NoticeIngestor(RetryingFetcher fetcher, CursorStore cursorStore, ObjectMapper objectMapper,
                          AppProperties.Ingest config, Sleeper sleeper) {
        this.fetcher = fetcher;
        this.cursorStore = cursorStore;
        this.objectMapper = objectMapper;
        this.config = config;
        this.sleeper = sleeper;
    }

    public IngestDtos.IngestReport run() {
        if (state != State.START) {
            throw new IllegalStateException("Ingestor already ran; create a new instance per run");
        }
        log.info("Notice ingestion {} -> {} (accepted CPV prefixes {})",
                config.getPublishedFrom(), config.getPublishedTo(), config.getAcceptedCpvPrefixes());

        int page = 0;
        try {
            Optional<String> cursor = cursorStore.load();
            report.setResumed(cursor.isPresent());
            String nextUrl = cursor.orElse(null);
            if (nextUrl != null) {
                log.info("Resuming from saved cursor {}", nextUrl);
            }

            while (true) {
                page++;
                state = State.FETCHING;
                log.info("Fetching page {}... (saved {})", page, records.size());
                FetchResponse response = nextUrl == null
                        ? fetcher.fetch(searchUrl(), initialParams())
                        : fetcher.fetch(URI.create(nextUrl));
                report.setPages_fetched(page);

                if (!response.isOk()) {
                    log.error("Catalog returned HTTP {} on page {}; stopping, resume later from cursor", response.getStatus(), page);
                    abort("http_status_" + response.getStatus());
                    break;
                }

                JsonNode data = objectMapper.readTree(response.getBody());
                JsonNode releases = data.path("releases");
                if (!releases.isArray() || releases.isEmpty()) {
                    log.info("No more releases. End reached.");
                    state = State.DONE;
                    break;
                }

                state = State.FILTERING;
                for (JsonNode release : releases) {
                    accept(release);
                }

                state = State.ADVANCING;
                JsonNode next = data.path("links").path("next");
                if (!next.isTextual() || next.asText().isBlank()) {
                    log.info("Pagination complete.");
                    state = State.DONE;
                    break;
                }
                nextUrl = next.asText();
                cursorStore.save(nextUrl);
                sleeper.sleep(Duration.ofMillis(config.getPageDelayMs()));
            }
        } catch (Exception e) {
            log.error("[CRITICAL] Ingestion interrupted on page {}: {}", page, e.toString());
            abort(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        report.setOutcome(state == State.DONE ? IngestDtos.Outcome.DONE : IngestDtos.Outcome.ABORTED);
        report.setAccepted(records.size());
        log.info("Ingestion {}: {} contracts over {} pages ({} duplicates, {} unknown CPV, {} outside prefixes)",
                report.getOutcome(), records.size(), report.getPages_fetched(), report.getDuplicates(),
                report.getRejected_unknown_cpv(), report.getRejected_cpv_prefix());
        return report;
    }

    private void abort(String reason) {
        state = State.ABORTED;
        report.setFailure(reason);
    }

    private void accept(JsonNode release) {
        String ocid = text(release.get("ocid"));
        if (ocid == null || ocid.isEmpty()) {
            report.setMissing_id(report.getMissing_id() + 1);
            return;
        }
        if (seenIds.contains(ocid)) {
            report.setDuplicates(report.getDuplicates() + 1);
            return;
        }

        JsonNode tender = release.path("tender");
        String cpv = CpvCodes.extract(tender, release);
        if (CpvCodes.UNKNOWN.equals(cpv)) {
            report.setRejected_unknown_cpv(report.getRejected_unknown_cpv() + 1);
            return;
        }
        if (!CpvCodes.startsWithAny(cpv, config.getAcceptedCpvPrefixes())) {
            report.setRejected_cpv_prefix(report.getRejected_cpv_prefix() + 1);
            return;
        }

        ContractRecord r = new ContractRecord();
        r.setOcid(ocid);
        r.setTitle(textOr(tender.get("title"), "Unknown"));
        r.setDescription(truncate(textOr(tender.get("description"), ""), config.getDescriptionMaxLength()));
        r.setCpv_code(cpv);
        applyValue(r, tender, release);
        r.setPublished_date(text(release.get("date")));

        JsonNode buyer = release.path("buyer");
        r.setBuyer_name(textOr(buyer.get("name"), "Unknown"));
        r.setBuyer_country(buyerCountry(buyer, release.path("parties")));
        r.setTender_status(text(tender.get("status")));
        r.setSource(config.getSourceName());

        records.add(r);
        seenIds.add(ocid);
    }

    /** First of tender.value / release.value carrying an amount; otherwise zero in the default currency. */
    private void applyValue(ContractRecord r, JsonNode tender, JsonNode release) {
        for (JsonNode holder : List.of(tender, release)) {
            JsonNode value = holder.path("value");
            JsonNode amount = value.get("amount");
            if (value.isObject() && amount != null && !amount.isNull()) {
                // plain notation: 12500000.00 must not become "1.25E7"
                r.setValue_amount(amount.isNumber() ? amount.decimalValue().toPlainString() : amount.asText());
                r.setCurrency(textOr(value.get("currency"), config.getDefaultCurrency()));
                return;
            }
        }
        r.setValue_amount("0");
        r.setCurrency(config.getDefaultCurrency());
    }

    /** Country of the last {@code parties} entry whose id equals {@code buyer.id}. */
    private String buyerCountry(JsonNode buyer, JsonNode parties) {
        String country = config.getDefaultCountry();
        String buyerId = text(buyer.get("id"));
        if (buyerId != null && parties.isArray()) {
            for (JsonNode p : parties) {
                if (buyerId.equals(text(p.get("id")))) {
                    country = textOr(p.path("address").get("countryName"), config.getDefaultCountry());
                }
            }
        }
        return country;
    }

    /** Initial query parameters, used only when no cursor was persisted. */
    Map<String, Object> initialParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("limit", config.getPageSize());
        params.put("publishedFrom", config.getPublishedFrom());
        params.put("publishedTo", config.getPublishedTo());
        return params;
    }

    private String searchUrl() {
        return config.getBaseUrl() + config.getSearchPath();
    }

    private static String truncate(String s, int max) {
        return max > 0 && s.length() > max ? s.substring(0, max) : s;
    }

    private static String text(JsonNode n) {
        return n == null || n.isNull() || n.isContainerNode() ? null : n.asText();
    }

    private static String textOr(JsonNode n, String fallback) {
        String s = text(n);
        return s == null ? fallback : s;
    }

    public State getState() {
        return state;
    }

    public List<ContractRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }
}
