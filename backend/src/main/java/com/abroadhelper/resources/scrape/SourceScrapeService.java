package com.abroadhelper.resources.scrape;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.http.PoliteHttpClient;
import com.abroadhelper.resources.model.BulkUpsertSummary;
import com.abroadhelper.resources.model.FetchOutcome;
import com.abroadhelper.resources.model.ResourceRecord;
import com.abroadhelper.resources.model.ScrapeRunSummary;
import com.abroadhelper.resources.model.SourceScrapeResult;
import com.abroadhelper.resources.model.SourceScrapeStatus;
import com.abroadhelper.resources.robots.RobotsTxtService;
import com.abroadhelper.resources.service.ResourceStoreService;
import com.abroadhelper.resources.validation.RecordValidator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches the configured source pages, honouring robots policy and the shared rate limit, and
 * stores the records they yield.
 */
@Service
public class SourceScrapeService {
    private static final Logger log = LoggerFactory.getLogger(SourceScrapeService.class);

    private final ResourceProperties properties;
    private final RobotsTxtService robotsTxtService;
    private final PoliteHttpClient httpClient;
    private final PageParser pageParser;
    private final RecordValidator recordValidator;
    private final ResourceStoreService storeService;
    private final Clock clock;

    public SourceScrapeService(
        ResourceProperties properties,
        RobotsTxtService robotsTxtService,
        PoliteHttpClient httpClient,
        PageParser pageParser,
        RecordValidator recordValidator,
        ResourceStoreService storeService,
        Clock clock
    ) {
        this.properties = properties;
        this.robotsTxtService = robotsTxtService;
        this.httpClient = httpClient;
        this.pageParser = pageParser;
        this.recordValidator = recordValidator;
        this.storeService = storeService;
        this.clock = clock;
    }

    public ScrapeRunSummary scrapeAll(boolean dryRun) {
        return run(properties.getSources(), dryRun);
    }

    /**
     * @throws IllegalArgumentException if no source has the given name
     */
    public ScrapeRunSummary scrape(String sourceName, boolean dryRun) {
        ResourceProperties.Source source = properties.getSources().stream()
            .filter(candidate -> candidate.getName() != null && candidate.getName().equalsIgnoreCase(sourceName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + sourceName));
        return run(List.of(source), dryRun);
    }

    private ScrapeRunSummary run(List<ResourceProperties.Source> sources, boolean dryRun) {
        List<SourceScrapeResult> results = new ArrayList<>();
        List<ResourceRecord> collected = new ArrayList<>();
        for (ResourceProperties.Source source : sources) {
            log.info("Processing source: {}", source.getName());
            try {
                results.add(scrapeSource(source, dryRun, collected));
            } catch (RuntimeException e) {
                log.error("Error scraping {}: {}", source.getName(), e.toString());
                results.add(SourceScrapeResult.failed(source.getName(), e.getMessage()));
            }
        }

        int parsed = results.stream().mapToInt(SourceScrapeResult::recordsParsed).sum();
        int saved = results.stream().mapToInt(SourceScrapeResult::recordsSaved).sum();
        int failed = results.stream().mapToInt(SourceScrapeResult::recordsFailed).sum();
        log.info("Scrape finished sources={} parsed={} saved={} failed={} dryRun={}", results.size(), parsed, saved, failed, dryRun);
        return new ScrapeRunSummary(dryRun, parsed, saved, failed, results, collected);
    }

    private SourceScrapeResult scrapeSource(
        ResourceProperties.Source source,
        boolean dryRun,
        List<ResourceRecord> collected
    ) {
        String url = source.getUrl();
        if (url == null || url.isBlank()) {
            return SourceScrapeResult.failed(source.getName(), "source url is not configured");
        }

        String userAgent = properties.getUserAgent();
        boolean allowed = source.getRobotsUrl() == null || source.getRobotsUrl().isBlank()
            ? robotsTxtService.isAllowed(url, userAgent)
            : robotsTxtService.isAllowed(url, source.getRobotsUrl(), userAgent);
        if (!allowed) {
            log.warn("Skipping {} - disallowed by robots.txt", url);
            return SourceScrapeResult.skippedByRobots(source.getName());
        }

        FetchOutcome outcome = httpClient.get(url);
        if (!outcome.isSuccess()) {
            log.warn("Fetch failed source={} status={} attempts={}", source.getName(), outcome.status(), outcome.attempts());
            return SourceScrapeResult.fetchFailed(source.getName(), outcome);
        }

        Document document = Jsoup.parse(
            outcome.body() == null ? "" : outcome.body(),
            outcome.lastResult().finalUrlOrRequested()
        );
        List<ResourceRecord> parsed = pageParser.parse(source, document);

        String scrapedAt = OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        List<ResourceRecord> complete = new ArrayList<>();
        int dropped = 0;
        for (ResourceRecord record : parsed) {
            List<String> missing = recordValidator.missingFields(record);
            if (!missing.isEmpty()) {
                dropped++;
                log.debug("Dropping incomplete record from {} title={} missing={}", source.getName(), record.title(), missing);
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>(record.metadata());
            metadata.put("source", source.getName());
            metadata.put("scraped_at", scrapedAt);
            complete.add(record.withMetadata(metadata));
        }
        log.info("Scraped {} resources from {} ({} incomplete dropped)", complete.size(), source.getName(), dropped);
        collected.addAll(complete);

        if (dryRun) {
            log.info("DRY RUN: Would update database with {} resources", complete.size());
            for (ResourceRecord record : complete) {
                log.info("  - {}", record.title());
            }
            return new SourceScrapeResult(
                source.getName(), SourceScrapeStatus.SUCCESS, outcome.status(), outcome.statusCode(),
                parsed.size(), dropped, 0, 0, null
            );
        }

        BulkUpsertSummary upserted = storeService.bulkUpsert(complete);
        log.info("Database update complete: {} succeeded, {} failed", upserted.success(), upserted.failed());
        return new SourceScrapeResult(
            source.getName(), SourceScrapeStatus.SUCCESS, outcome.status(), outcome.statusCode(),
            parsed.size(), dropped, upserted.success(), upserted.failed(), null
        );
    }
}
