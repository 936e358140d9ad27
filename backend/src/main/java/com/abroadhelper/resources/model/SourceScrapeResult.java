package com.abroadhelper.resources.model;

/**
 * Per-source outcome. {@code fetchStatus} and {@code httpStatus} are set when the page was
 * requested; {@code error} carries the failure message for {@code FAILED} and {@code FETCH_FAILED}.
 */
public record SourceScrapeResult(
    String source,
    SourceScrapeStatus status,
    FetchStatus fetchStatus,
    Integer httpStatus,
    int recordsParsed,
    int recordsDropped,
    int recordsSaved,
    int recordsFailed,
    String error
) {
    public static SourceScrapeResult skippedByRobots(String source) {
        return new SourceScrapeResult(source, SourceScrapeStatus.SKIPPED_ROBOTS, null, null, 0, 0, 0, 0, null);
    }

    public static SourceScrapeResult fetchFailed(String source, FetchOutcome outcome) {
        HttpFetchResult last = outcome.lastResult();
        return new SourceScrapeResult(
            source,
            SourceScrapeStatus.FETCH_FAILED,
            outcome.status(),
            last == null || !last.hasResponse() ? null : last.statusCode(),
            0,
            0,
            0,
            0,
            last == null ? null : last.errorCode()
        );
    }

    public static SourceScrapeResult failed(String source, String error) {
        return new SourceScrapeResult(source, SourceScrapeStatus.FAILED, null, null, 0, 0, 0, 0, error);
    }
}
