package com.abroadhelper.resources.model;

import java.util.List;

public record ScrapeRunSummary(
    boolean dryRun,
    int recordsParsed,
    int recordsSaved,
    int recordsFailed,
    List<SourceScrapeResult> sources,
    List<ResourceRecord> records
) {
    public ScrapeRunSummary {
        sources = List.copyOf(sources);
        records = List.copyOf(records);
    }
}
