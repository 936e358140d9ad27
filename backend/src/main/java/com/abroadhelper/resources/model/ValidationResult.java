package com.abroadhelper.resources.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationResult(
    String category,
    int totalResources,
    List<BrokenLinkFinding> brokenLinks,
    List<StaleDataFinding> staleData,
    List<InvalidDateFinding> invalidDates,
    List<MissingFieldsFinding> missingFields,
    List<IndeterminateLinkFinding> indeterminateLinks,
    List<String> passed
) {
    public ValidationResult {
        brokenLinks = List.copyOf(brokenLinks);
        staleData = List.copyOf(staleData);
        invalidDates = List.copyOf(invalidDates);
        missingFields = List.copyOf(missingFields);
        indeterminateLinks = List.copyOf(indeterminateLinks);
        passed = List.copyOf(passed);
    }

    public int issuesCount() {
        return brokenLinks.size() + staleData.size() + invalidDates.size() + missingFields.size();
    }
}
