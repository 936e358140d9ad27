package com.abroadhelper.resources.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transient copy of a stored resource. Date fields are kept as text so that malformed values
 * coming from manual curation can be reported instead of rejected on read.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResourceRecord(
    String id,
    String title,
    String description,
    String url,
    String category,
    String country,
    String institution,
    String deadline,
    String eligibility,
    String amount,
    List<String> tags,
    String lastUpdated,
    Map<String, Object> metadata
) {
    public ResourceRecord {
        tags = tags == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tags));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public ResourceRecord withMetadata(Map<String, Object> newMetadata) {
        return new ResourceRecord(
            id, title, description, url, category, country, institution,
            deadline, eligibility, amount, tags, lastUpdated, newMetadata
        );
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }
}
