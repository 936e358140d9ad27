package com.abroadhelper.resources.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StaleDataFinding(String id, String title, long daysOld, String lastUpdated) {}
