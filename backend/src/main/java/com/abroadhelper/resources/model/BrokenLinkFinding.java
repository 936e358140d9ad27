package com.abroadhelper.resources.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BrokenLinkFinding(String id, String title, String url, int statusCode, String category) {}
