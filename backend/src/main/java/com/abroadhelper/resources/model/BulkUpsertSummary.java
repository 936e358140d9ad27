package com.abroadhelper.resources.model;

public record BulkUpsertSummary(int success, int failed) {}
