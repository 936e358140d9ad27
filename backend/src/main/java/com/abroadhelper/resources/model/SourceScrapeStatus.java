package com.abroadhelper.resources.model;

public enum SourceScrapeStatus {
    SUCCESS,
    SKIPPED_ROBOTS,
    FETCH_FAILED,
    FAILED
}
