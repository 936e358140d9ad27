package com.abroadhelper.resources.model;

public record LinkTarget(String recordId, String title, String url, String category) {

    public static LinkTarget of(ResourceRecord record) {
        return new LinkTarget(record.id(), record.title(), record.url(), record.category());
    }
}
