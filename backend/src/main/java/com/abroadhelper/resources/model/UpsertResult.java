package com.abroadhelper.resources.model;

public record UpsertResult(String id, boolean inserted) {}
