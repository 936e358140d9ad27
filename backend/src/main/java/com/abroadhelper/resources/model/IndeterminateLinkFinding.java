package com.abroadhelper.resources.model;

/** A link whose liveness could not be decided, e.g. the probe itself failed unexpectedly. */
public record IndeterminateLinkFinding(String id, String title, String url, String reason) {}
