package com.abroadhelper.resources.model;

public enum LinkStatus {
    LIVE,
    BROKEN,
    INDETERMINATE
}
