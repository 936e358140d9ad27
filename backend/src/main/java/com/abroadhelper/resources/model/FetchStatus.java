package com.abroadhelper.resources.model;

public enum FetchStatus {
    SUCCESS,
    /** 4xx response, never retried. */
    CLIENT_ERROR,
    /** 5xx responses until the retry budget ran out. */
    RETRIES_EXHAUSTED,
    /** Timeouts or connection failures until the retry budget ran out. */
    TRANSPORT_FAILURE,
    INVALID_URL,
    INTERRUPTED
}
