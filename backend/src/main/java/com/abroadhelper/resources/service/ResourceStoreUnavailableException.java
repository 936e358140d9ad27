package com.abroadhelper.resources.service;

public class ResourceStoreUnavailableException extends RuntimeException {
    public ResourceStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
