package com.hfm.budget.exception;

/**
 * A dependency needed to answer the request could not be reached or answered with an error.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final String service;

    public UpstreamUnavailableException(String service, String message) {
        super(message);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
