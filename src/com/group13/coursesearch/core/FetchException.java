package com.group13.coursesearch.core;

/**
 * A single page could not be retrieved (network error, timeout, non-200 status).
 * The crawler treats it as transient: the page is skipped and the run continues.
 */
public class FetchException extends Exception {

    private final String url;
    private final int statusCode;

    public FetchException(String url, String message) {
        this(url, -1, message, null);
    }

    public FetchException(String url, int statusCode, String message) {
        this(url, statusCode, message, null);
    }

    public FetchException(String url, String message, Throwable cause) {
        this(url, -1, message, cause);
    }

    private FetchException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    // -1 when no response was received.
    public int getStatusCode() {
        return statusCode;
    }
}
