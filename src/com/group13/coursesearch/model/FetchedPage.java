package com.group13.coursesearch.model;

/*
  Raw result of a successful page fetch.
  finalUrl differs from requestedUrl when the server redirected.
 */
public class FetchedPage {

    private final String requestedUrl;
    private final String finalUrl;
    private final int statusCode;
    private final String body;

    public FetchedPage(String requestedUrl, String finalUrl, int statusCode, String body) {
        this.requestedUrl = requestedUrl;
        this.finalUrl = finalUrl != null ? finalUrl : requestedUrl;
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
    }

    public String getRequestedUrl() { return requestedUrl; }
    public String getFinalUrl() { return finalUrl; }
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
}
