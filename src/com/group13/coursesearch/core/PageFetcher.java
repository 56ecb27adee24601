package com.group13.coursesearch.core;

import com.group13.coursesearch.model.FetchedPage;

/**
 * Strategy Interface for retrieving a page.
 * Owns all outbound traffic of the crawler.
 */
public interface PageFetcher {
    /**
     * Fetches the page at the given absolute URL.
     *
     * @throws FetchException on network errors, timeouts and non-200 responses
     */
    FetchedPage fetch(String url) throws FetchException;
}
