package com.group13.coursesearch.impl;

import com.group13.coursesearch.config.CrawlerConfig;
import com.group13.coursesearch.core.FetchException;
import com.group13.coursesearch.core.PageFetcher;
import com.group13.coursesearch.model.FetchedPage;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Fetches pages over HTTP(S) with {@link HttpURLConnection}.
 * Only 200 responses with an HTML (or unspecified) content type count as successful.
 */
public class HttpPageFetcher implements PageFetcher {

    private final int timeoutMs;
    private final String userAgent;

    public HttpPageFetcher(CrawlerConfig config) {
        this(config.getTimeoutMs(), config.getUserAgent());
    }

    public HttpPageFetcher(int timeoutMs, String userAgent) {
        this.timeoutMs = timeoutMs;
        this.userAgent = userAgent;
    }

    @Override
    public FetchedPage fetch(String url) throws FetchException {
        HttpURLConnection connection = null;
        try {
            URL target = new URI(url).toURL();
            if (!target.getProtocol().startsWith("http")) {
                throw new FetchException(url, "Unsupported protocol: " + target.getProtocol());
            }
            connection = (HttpURLConnection) target.openConnection();
            connection.setRequestMethod("GET");
            connection.setConnectTimeout(timeoutMs);
            connection.setReadTimeout(timeoutMs);
            connection.setInstanceFollowRedirects(true);
            connection.setRequestProperty("User-Agent", userAgent);
            connection.setRequestProperty("Accept", "text/html,application/xhtml+xml");
            connection.connect();

            int status = connection.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                throw new FetchException(url, status, "HTTP " + status);
            }

            String contentType = connection.getContentType();
            if (contentType != null && !contentType.toLowerCase(Locale.ROOT).contains("html")) {
                throw new FetchException(url, status, "Not an HTML page: " + contentType);
            }

            byte[] body;
            try (InputStream in = connection.getInputStream()) {
                body = in.readAllBytes();
            }
            String finalUrl = connection.getURL().toString();
            return new FetchedPage(url, finalUrl, status, new String(body, charsetOf(contentType)));
        } catch (IOException | IllegalArgumentException | URISyntaxException e) {
            throw new FetchException(url, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private static Charset charsetOf(String contentType) {
        if (contentType != null) {
            for (String part : contentType.split(";")) {
                String trimmed = part.trim();
                if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                    try {
                        return Charset.forName(trimmed.substring("charset=".length()).replace("\"", ""));
                    } catch (IllegalArgumentException e) {
                        return StandardCharsets.UTF_8;
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }
}
