package com.codescan.core.rules.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads rule documents over HTTP(S).
 *
 * <p>Every request carries a fixed request timeout. Only status 200 is accepted.
 */
public class RuleDownloader {

    private static final Logger log = LoggerFactory.getLogger(RuleDownloader.class);

    /** Request timeout of rule downloads. */
    public static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final Duration timeout;

    public RuleDownloader() {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(15))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(), REQUEST_TIMEOUT);
    }

    public RuleDownloader(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    /**
     * Fetches a URL.
     *
     * @param url URL to fetch
     * @return response body
     * @throws RuleFetchException if the URL is invalid, unreachable or answers with a status other than 200
     */
    public byte[] download(String url) throws RuleFetchException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        } catch (IllegalArgumentException e) {
            throw new RuleFetchException("Invalid rule URL: " + url, e);
        }

        log.debug("Downloading rules from {}", url);
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                throw new RuleFetchException("Download of " + url + " failed with HTTP " + response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new RuleFetchException("Download of " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuleFetchException("Download of " + url + " interrupted", e);
        }
    }
}
