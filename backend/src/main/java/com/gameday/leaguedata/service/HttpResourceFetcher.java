package com.gameday.leaguedata.service;

import com.gameday.leaguedata.exception.ResourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Fetches published sheets over HTTP with {@link RestClient}, and local sheets from disk.
 * No retries: a failed attempt is reported to the caller straight away.
 */
@Service
public class HttpResourceFetcher implements ResourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpResourceFetcher.class);

    private final RestClient restClient;

    public HttpResourceFetcher(RestClient sheetRestClient) {
        this.restClient = sheetRestClient;
    }

    @Override
    public String fetch(String location) {
        if (location == null || location.isBlank()) {
            throw new ResourceFetchException(location, "Resource location is blank");
        }
        String loc = location.trim();
        String lower = loc.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return fetchRemote(loc);
        }
        return readLocal(loc);
    }

    private String fetchRemote(String url) {
        long t0 = System.currentTimeMillis();
        try {
            // Published sheets are UTF-8 but often sent as text/csv without a charset
            byte[] body = restClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .body(byte[].class);
            log.debug("[Fetch] {} ok in {} ms", url, System.currentTimeMillis() - t0);
            return body == null ? "" : new String(body, StandardCharsets.UTF_8);
        } catch (RestClientResponseException e) {
            throw new ResourceFetchException(url, "HTTP " + e.getStatusCode().value() + " while fetching " + url, e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new ResourceFetchException(url, "Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }

    private String readLocal(String location) {
        try {
            Path path = location.toLowerCase(Locale.ROOT).startsWith("file:")
                    ? Path.of(URI.create(location))
                    : Path.of(location);
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException | FileSystemNotFoundException | IllegalArgumentException e) {
            throw new ResourceFetchException(location, "Failed to read " + location + ": " + e.getMessage(), e);
        }
    }
}
