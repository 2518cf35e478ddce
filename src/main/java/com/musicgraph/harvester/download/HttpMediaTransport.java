package com.musicgraph.harvester.download;

import com.musicgraph.harvester.error.DownloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link MediaTransport} over the JDK {@link HttpClient}. The body is streamed, never buffered whole.
 */
public class HttpMediaTransport implements MediaTransport {
    private static final Logger logger = LoggerFactory.getLogger(HttpMediaTransport.class);

    private final HttpClient client;
    private final Duration timeout;

    public HttpMediaTransport(Duration timeout) {
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public MediaResponse open(String url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("User-Agent", "SimilarArtistHarvester/1.0")
            .GET()
            .build();
        HttpResponse<InputStream> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while opening " + url);
        }
        if (response.statusCode() != 200) {
            response.body().close();
            logger.debug("Media request returned HTTP {}", response.statusCode());
            throw new DownloadException("HTTP " + response.statusCode() + " from media server", null);
        }
        long length = response.headers().firstValueAsLong("content-length").orElse(-1L);
        return new MediaResponse(length, response.body());
    }
}
