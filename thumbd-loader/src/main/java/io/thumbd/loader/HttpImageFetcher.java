package io.thumbd.loader;

import io.thumbd.common.exception.LoadException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

public final class HttpImageFetcher implements ImageFetcher {

    public static final String DEFAULT_USER_AGENT = "thumbd/0.1";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final String userAgent;
    private final Duration requestTimeout;

    public HttpImageFetcher(HttpClient client, String userAgent, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    public static HttpImageFetcher create() {
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        return new HttpImageFetcher(client, DEFAULT_USER_AGENT, DEFAULT_REQUEST_TIMEOUT);
    }

    @Override
    public byte[] fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new LoadException.Network("Invalid URL: " + url, e);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .header("User-Agent", userAgent)
            .GET()
            .build();

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                throw new LoadException.Http(response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new LoadException.Network("Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LoadException.Network("Interrupted while fetching " + url, e);
        }
    }
}
