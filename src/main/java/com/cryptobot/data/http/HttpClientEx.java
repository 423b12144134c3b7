package com.cryptobot.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Thin wrapper over {@link HttpClient} for text GET calls: fixed connect timeout,
 * redirects followed, non-2xx turned into {@link HttpStatusException}.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "CryptoBot/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this(Duration.ofSeconds(20));
    }

    public HttpClientEx(Duration connectTimeout) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        return getText(url, timeoutSeconds, Map.of());
    }

    public String getText(String url, int timeoutSeconds, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json");
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new HttpStatusException(resp.statusCode(), url, resp.body());
    }
}
