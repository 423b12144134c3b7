package com.cryptobot.ta.remote;

import com.cryptobot.data.http.HttpClientEx;
import com.cryptobot.data.http.HttpStatusException;
import com.cryptobot.ta.config.Config;
import com.cryptobot.ta.error.IndicatorFetchException;
import com.cryptobot.ta.error.RateLimitExceededException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * REST client for taapi.io single-indicator endpoints:
 * {@code GET {base}/{indicator}?secret&exchange&symbol&interval&params}.
 */
public final class TaapiClient implements RemoteIndicatorSource {
    private final HttpClientEx http;
    private final String baseUrl;
    private final String apiKey;
    private final int timeoutSec;

    public TaapiClient(Config config, HttpClientEx http) {
        this(
                http,
                config.getString("taapi.base_url", "https://api.taapi.io"),
                config.requireString("taapi.api_key"),
                Math.max(5, config.getInt("taapi.request_timeout_sec", 30))
        );
    }

    public TaapiClient(HttpClientEx http, String baseUrl, String apiKey, int timeoutSec) {
        this.http = http;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeoutSec = timeoutSec;
    }

    @Override
    public JSONObject fetch(IndicatorSpec spec, FetchTarget target) {
        String url = buildUrl(spec, target);
        String body;
        try {
            body = http.getText(url, timeoutSec);
        } catch (HttpStatusException e) {
            if (e.statusCode() == 429) {
                throw new RateLimitExceededException(spec.key(), "HTTP 429 rate limit exceeded for " + spec.indicator());
            }
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.HTTP,
                    e.getMessage() + errorSuffix(e.body()), e);
        } catch (HttpTimeoutException e) {
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.TIMEOUT,
                    "request timed out for " + spec.indicator(), e);
        } catch (IOException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.classify(e), message, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.OTHER,
                    "interrupted while fetching " + spec.indicator(), e);
        }
        return parse(spec, body);
    }

    String buildUrl(IndicatorSpec spec, FetchTarget target) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append('/').append(encode(spec.indicator()))
                .append("?secret=").append(encode(apiKey))
                .append("&exchange=").append(encode(target.exchange()))
                .append("&symbol=").append(encode(target.symbolPair()))
                .append("&interval=").append(encode(target.interval()));
        for (Map.Entry<String, String> param : spec.params().entrySet()) {
            url.append('&').append(encode(param.getKey())).append('=').append(encode(param.getValue()));
        }
        return url.toString();
    }

    private static JSONObject parse(IndicatorSpec spec, String body) {
        String raw = body == null ? "" : body.trim();
        if (raw.isEmpty()) {
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.EMPTY, "empty response body");
        }
        JSONObject json;
        try {
            json = new JSONObject(raw);
        } catch (JSONException e) {
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.PARSE,
                    "malformed response for " + spec.indicator() + ": " + e.getMessage(), e);
        }
        String error = apiError(json);
        if (!error.isEmpty()) {
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.HTTP, "API error: " + error);
        }
        if (json.isEmpty()) {
            throw new IndicatorFetchException(spec.key(), IndicatorFetchException.EMPTY, "empty response object");
        }
        return json;
    }

    private static String apiError(JSONObject json) {
        Object error = json.opt("error");
        if (error != null && error != JSONObject.NULL) {
            return String.valueOf(error);
        }
        Object errors = json.opt("errors");
        if (errors instanceof JSONArray array && !array.isEmpty()) {
            return array.join("; ").replace("\"", "");
        }
        return "";
    }

    private static String errorSuffix(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.trim();
        return " body=" + (trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
