package com.cryptobot.data.http;

public class HttpStatusException extends RuntimeException {
    private final int statusCode;
    private final String body;

    public HttpStatusException(int statusCode, String url, String body) {
        super("HTTP " + statusCode + " for " + redact(url));
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    static String redact(String url) {
        if (url == null) {
            return "";
        }
        return url.replaceAll("(?i)(secret|api_key|x_cg_demo_api_key)=[^&]*", "$1=***");
    }
}
