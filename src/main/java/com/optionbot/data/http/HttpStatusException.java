package com.optionbot.data.http;

import java.io.IOException;

public final class HttpStatusException extends IOException {
    private final int statusCode;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
