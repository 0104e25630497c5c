package com.optionbot.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin wrapper over {@link HttpClient} shared by the market, news and social fetchers.
 * Non-2xx responses surface as {@link HttpStatusException} so callers can classify them.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "Mozilla/5.0 (compatible; OptionBot/1.0)";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        return send(request(url, timeoutSeconds).GET(), url);
    }

    public String postJson(String url, String json, int timeoutSeconds) throws IOException, InterruptedException {
        HttpRequest.Builder builder = request(url, timeoutSeconds)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        return send(builder, url);
    }

    private static HttpRequest.Builder request(String url, int timeoutSeconds) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .header("User-Agent", USER_AGENT);
    }

    private String send(HttpRequest.Builder builder, String url) throws IOException, InterruptedException {
        HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new HttpStatusException(status, url);
        }
        return resp.body();
    }
}
