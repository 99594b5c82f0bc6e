package com.vigil.checks;

import com.vigil.check.Check;
import com.vigil.check.CheckConfig;
import com.vigil.check.CheckDescriptor;
import com.vigil.check.CheckOutcome;
import com.vigil.check.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code website_status}: issues one HTTP request and compares status code and body against
 * expectations.
 * <p>
 * SUCCESS when status and content match, WARNING when the status matches but a content
 * expectation fails, ERROR when the status differs or the request fails.
 */
public final class WebsiteStatusCheck implements Check {

    private static final Logger log = LoggerFactory.getLogger(WebsiteStatusCheck.class);

    public static final String TYPE = "website_status";

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient following;
    private final HttpClient notFollowing;

    public WebsiteStatusCheck() {
        this.following = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).build();
        this.notFollowing = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NEVER).build();
    }

    @Override
    public CheckDescriptor descriptor(String type) {
        return new CheckDescriptor(type, "Checks website availability, status code and content",
                List.of("url"),
                List.of("timeout", "expected_status", "method", "headers", "body", "auth_username",
                        "auth_password", "follow_redirects", "expected_content", "unexpected_content"));
    }

    @Override
    public ValidationResult validate(String type, CheckConfig config) {
        ValidationResult required = Check.super.validate(type, config);
        if (!required.valid()) {
            return required;
        }
        String url = config.getString("url", "");
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            return ValidationResult.fail("Invalid URL format: " + url + ". Must start with http:// or https://");
        }
        return ValidationResult.ok();
    }

    @Override
    public CheckOutcome execute(CheckConfig config) throws InterruptedException {
        String url = config.require("url");
        Duration timeout = config.getDuration("timeout", DEFAULT_TIMEOUT);
        String method = config.getString("method", "GET").toUpperCase(Locale.ROOT);
        int expectedStatus = config.getInt("expected_status", 200);
        boolean followRedirects = config.getBoolean("follow_redirects", true);
        String expectedContent = config.getString("expected_content", null);
        String unexpectedContent = config.getString("unexpected_content", null);

        HttpRequest request = buildRequest(config, url, method, timeout);
        log.debug("Checking website {} (method: {}, timeout: {}s)", url, method, timeout.toSeconds());
        HttpResponse<byte[]> response;
        try {
            response = (followRedirects ? following : notFollowing)
                    .send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            return IoFailures.error("Request timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            return IoFailures.error("Connection error: " + e.getMessage(), e);
        }

        String body = new String(response.body(), StandardCharsets.UTF_8);
        boolean statusMatch = response.statusCode() == expectedStatus;
        List<String> contentIssues = new ArrayList<>();
        if (expectedContent != null && !expectedContent.isEmpty() && !body.contains(expectedContent)) {
            contentIssues.add("Expected content '" + expectedContent + "' not found");
        }
        if (unexpectedContent != null && !unexpectedContent.isEmpty() && body.contains(unexpectedContent)) {
            contentIssues.add("Unexpected content '" + unexpectedContent + "' found");
        }
        boolean contentMatch = contentIssues.isEmpty();

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("url", url);
        raw.put("status_code", response.statusCode());
        raw.put("expected_status", expectedStatus);
        raw.put("status_match", statusMatch);
        raw.put("content_match", contentMatch);
        raw.put("content_issues", contentIssues);
        raw.put("response_headers", headers(response));
        raw.put("response_size", response.body().length);
        raw.put("redirect_history", followRedirects ? redirects(response) : null);

        if (statusMatch && contentMatch) {
            return CheckOutcome.success("Website check successful. Status code: " + response.statusCode(),
                    Duration.ZERO, raw);
        }
        if (statusMatch) {
            return CheckOutcome.warning("Website accessible but content issues detected: "
                    + String.join(", ", contentIssues), Duration.ZERO, raw);
        }
        return CheckOutcome.error("Website check failed. Expected status: " + expectedStatus
                + ", actual: " + response.statusCode(), Duration.ZERO, raw);
    }

    private static HttpRequest buildRequest(CheckConfig config, String url, String method, Duration timeout) {
        String body = config.getString("body", null);
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .method(method, publisher);
        config.getMap("headers").forEach((name, value) -> builder.header(name, String.valueOf(value)));
        if (config.has("auth_username") && config.has("auth_password")) {
            String credentials = config.getString("auth_username", "") + ":" + config.getString("auth_password", "");
            builder.header("Authorization",
                    "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }
        return builder.build();
    }

    private static Map<String, String> headers(HttpResponse<?> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> headers.put(name, String.join(", ", values)));
        return headers;
    }

    private static List<String> redirects(HttpResponse<?> response) {
        List<String> history = new ArrayList<>();
        Optional<? extends HttpResponse<?>> previous = response.previousResponse();
        while (previous.isPresent()) {
            history.add(0, previous.get().uri().toString());
            previous = previous.get().previousResponse();
        }
        return history;
    }
}
