package com.vigil.checks;

import com.sun.net.httpserver.HttpServer;
import com.vigil.check.CheckConfig;
import com.vigil.check.CheckOutcome;
import com.vigil.check.OutcomeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WebsiteStatusCheck")
class WebsiteStatusCheckTest {

    private final WebsiteStatusCheck check = new WebsiteStatusCheck();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private HttpServer server;
    private String base;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/ok", exchange -> respond(exchange, 200, "Welcome to the status page"));
        server.createContext("/maintenance", exchange -> respond(exchange, 200, "Down for maintenance"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "not here"));
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", base + "/ok");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/secure", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            respond(exchange, 200, "secret");
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private CheckOutcome run(Map<String, Object> config) throws InterruptedException {
        return check.execute(CheckConfig.of(config));
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("should succeed when status and content match")
        void shouldSucceed() throws Exception {
            CheckOutcome outcome = run(Map.of("url", base + "/ok", "expected_content", "Welcome"));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
            assertThat(outcome.message()).isEqualTo("Website check successful. Status code: 200");
            assertThat(outcome.rawData())
                    .containsEntry("status_code", 200)
                    .containsEntry("status_match", true)
                    .containsEntry("content_match", true);
        }

        @Test
        @DisplayName("should warn when content expectations fail")
        void shouldWarnOnContent() throws Exception {
            CheckOutcome outcome = run(Map.of("url", base + "/maintenance", "unexpected_content", "maintenance"));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.WARNING);
            assertThat(outcome.message()).contains("Unexpected content 'maintenance' found");
        }

        @Test
        @DisplayName("should fail on status mismatch")
        void shouldFailOnStatus() throws Exception {
            CheckOutcome outcome = run(Map.of("url", base + "/missing"));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.ERROR);
            assertThat(outcome.message()).isEqualTo("Website check failed. Expected status: 200, actual: 404");
        }

        @Test
        @DisplayName("should accept configured expected status")
        void shouldAcceptExpectedStatus() throws Exception {
            CheckOutcome outcome = run(Map.of("url", base + "/missing", "expected_status", 404));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
        }

        @Test
        @DisplayName("should follow redirects and record them")
        void shouldFollowRedirects() throws Exception {
            CheckOutcome outcome = run(Map.of("url", base + "/moved"));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
            assertThat(outcome.rawData().get("redirect_history")).isEqualTo(List.of(base + "/moved"));
        }

        @Test
        @DisplayName("should report the redirect status when not following")
        void shouldNotFollowRedirects() throws Exception {
            CheckOutcome outcome = run(Map.of("url", base + "/moved", "follow_redirects", false, "expected_status", 302));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.SUCCESS);
            assertThat(outcome.rawData()).containsEntry("status_code", 302);
        }

        @Test
        @DisplayName("should send basic credentials")
        void shouldSendBasicAuth() throws Exception {
            run(Map.of("url", base + "/secure", "auth_username", "ops", "auth_password", "pw"));

            assertThat(lastAuthorization.get()).isEqualTo("Basic b3BzOnB3");
        }

        @Test
        @DisplayName("should report refused connections as errors")
        void shouldReportConnectionError() throws Exception {
            int port;
            try (ServerSocket socket = new ServerSocket(0)) {
                port = socket.getLocalPort();
            }

            CheckOutcome outcome = run(Map.of("url", "http://127.0.0.1:" + port + "/", "timeout", 2));

            assertThat(outcome.kind()).isEqualTo(OutcomeKind.ERROR);
            assertThat(outcome.message()).startsWith("Connection error");
            assertThat(outcome.rawData()).containsKey("error_type");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should require url")
        void shouldRequireUrl() {
            assertThat(check.validate(WebsiteStatusCheck.TYPE, CheckConfig.empty()).errors())
                    .containsExactly("Missing required configuration: url");
        }

        @Test
        @DisplayName("should reject non-http urls")
        void shouldRejectScheme() {
            assertThat(check.validate(WebsiteStatusCheck.TYPE, CheckConfig.of(Map.of("url", "ftp://example.com"))).valid())
                    .isFalse();
        }
    }
}
