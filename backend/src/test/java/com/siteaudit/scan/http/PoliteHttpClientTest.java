package com.siteaudit.scan.http;

import com.siteaudit.config.AuditProperties;
import com.siteaudit.scan.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private AuditProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new AuditProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void retriesServerErrorsUpToConfiguredLimit() {
        properties.setRequestMaxRetries(1);
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html></html>"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/page").toString(), PoliteHttpClient.HTML_ACCEPT);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("<html></html>");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() {
        properties.setRequestMaxRetries(2);
        server.enqueue(new MockResponse().setResponseCode(404));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/missing").toString(), "text/html");

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.failureReason()).isEqualTo("http_404");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void rejectsBodiesOverTheByteLimit() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("x".repeat(4096)));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/big").toString(), "text/plain", 1024);

        assertThat(result.errorCode()).isEqualTo("body_too_large");
        assertThat(result.isSuccessful()).isFalse();
    }

    @Test
    void exposesResponseHeadersCaseInsensitively() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Strict-Transport-Security", "max-age=31536000")
            .setHeader("X-Frame-Options", "DENY")
            .setBody("ok"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get(server.url("/").toString(), "text/html");

        assertThat(result.header("strict-transport-security")).isEqualTo("max-age=31536000");
        assertThat(result.header("X-FRAME-OPTIONS")).isEqualTo("DENY");
    }

    @Test
    void postsJsonWithExtraHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"summary\":\"ok\"}"));
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.postJson(
            server.url("/summarize").toString(),
            "{\"grade\":\"B\"}",
            "application/json",
            Map.of("Authorization", "Bearer secret")
        );

        RecordedRequest request = server.takeRequest();
        assertThat(result.isSuccessful()).isTrue();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"grade\":\"B\"}");
    }

    @Test
    void invalidUrlIsReportedWithoutThrowing() {
        PoliteHttpClient client = new PoliteHttpClient(properties, executor);

        HttpFetchResult result = client.get("http://", "text/html");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
    }
}
