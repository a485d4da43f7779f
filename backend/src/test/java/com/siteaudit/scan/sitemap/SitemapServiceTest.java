package com.siteaudit.scan.sitemap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.HttpFetchResult;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SitemapServiceTest {

  private static final String URLSET =
      """
          <?xml version="1.0" encoding="UTF-8"?>
          <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
            <url><loc>https://example.com/shop</loc></url>
            <url><loc>https://example.com/book-now</loc></url>
          </urlset>
          """;

  @Mock private PoliteHttpClient httpClient;

  private SitemapService service;

  @BeforeEach
  void setUp() {
    lenient().when(httpClient.get(anyString(), anyString(), anyInt())).thenReturn(status(404, "x"));
    service = new SitemapService(httpClient);
  }

  @Test
  void extractsUrlsFromGzippedSitemapByMagicBytes() throws Exception {
    stub("https://example.com/sitemap.xml", ok("https://example.com/sitemap.xml", gzip(URLSET), null));

    SitemapDiscoveryResult result = service.discover("https://example.com", List.of(), 5, 200);

    assertEquals(List.of("https://example.com/shop", "https://example.com/book-now"), result.discoveredUrls());
    assertEquals(List.of("https://example.com/sitemap.xml"), result.fetchedSitemaps());
  }

  @Test
  void extractsUrlsFromExplicitGzipSeed() throws Exception {
    byte[] compressed = gzip(URLSET);
    stub("https://example.com/sitemap.xml.gz", ok("https://example.com/sitemap.xml.gz", compressed, "gzip"));

    SitemapDiscoveryResult result =
        service.discover(List.of("https://example.com/sitemap.xml.gz"), 5, 200);

    assertEquals(2, result.discoveredUrls().size());
  }

  @Test
  void followsIndexOneLevelWithinChildBound() {
    String index =
        """
            <sitemapindex>
              <sitemap><loc>https://example.com/a.xml</loc></sitemap>
              <sitemap><loc>https://example.com/b.xml</loc></sitemap>
              <sitemap><loc>https://example.com/c.xml</loc></sitemap>
            </sitemapindex>
            """;
    stub("https://example.com/sitemap_index.xml", ok("https://example.com/sitemap_index.xml", bytes(index), null));
    stub("https://example.com/a.xml", ok("https://example.com/a.xml", bytes(URLSET), null));
    stub(
        "https://example.com/b.xml",
        ok(
            "https://example.com/b.xml",
            bytes("<urlset><url><loc>https://example.com/contact</loc></url></urlset>"),
            null));

    SitemapDiscoveryResult result = service.discover("https://example.com", List.of(), 2, 200);

    assertEquals(3, result.discoveredUrls().size());
    assertTrue(result.discoveredUrls().contains("https://example.com/contact"));
    verify(httpClient, never()).get(eq("https://example.com/c.xml"), anyString(), anyInt());
    assertEquals(1, result.errors().get("http_404"));
  }

  @Test
  void stopsAtUrlCap() {
    stub("https://example.com/sitemap.xml", ok("https://example.com/sitemap.xml", bytes(URLSET), null));

    SitemapDiscoveryResult result = service.discover("https://example.com", List.of(), 5, 1);

    assertEquals(List.of("https://example.com/shop"), result.discoveredUrls());
  }

  private void stub(String url, HttpFetchResult result) {
    when(httpClient.get(eq(url), eq(SitemapService.SITEMAP_ACCEPT), anyInt())).thenReturn(result);
  }

  private static HttpFetchResult ok(String url, byte[] body, String contentEncoding) {
    return new HttpFetchResult(
        url,
        URI.create(url),
        200,
        new String(body, StandardCharsets.ISO_8859_1),
        body,
        "application/xml",
        contentEncoding,
        Map.of(),
        Instant.now(),
        Duration.ofMillis(5),
        null,
        null);
  }

  private static HttpFetchResult status(int code, String url) {
    return new HttpFetchResult(
        url, null, code, "", new byte[0], null, null, Map.of(), Instant.now(), Duration.ZERO, null, null);
  }

  private static byte[] bytes(String xml) {
    return xml.getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] gzip(String xml) throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(bytes(xml));
    }
    return out.toByteArray();
  }
}
