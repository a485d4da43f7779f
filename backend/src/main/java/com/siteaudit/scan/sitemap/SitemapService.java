package com.siteaudit.scan.sitemap;

import com.siteaudit.scan.http.PoliteHttpClient;
import com.siteaudit.scan.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Reads {@code sitemap.xml}, {@code sitemap_index.xml} and robots sitemap hints,
 * following a sitemap index one level down.
 */
@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";
    private static final int MAX_SITEMAP_BYTES = 2_000_000;
    private static final int MAX_INDEX_DEPTH = 1;

    private final PoliteHttpClient httpClient;

    public SitemapService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public SitemapDiscoveryResult discover(String origin, List<String> hintUrls, int maxChildSitemaps, int maxUrls) {
        List<String> seeds = new ArrayList<>();
        seeds.add(origin + "/sitemap.xml");
        seeds.add(origin + "/sitemap_index.xml");
        if (hintUrls != null) {
            seeds.addAll(hintUrls);
        }
        return discover(seeds, maxChildSitemaps, maxUrls);
    }

    public SitemapDiscoveryResult discover(List<String> seedSitemaps, int maxChildSitemaps, int maxUrls) {
        ArrayDeque<SitemapTask> queue = new ArrayDeque<>();
        for (String seed : seedSitemaps) {
            String normalized = normalizeSitemapUrl(seed);
            if (normalized != null) {
                queue.addLast(new SitemapTask(normalized, 0));
            }
        }

        LinkedHashSet<String> visited = new LinkedHashSet<>();
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        List<String> fetched = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        int childrenQueued = 0;

        while (!queue.isEmpty() && urls.size() < maxUrls) {
            SitemapTask current = queue.removeFirst();
            if (!visited.add(current.url())) {
                continue;
            }

            HttpFetchResult fetch = httpClient.get(current.url(), SITEMAP_ACCEPT, MAX_SITEMAP_BYTES);
            if (!fetch.isSuccessful()) {
                increment(errors, fetch.failureReason());
                continue;
            }
            String xmlPayload;
            try {
                xmlPayload = extractXmlPayload(current.url(), fetch);
            } catch (IOException e) {
                log.debug("sitemap gzip decode failed url={} error={}", current.url(), e.getMessage());
                increment(errors, "gzip_decode_error");
                continue;
            }
            if (xmlPayload == null || xmlPayload.isBlank()) {
                increment(errors, "empty_sitemap_payload");
                continue;
            }

            Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
            fetched.add(current.url());

            if (current.depth() < MAX_INDEX_DEPTH) {
                for (Element loc : xml.select("sitemap > loc")) {
                    String child = normalizeSitemapUrl(loc.text());
                    if (child == null || visited.contains(child) || childrenQueued >= maxChildSitemaps) {
                        continue;
                    }
                    queue.addLast(new SitemapTask(child, current.depth() + 1));
                    childrenQueued++;
                }
            }

            for (Element locElement : xml.select("url > loc")) {
                if (urls.size() >= maxUrls) {
                    break;
                }
                String loc = locElement.text().trim();
                if (loc.startsWith("http://") || loc.startsWith("https://")) {
                    urls.add(loc);
                }
            }
        }

        log.debug("sitemap discovery fetched={} urls={} errors={}", fetched.size(), urls.size(), errors);
        return new SitemapDiscoveryResult(fetched, List.copyOf(urls), errors);
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }

    private String extractXmlPayload(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null && fetch.body() != null) {
            bodyBytes = fetch.body().getBytes(StandardCharsets.UTF_8);
        }
        if (bodyBytes == null) {
            return fetch.body();
        }
        if (isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
                return new String(gzipInputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(bodyBytes, StandardCharsets.UTF_8);
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        boolean hasMagic = bodyBytes.length >= 2
            && (bodyBytes[0] & 0xFF) == 0x1f
            && (bodyBytes[1] & 0xFF) == 0x8b;
        if (hasMagic) {
            return true;
        }
        // transparently decompressed responses keep the header but lose the magic bytes
        String contentEncoding = fetch.contentEncoding();
        if (contentEncoding != null && contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return bodyBytes.length > 0 && bodyBytes[0] != '<';
        }
        String requested = sitemapUrl.toLowerCase(Locale.ROOT);
        return requested.endsWith(".gz") && bodyBytes.length > 0 && bodyBytes[0] != '<';
    }

    private String normalizeSitemapUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String normalized = url.trim();
        if (!normalized.startsWith("http://") && !normalized.startsWith("https://")) {
            return null;
        }
        return normalized;
    }

    private record SitemapTask(String url, int depth) {
    }
}
