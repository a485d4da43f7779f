package com.siteaudit.scan.crawl;

import com.siteaudit.scan.util.UrlSupport;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Pre-split view of a candidate URL relative to the audited site.
 */
record UrlFacts(
    String url,
    String host,
    boolean external,
    String path,
    List<String> segments,
    boolean hasQuery
) {
    static UrlFacts of(String url, String siteHost) {
        URI uri = UrlSupport.safeUri(url);
        String host = uri == null || uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri == null || uri.getPath() == null || uri.getPath().isEmpty()
            ? "/"
            : uri.getPath().toLowerCase(Locale.ROOT);
        List<String> segments = Arrays.stream(path.split("/"))
            .filter(segment -> !segment.isBlank())
            .toList();
        boolean external = siteHost != null && !stripWww(host).equals(stripWww(siteHost));
        boolean hasQuery = uri != null && uri.getRawQuery() != null && !uri.getRawQuery().isBlank();
        return new UrlFacts(url, host, external, path, segments, hasQuery);
    }

    int depth() {
        return segments.size();
    }

    String lastSegment() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    boolean hasSegment(List<String> keywords) {
        return segments.stream().anyMatch(segment -> matchesKeyword(segment, keywords));
    }

    boolean hostContains(List<String> keywords) {
        return keywords.stream().anyMatch(host::contains);
    }

    /**
     * Segment equals the keyword, its plural, or starts with {@code keyword-}.
     */
    static boolean matchesKeyword(String segment, List<String> keywords) {
        for (String keyword : keywords) {
            if (segment.equals(keyword) || segment.equals(keyword + "s") || segment.startsWith(keyword + "-")) {
                return true;
            }
        }
        return false;
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
