package com.siteaudit.scan.crawl;

import com.siteaudit.scan.util.UrlSupport;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Keeps links on the audited host (with or without {@code www.}) plus other hosts, subdomains
 * included, that look like commerce or booking front-ends. Social networks and static files are dropped.
 */
public final class LinkScopeFilter {
    private static final List<String> STATIC_EXTENSIONS = List.of(
        ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".zip", ".mp4", ".mp3", ".css", ".js", ".xml", ".ico"
    );

    private LinkScopeFilter() {
    }

    public static boolean inScope(String url, String siteHost) {
        URI uri = UrlSupport.httpUri(url);
        if (uri == null || siteHost == null) {
            return false;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (isSocialHost(host)) {
            return false;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (STATIC_EXTENSIONS.stream().anyMatch(path::endsWith)) {
            return false;
        }
        if (stripWww(host).equals(stripWww(siteHost.toLowerCase(Locale.ROOT)))) {
            return true;
        }
        return PageKeywords.BOOKING_HOSTS.stream().anyMatch(host::contains)
            || PageKeywords.COMMERCE_HOSTS.stream().anyMatch(host::contains);
    }

    public static boolean isSocialHost(String host) {
        String value = host == null ? "" : host.toLowerCase(Locale.ROOT);
        return PageKeywords.SOCIAL_HOSTS.stream()
            .anyMatch(social -> value.equals(social) || value.endsWith("." + social));
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }
}
