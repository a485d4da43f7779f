package com.siteaudit.scan.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlSupport {

    private UrlSupport() {
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    /**
     * Parses an absolute http(s) URL, returning null for anything else.
     */
    public static URI httpUri(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null || uri.getHost().isBlank()) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return null;
        }
        return uri;
    }

    public static String host(String url) {
        URI uri = httpUri(url);
        return uri == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Scheme, host and non-default port, without a trailing slash.
     */
    public static String origin(String url) {
        URI uri = httpUri(url);
        if (uri == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String origin = scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT);
        if (uri.getPort() > 0 && !isDefaultPort(scheme, uri.getPort())) {
            origin = origin + ":" + uri.getPort();
        }
        return origin;
    }

    public static boolean isHttps(String url) {
        URI uri = httpUri(url);
        return uri != null && "https".equalsIgnoreCase(uri.getScheme());
    }

    public static String path(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getPath() == null || uri.getPath().isEmpty()) {
            return "/";
        }
        return uri.getPath();
    }

    /**
     * Drops the fragment and a trailing slash on non-root paths so equivalent links collapse.
     */
    public static String canonicalize(String url) {
        URI uri = httpUri(url);
        if (uri == null) {
            return null;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
        return origin(url) + path + query;
    }

    /**
     * Identity of a page regardless of scheme or a leading {@code www.}; falls back to the raw URL
     * when it does not parse.
     */
    public static String pageKey(String url) {
        URI uri = httpUri(url);
        if (uri == null) {
            return url;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        if (uri.getPort() > 0 && uri.getPort() != 80 && uri.getPort() != 443) {
            host = host + ":" + uri.getPort();
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
        return host + path + query;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }
}
