package com.tarantula.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonical form used for URL identity inside a run: lower-case scheme and host, no default port,
 * no fragment, dot segments removed, empty path as "/". The query is kept byte for byte.
 */
public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        URI uri = safeUri(url);
        if (uri == null || !isHttpScheme(uri) || uri.getHost() == null || uri.getHost().isBlank()) {
            return null;
        }
        return normalize(uri);
    }

    public static String normalize(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(scheme).append("://").append(authority(scheme, uri));
        String path = uri.getRawPath();
        out.append(path == null || path.isEmpty() ? "/" : path);
        if (uri.getRawQuery() != null) {
            out.append('?').append(uri.getRawQuery());
        }
        URI rebuilt = safeUri(out.toString());
        if (rebuilt == null) {
            return null;
        }
        URI normalized = rebuilt.normalize();
        String normalizedPath = stripLeadingParentSegments(normalized.getRawPath());
        StringBuilder result = new StringBuilder(scheme).append("://").append(authority(scheme, normalized));
        result.append(normalizedPath);
        if (normalized.getRawQuery() != null) {
            result.append('?').append(normalized.getRawQuery());
        }
        return result.toString();
    }

    /**
     * Resolves {@code href} against {@code baseUrl} and normalizes the result, or returns null
     * when either side cannot be parsed.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String base = normalize(baseUrl);
        URI baseUri = base == null ? null : safeUri(base);
        URI ref = safeUri(href);
        if (baseUri == null || ref == null) {
            return null;
        }
        try {
            return normalize(baseUri.resolve(ref).toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Rate limiting key: lower-case host plus the port when it is not the scheme default.
     */
    public static String hostKey(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        return authority(uri.getScheme().toLowerCase(Locale.ROOT), uri);
    }

    public static String origin(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme + "://" + authority(scheme, uri);
    }

    public static boolean isHttpScheme(URI uri) {
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        try {
            return new URI(trimmed);
        } catch (URISyntaxException first) {
            if (!trimmed.contains(" ")) {
                return null;
            }
            try {
                return new URI(trimmed.replace(" ", "%20"));
            } catch (URISyntaxException ignored) {
                return null;
            }
        }
    }

    private static String authority(String scheme, URI uri) {
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || port == defaultPort(scheme)) {
            return host;
        }
        return host + ":" + port;
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : "http".equals(scheme) ? 80 : -1;
    }

    // URI.normalize keeps "/.." at the root of an absolute path
    private static String stripLeadingParentSegments(String path) {
        String current = path == null || path.isEmpty() ? "/" : path;
        while (current.startsWith("/../")) {
            current = current.substring(3);
        }
        return "/..".equals(current) ? "/" : current;
    }
}
