package com.tarantula.crawl.links;

import com.tarantula.crawl.model.UriProtocol;
import com.tarantula.crawl.model.UriScope;
import com.tarantula.crawl.util.UrlNormalizer;

import java.net.URI;
import java.util.Locale;

public final class LinkClassifier {

    private LinkClassifier() {
    }

    /**
     * Scope decided from the raw href alone, or null when the href needs resolving first.
     */
    public static UriScope classifyPrefix(String rawHref) {
        String href = rawHref == null ? "" : rawHref.trim().toLowerCase(Locale.ROOT);
        if (href.isEmpty() || href.startsWith("#")) {
            return UriScope.ANCHOR;
        }
        if (href.startsWith("mailto:")) {
            return UriScope.MAILTO;
        }
        if (href.startsWith("javascript:")) {
            return UriScope.CODE;
        }
        if (href.startsWith("data:")) {
            return UriScope.EMBEDDED_IMAGE;
        }
        if (hasScheme(href) && !href.startsWith("http:") && !href.startsWith("https:")) {
            return UriScope.UNKNOWN_PREFIX;
        }
        return null;
    }

    public static UriScope classifyTarget(String pageUrl, String targetUrl) {
        URI page = UrlNormalizer.safeUri(pageUrl);
        URI target = UrlNormalizer.safeUri(targetUrl);
        if (page == null || target == null || page.getHost() == null || target.getHost() == null) {
            return UriScope.EXTERNAL;
        }
        String pageHost = page.getHost().toLowerCase(Locale.ROOT);
        String targetHost = target.getHost().toLowerCase(Locale.ROOT);
        if (pageHost.equals(targetHost)) {
            String path = target.getRawPath();
            boolean root = (path == null || path.isEmpty() || "/".equals(path)) && target.getRawQuery() == null;
            return root ? UriScope.ROOT : UriScope.SAME_DOMAIN;
        }
        return baseDomain(pageHost).equals(baseDomain(targetHost))
            ? UriScope.DIFFERENT_SUBDOMAIN
            : UriScope.EXTERNAL;
    }

    public static UriProtocol protocolOf(String rawHref) {
        String href = rawHref == null ? "" : rawHref.trim().toLowerCase(Locale.ROOT);
        if (href.startsWith("//")) {
            return UriProtocol.IMPLICIT;
        }
        if (href.startsWith("https:")) {
            return UriProtocol.HTTPS;
        }
        if (href.startsWith("http:")) {
            return UriProtocol.HTTP;
        }
        return null;
    }

    // last two labels; good enough to tell "www.example.com" and "blog.example.com" apart from others
    static String baseDomain(String host) {
        String[] labels = host.split("\\.");
        if (labels.length <= 2) {
            return host;
        }
        return labels[labels.length - 2] + "." + labels[labels.length - 1];
    }

    private static boolean hasScheme(String href) {
        int colon = href.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        int slash = href.indexOf('/');
        int query = href.indexOf('?');
        if ((slash >= 0 && slash < colon) || (query >= 0 && query < colon)) {
            return false;
        }
        for (int i = 0; i < colon; i++) {
            char c = href.charAt(i);
            boolean valid = Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.';
            if (!valid || (i == 0 && !Character.isLetter(c))) {
                return false;
            }
        }
        return true;
    }
}
