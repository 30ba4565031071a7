package com.tarantula.crawl.links;

import com.tarantula.crawl.model.Link;
import com.tarantula.crawl.model.UriScope;
import com.tarantula.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LinkExtractor {
    private static final String LINK_SELECTOR = "a[href], area[href]";

    /**
     * Crawlable http(s) links of a page, normalized and deduplicated in document order. Relative
     * hrefs resolve against {@code baseUrl} unless the page declares a {@code <base href>}.
     */
    public List<Link> extract(String baseUrl, String html) {
        if (html == null || html.isBlank() || baseUrl == null) {
            return List.of();
        }
        String pageUrl = UrlNormalizer.normalize(baseUrl);
        if (pageUrl == null) {
            return List.of();
        }
        Document doc = Jsoup.parse(html, pageUrl);
        Map<String, Link> links = new LinkedHashMap<>();
        for (Element element : doc.select(LINK_SELECTOR)) {
            String rawHref = element.attr("href");
            UriScope prefixScope = LinkClassifier.classifyPrefix(rawHref);
            if (prefixScope != null) {
                continue;
            }
            String absolute = element.attr("abs:href");
            String normalized = absolute.isBlank()
                ? UrlNormalizer.resolve(pageUrl, rawHref)
                : UrlNormalizer.normalize(absolute);
            if (normalized == null || links.containsKey(normalized)) {
                continue;
            }
            links.put(normalized, new Link(
                normalized,
                LinkClassifier.classifyTarget(pageUrl, normalized),
                LinkClassifier.protocolOf(rawHref),
                element.tagName()
            ));
        }
        return new ArrayList<>(links.values());
    }
}
