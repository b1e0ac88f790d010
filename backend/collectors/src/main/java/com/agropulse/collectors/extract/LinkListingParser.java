package com.agropulse.collectors.extract;

import com.agropulse.core.model.FeedSource;
import com.agropulse.core.util.TextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

class LinkListingParser {

    List<ArticleStub> parse(Document doc, FeedSource feed, int maxCandidates) {
        Set<String> seen = new LinkedHashSet<>();
        List<ArticleStub> stubs = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String url = anchor.absUrl("href");
            String title = TextUtils.collapseWhitespace(anchor.text());
            if (!accepts(feed, url, title) || !seen.add(url)) {
                continue;
            }
            if (title.isEmpty()) {
                title = titleFromSlug(url);
            }
            stubs.add(new ArticleStub(url, title, "", "", null));
            if (stubs.size() >= maxCandidates) {
                break;
            }
        }
        return stubs;
    }

    static boolean accepts(FeedSource feed, String url, String title) {
        if (url.isEmpty()) {
            return false;
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return false;
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        if (feed.hostFilter() != null && !feed.hostFilter().isBlank() && !onHost(host, feed.hostFilter())) {
            return false;
        }
        if (!feed.pathIncludes().isEmpty() && feed.pathIncludes().stream()
                .map(fragment -> fragment.toLowerCase(Locale.ROOT))
                .noneMatch(path::contains)) {
            return false;
        }
        String loweredUrl = url.toLowerCase(Locale.ROOT);
        String loweredTitle = TextUtils.lower(title);
        return feed.excludedTerms().stream()
                .map(term -> term.toLowerCase(Locale.ROOT))
                .noneMatch(term -> loweredUrl.contains(term) || loweredTitle.contains(term));
    }

    private static boolean onHost(String host, String hostFilter) {
        String expected = hostFilter.toLowerCase(Locale.ROOT);
        return host.equals(expected) || host.endsWith("." + expected);
    }

    static String titleFromSlug(String url) {
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        String slug = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        int dot = slug.indexOf('.');
        if (dot > 0) {
            slug = slug.substring(0, dot);
        }
        return TextUtils.collapseWhitespace(slug.replace('-', ' ').replace('_', ' '));
    }
}
