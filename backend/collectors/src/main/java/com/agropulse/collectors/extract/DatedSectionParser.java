package com.agropulse.collectors.extract;

import com.agropulse.core.util.TextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

class DatedSectionParser {
    private static final Pattern HEADING = Pattern.compile("\\d{2}/\\d{2}/\\d{4}");

    private final PublishedDateParser dates;

    DatedSectionParser(PublishedDateParser dates) {
        this.dates = dates;
    }

    List<ArticleStub> parse(Document doc, int maxCandidates) throws ExtractException {
        Element content = doc.getElementById("content");
        if (content == null) {
            throw new ExtractException(ExtractException.Kind.UNPARSEABLE, "No #content block in " + doc.location());
        }
        List<ArticleStub> stubs = new ArrayList<>();
        for (Element heading : content.select("h3")) {
            String headingText = TextUtils.collapseWhitespace(heading.text());
            if (!HEADING.matcher(headingText).matches()) {
                continue;
            }
            Element list = followingList(heading);
            if (list == null) {
                continue;
            }
            for (Element item : list.select("li.horizontal")) {
                Element anchor = item.selectFirst("a[href]");
                Element title = item.selectFirst("h2");
                if (anchor == null || title == null) {
                    continue;
                }
                String url = anchor.absUrl("href");
                if (url.isEmpty()) {
                    continue;
                }
                Element time = item.selectFirst(".hora");
                Instant listedAt = dates.combine(headingText, time == null ? null : time.text()).orElse(null);
                stubs.add(new ArticleStub(url, TextUtils.collapseWhitespace(title.text()), "", "", listedAt));
                if (stubs.size() >= maxCandidates) {
                    return stubs;
                }
            }
        }
        return stubs;
    }

    private static Element followingList(Element heading) {
        for (Element sibling : heading.nextElementSiblings()) {
            if ("ul".equals(sibling.tagName())) {
                return sibling;
            }
        }
        return null;
    }
}
