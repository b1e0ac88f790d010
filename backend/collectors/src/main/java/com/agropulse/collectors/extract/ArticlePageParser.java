package com.agropulse.collectors.extract;

import com.agropulse.core.util.TextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

class ArticlePageParser {
    static final List<String> CONTAINER_SELECTORS = List.of(".materia", ".conteudo", ".news-body", ".content", "article", "main");
    private static final List<String> IMAGE_ATTRIBUTES = List.of("src", "data-src", "data-original", "data-lazy-src");
    private static final List<String> BOILERPLATE = List.of("logotipo");
    private static final int MIN_PARAGRAPH = 25;
    private static final int PREFERRED_PARAGRAPH = 50;
    private static final int PARAGRAPHS_CONSIDERED = 5;

    private final PublishedDateParser dates;

    ArticlePageParser(PublishedDateParser dates) {
        this.dates = dates;
    }

    ArticleDraft parse(Document doc, ArticleStub stub) throws ExtractException {
        Element container = container(doc)
                .orElseThrow(() -> new ExtractException(
                        ExtractException.Kind.UNPARSEABLE, "No article container in " + doc.location()));

        String title = title(doc).orElse(stub.title());
        if (title.isEmpty()) {
            throw ExtractException.missing("title", stub.url());
        }
        String summary = summary(container).orElse(stub.teaser());
        String image = image(doc, container).orElse(stub.imageUrl());
        Instant publishedAt = publishedAt(doc).orElse(stub.listedAt());
        if (publishedAt == null) {
            throw ExtractException.missing("publish date", stub.url());
        }
        return new ArticleDraft(title, stub.url(), summary, image, publishedAt);
    }

    private static Optional<Element> container(Document doc) {
        for (String selector : CONTAINER_SELECTORS) {
            Element element = doc.selectFirst(selector);
            if (element != null) {
                return Optional.of(element);
            }
        }
        if (doc.selectFirst("h1, h2") != null) {
            return Optional.of(doc.body());
        }
        return Optional.empty();
    }

    static Optional<String> title(Document doc) {
        for (String selector : List.of("h1", "h2")) {
            Element element = doc.selectFirst(selector);
            if (element != null && !TextUtils.isBlank(element.text())) {
                return Optional.of(TextUtils.collapseWhitespace(element.text()));
            }
        }
        return TextUtils.isBlank(doc.title()) ? Optional.empty() : Optional.of(TextUtils.collapseWhitespace(doc.title()));
    }

    static Optional<String> summary(Element container) {
        List<String> paragraphs = container.select("p").stream()
                .map(p -> TextUtils.collapseWhitespace(p.text()))
                .filter(text -> text.length() > MIN_PARAGRAPH)
                .filter(text -> !TextUtils.containsAny(text, BOILERPLATE))
                .limit(PARAGRAPHS_CONSIDERED)
                .collect(Collectors.toList());
        return paragraphs.stream()
                .filter(text -> text.length() > PREFERRED_PARAGRAPH)
                .findFirst()
                .or(() -> paragraphs.stream().findFirst());
    }

    static Optional<String> image(Document doc, Element container) {
        Element og = doc.selectFirst("meta[property=og:image]");
        if (og != null && !og.absUrl("content").isEmpty()) {
            return Optional.of(og.absUrl("content"));
        }
        for (Element img : container.select("img")) {
            for (String attribute : IMAGE_ATTRIBUTES) {
                String url = img.absUrl(attribute);
                if (!url.isEmpty()) {
                    return Optional.of(url);
                }
            }
        }
        return Optional.empty();
    }

    Optional<Instant> publishedAt(Document doc) {
        Element meta = doc.selectFirst("meta[property=article:published_time]");
        if (meta != null) {
            Optional<Instant> parsed = dates.parseMachine(meta.attr("content"));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        Element time = doc.selectFirst("time[datetime]");
        if (time != null) {
            Optional<Instant> parsed = dates.parseMachine(time.attr("datetime"));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        Element block = doc.selectFirst(".datas");
        if (block == null) {
            block = doc.selectFirst(".meta");
        }
        return block == null ? Optional.empty() : dates.parseLocalText(block.text());
    }
}
