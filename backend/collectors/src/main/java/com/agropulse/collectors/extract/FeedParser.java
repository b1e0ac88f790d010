package com.agropulse.collectors.extract;

import com.agropulse.core.util.TextUtils;
import org.jsoup.Jsoup;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

// Not namespace aware: prefixed elements such as dc:date and media:content are looked up by qualified name.
class FeedParser {
    private final PublishedDateParser dates;

    FeedParser(PublishedDateParser dates) {
        this.dates = dates;
    }

    List<ArticleStub> parse(String xml, String feedUrl, int maxCandidates) throws ExtractException {
        Document document = parseXml(xml, feedUrl);
        Element root = document.getDocumentElement();
        String rootName = root == null ? "" : root.getTagName().toLowerCase(Locale.ROOT);
        List<ArticleStub> stubs;
        if ("rss".equals(rootName) || "rdf:rdf".equals(rootName)) {
            stubs = parseRss(document, feedUrl);
        } else if ("feed".equals(rootName)) {
            stubs = parseAtom(document, feedUrl);
        } else {
            throw new ExtractException(ExtractException.Kind.UNPARSEABLE, "Not an RSS/Atom document: " + feedUrl);
        }
        return stubs.size() > maxCandidates ? List.copyOf(stubs.subList(0, maxCandidates)) : stubs;
    }

    private List<ArticleStub> parseRss(Document document, String feedUrl) {
        NodeList items = document.getElementsByTagName("item");
        List<ArticleStub> stubs = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            if (!(items.item(i) instanceof Element item)) {
                continue;
            }
            Optional<String> link = childText(item, "link").map(value -> resolve(feedUrl, value));
            if (link.isEmpty() || link.get().isEmpty()) {
                continue;
            }
            Instant listedAt = childText(item, "pubDate")
                    .or(() -> childText(item, "dc:date"))
                    .flatMap(dates::parseMachine)
                    .orElse(null);
            String image = childAttribute(item, "enclosure", "url")
                    .or(() -> childAttribute(item, "media:content", "url"))
                    .or(() -> childAttribute(item, "media:thumbnail", "url"))
                    .orElse("");
            stubs.add(new ArticleStub(
                    link.get(),
                    childText(item, "title").map(TextUtils::collapseWhitespace).orElse(""),
                    childText(item, "description").map(FeedParser::plainText).orElse(""),
                    image,
                    listedAt
            ));
        }
        return stubs;
    }

    private List<ArticleStub> parseAtom(Document document, String feedUrl) {
        NodeList entries = document.getElementsByTagName("entry");
        List<ArticleStub> stubs = new ArrayList<>();
        for (int i = 0; i < entries.getLength(); i++) {
            if (!(entries.item(i) instanceof Element entry)) {
                continue;
            }
            Optional<String> link = alternateLink(entry).map(value -> resolve(feedUrl, value));
            if (link.isEmpty() || link.get().isEmpty()) {
                continue;
            }
            Instant listedAt = childText(entry, "published")
                    .or(() -> childText(entry, "updated"))
                    .flatMap(dates::parseMachine)
                    .orElse(null);
            String teaser = childText(entry, "summary")
                    .or(() -> childText(entry, "content"))
                    .map(FeedParser::plainText)
                    .orElse("");
            stubs.add(new ArticleStub(
                    link.get(),
                    childText(entry, "title").map(TextUtils::collapseWhitespace).orElse(""),
                    teaser,
                    childAttribute(entry, "media:content", "url").orElse(""),
                    listedAt
            ));
        }
        return stubs;
    }

    private static Document parseXml(String xml, String feedUrl) throws ExtractException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    // recoverable, keep parsing
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            return builder.parse(new InputSource(new StringReader(xml.strip())));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ExtractException(ExtractException.Kind.UNPARSEABLE, "Invalid RSS/Atom XML from " + feedUrl, e);
        }
    }

    private static Optional<String> alternateLink(Element entry) {
        NodeList links = entry.getElementsByTagName("link");
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href");
            if (href.isBlank()) {
                continue;
            }
            String rel = link.getAttribute("rel");
            if (rel.isBlank() || "alternate".equals(rel)) {
                return Optional.of(href.trim());
            }
            if (fallback == null) {
                fallback = href.trim();
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<String> childText(Element parent, String tagName) {
        NodeList children = parent.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        return text == null || text.isBlank() ? Optional.empty() : Optional.of(text.trim());
    }

    private static Optional<String> childAttribute(Element parent, String tagName, String attribute) {
        NodeList children = parent.getElementsByTagName(tagName);
        if (children.getLength() == 0 || !(children.item(0) instanceof Element child)) {
            return Optional.empty();
        }
        String value = child.getAttribute(attribute);
        return value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static String plainText(String html) {
        return TextUtils.collapseWhitespace(Jsoup.parse(html).text());
    }

    private static String resolve(String base, String link) {
        try {
            return URI.create(base).resolve(link.trim()).toString();
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
