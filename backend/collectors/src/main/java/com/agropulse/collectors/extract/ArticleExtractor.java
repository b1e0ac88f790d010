package com.agropulse.collectors.extract;

import com.agropulse.collectors.fetch.RawDocument;
import com.agropulse.core.model.FeedSource;
import com.agropulse.core.model.ListingFormat;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.time.ZoneId;
import java.util.List;

public class ArticleExtractor {
    private final DatedSectionParser datedSections;
    private final FeedParser feeds;
    private final LinkListingParser links;
    private final ArticlePageParser pages;

    public ArticleExtractor(ZoneId zone) {
        PublishedDateParser dates = new PublishedDateParser(zone);
        this.datedSections = new DatedSectionParser(dates);
        this.feeds = new FeedParser(dates);
        this.links = new LinkListingParser();
        this.pages = new ArticlePageParser(dates);
    }

    public List<ArticleStub> parseListing(RawDocument doc, ListingFormat format, FeedSource feed, int maxCandidates)
            throws ExtractException {
        return switch (format) {
            case DATED_SECTIONS -> datedSections.parse(html(doc), maxCandidates);
            case RSS -> feeds.parse(doc.body(), doc.url(), maxCandidates);
            case LINKS -> {
                if (feed == null) {
                    throw new ExtractException(ExtractException.Kind.UNPARSEABLE, "Link listing without a feed definition: " + doc.url());
                }
                yield links.parse(html(doc), feed, maxCandidates);
            }
        };
    }

    public boolean needsDetail(ArticleStub stub) {
        return stub.title().isEmpty()
                || stub.listedAt() == null
                || stub.teaser().isEmpty()
                || stub.imageUrl().isEmpty();
    }

    public ArticleDraft fromStub(ArticleStub stub) throws ExtractException {
        if (stub.title().isEmpty()) {
            throw ExtractException.missing("title", stub.url());
        }
        if (stub.listedAt() == null) {
            throw ExtractException.missing("publish date", stub.url());
        }
        return new ArticleDraft(stub.title(), stub.url(), stub.teaser(), stub.imageUrl(), stub.listedAt());
    }

    public ArticleDraft parseArticle(RawDocument doc, ArticleStub stub) throws ExtractException {
        return pages.parse(html(doc), stub);
    }

    private static Document html(RawDocument doc) {
        return Jsoup.parse(doc.body(), doc.url());
    }
}
