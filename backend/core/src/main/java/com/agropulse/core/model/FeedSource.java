package com.agropulse.core.model;

import java.util.List;
import java.util.Objects;

public record FeedSource(
        String id,
        String name,
        ListingFormat format,
        List<String> listingUrls,
        String hostFilter,
        List<String> pathIncludes,
        List<String> excludedTerms,
        List<String> fallbackUrls
) {
    public FeedSource {
        Objects.requireNonNull(id, "id is required");
        name = name == null ? id : name;
        format = format == null ? ListingFormat.LINKS : format;
        listingUrls = listingUrls == null ? List.of() : List.copyOf(listingUrls);
        pathIncludes = pathIncludes == null ? List.of() : List.copyOf(pathIncludes);
        excludedTerms = excludedTerms == null ? List.of() : List.copyOf(excludedTerms);
        fallbackUrls = fallbackUrls == null ? List.of() : List.copyOf(fallbackUrls);
    }
}
