package com.agropulse.core.model;

import com.agropulse.core.util.TextUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public record Topic(
        String id,
        String label,
        String sourceRef,
        String sourceName,
        ListingFormat format,
        Set<String> keywords,
        String color,
        List<String> classifierHints
) {
    public Topic {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(label, "label is required");
        format = format == null ? ListingFormat.DATED_SECTIONS : format;
        keywords = Set.copyOf(lowered(keywords, new LinkedHashSet<>()));
        classifierHints = List.copyOf(lowered(classifierHints, new ArrayList<>()));
        color = color == null ? "#777777" : color;
    }

    public static Topic of(String id, String label, String sourceRef, Set<String> keywords, String color) {
        return new Topic(id, label, sourceRef, null, ListingFormat.DATED_SECTIONS, keywords, color, List.of());
    }

    public String displaySource() {
        if (sourceName != null && !sourceName.isBlank()) {
            return sourceName;
        }
        if (sourceRef == null) {
            return id;
        }
        try {
            String host = URI.create(sourceRef).getHost();
            return host == null ? id : host;
        } catch (IllegalArgumentException e) {
            return id;
        }
    }

    public boolean accepts(String title, String summary) {
        return keywords.isEmpty() || TextUtils.containsAny(title + " " + summary, keywords);
    }

    public boolean mentionedIn(String text) {
        return TextUtils.lower(text).contains(id.toLowerCase(Locale.ROOT))
                || TextUtils.containsAny(text, keywords)
                || TextUtils.containsAny(text, classifierHints);
    }

    private static <C extends Collection<String>> C lowered(Collection<String> source, C target) {
        if (source != null) {
            for (String value : source) {
                if (!TextUtils.isBlank(value)) {
                    target.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return target;
    }
}
