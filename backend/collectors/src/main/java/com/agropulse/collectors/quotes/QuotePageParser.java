package com.agropulse.collectors.quotes;

import com.agropulse.core.model.Quote;
import com.agropulse.core.util.TextUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class QuotePageParser {
    public static final IndicatorSpec CAFE = new IndicatorSpec(
            "cafe", "Café", "Indicador Café Arábica - Cepea/Esalq", "R$/sc", "Cepea/Esalq");
    public static final IndicatorSpec CAFE_ON_MAIN_PAGE = new IndicatorSpec(
            "cafe", "Café", "Café", "R$/sc", "Cepea/Esalq");
    public static final IndicatorSpec MILHO = new IndicatorSpec(
            "milho", "Milho", "Indicador do Milho Esalq/B3", "R$/sc 60 kg", "ESALQ/B3");
    public static final IndicatorSpec SOJA = new IndicatorSpec(
            "soja", "Soja", "Indicador da Soja ESALQ/B3 - Paranaguá", "R$/sc", "ESALQ/B3 - Paranaguá");

    private static final Pattern CURRENCY_VALUE = Pattern.compile("R\\$\\s*(\\d{1,3}(?:\\.\\d{3})*,\\d{2}|\\d{1,3}[.,]\\d{2})");
    private static final Pattern BARE_VALUE = Pattern.compile("(\\d{1,3}(?:\\.\\d{3})*,\\d{2}|\\d{1,3}[.,]\\d{2})");
    private static final Pattern CHANGE = Pattern.compile("([+-]?\\d{1,3}(?:[.,]\\d{2})%)");
    private static final int TABLES_AFTER_HEADING = 4;

    private QuotePageParser() {
    }

    public record IndicatorSpec(String key, String label, String heading, String unit, String source) {
    }

    public static Quote dollar(Document doc) {
        Element value = doc.selectFirst(".box-dolar .valor");
        Element change = doc.selectFirst(".box-dolar .porcentagem");
        return new Quote(
                "dolar",
                "Dólar",
                value == null ? "" : TextUtils.collapseWhitespace(value.text()),
                change == null ? "" : TextUtils.collapseWhitespace(change.text()),
                "R$",
                "Notícias Agrícolas"
        );
    }

    public static Quote indicator(Document doc, IndicatorSpec spec) {
        List<Element> tables = tablesAfterHeading(doc, spec.heading());
        String value = "";
        String change = "";
        if (!tables.isEmpty()) {
            String text = TextUtils.collapseWhitespace(tables.get(0).text());
            value = firstGroup(CURRENCY_VALUE, text);
            if (value.isEmpty()) {
                value = firstGroup(BARE_VALUE, text);
            }
            change = firstGroup(CHANGE, text);
        }
        return new Quote(spec.key(), spec.label(), value, change, spec.unit(), spec.source());
    }

    static List<Element> tablesAfterHeading(Document doc, String heading) {
        String needle = heading.toLowerCase(Locale.ROOT);
        List<Element> tables = new ArrayList<>();
        boolean found = false;
        for (Element element : doc.select("h2, h3, table")) {
            if (!found) {
                found = !"table".equals(element.tagName())
                        && TextUtils.lower(TextUtils.collapseWhitespace(element.text())).contains(needle);
                continue;
            }
            if ("table".equals(element.tagName())) {
                tables.add(element);
                if (tables.size() == TABLES_AFTER_HEADING) {
                    break;
                }
            }
        }
        return tables;
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : "";
    }
}
