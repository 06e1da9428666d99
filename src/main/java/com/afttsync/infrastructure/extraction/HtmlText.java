package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.NormalizationUtils;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the extractors.
 */
final class HtmlText {

    private static final Pattern DECIMAL = Pattern.compile("[-+]?\\d+(?:[.,]\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("^[-+]?\\d{1,9}$");
    private static final List<String> YES = List.of("oui", "yes", "true", "1");

    private HtmlText() {
    }

    static String text(Element element) {
        return element == null ? "" : NormalizationUtils.collapseWhitespace(element.text());
    }

    /**
     * Trimmed cell texts of a table row ({@code th} and {@code td}).
     */
    static List<String> cellTexts(Element row) {
        return row.children().stream()
            .filter(cell -> "th".equals(cell.normalName()) || "td".equals(cell.normalName()))
            .map(HtmlText::text)
            .toList();
    }

    static List<String> headerTexts(Element table) {
        return table.select("th").stream().map(HtmlText::text).toList();
    }

    /**
     * Cell at a position as a field; missing and blank cells are absent.
     */
    static Field<String> cell(Elements cells, int index) {
        return index < cells.size() ? Field.ofText(text(cells.get(index))) : Field.absent();
    }

    /**
     * Visual lines of an element: block elements and {@code <br>} end a line.
     */
    static List<String> lines(Element element) {
        Element copy = element.clone();
        for (Element block : copy.select("br, p, div, li, tr, h1, h2, h3, h4, h5, h6")) {
            if (block != copy) {
                block.after(new TextNode("\n"));
            }
        }
        return Arrays.stream(copy.wholeText().split("\n"))
            .map(NormalizationUtils::collapseWhitespace)
            .filter(line -> !line.isEmpty())
            .toList();
    }

    /**
     * First decimal number in the text; comma and dot are both decimal separators.
     */
    static Field<Double> decimal(String text) {
        if (text == null) {
            return Field.absent();
        }
        Matcher matcher = DECIMAL.matcher(text);
        if (!matcher.find()) {
            return Field.absent();
        }
        return Field.of(Double.parseDouble(matcher.group().replace(',', '.')));
    }

    static Field<Integer> integer(String text) {
        if (text == null) {
            return Field.absent();
        }
        String trimmed = text.trim();
        return INTEGER.matcher(trimmed).matches() ? Field.of(Integer.parseInt(trimmed.replace("+", ""))) : Field.absent();
    }

    static Field<Boolean> yesNo(String text) {
        Field<String> value = Field.ofText(text);
        return value.map(v -> YES.contains(v.toLowerCase(Locale.ROOT)));
    }

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a {@code key: value} line; empty when the line has no colon.
     */
    static Optional<String[]> keyValue(String line) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new String[] {lower(line.substring(0, colon).trim()), line.substring(colon + 1).trim()});
    }
}
