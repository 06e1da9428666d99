package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.OrganizationRecord;
import com.afttsync.domain.model.UpstreamDocument;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Organization selector of the rankings page: one {@code <option>} per organization,
 * labelled {@code "CODE - NAME"}. Placeholder options start with {@code --}.
 */
public class OrganizationListExtractor implements DocumentExtractor {

    private static final Pattern OPTION = Pattern.compile("^([A-Za-z0-9\\-_]+)\\s*-\\s*(.+)$");

    @Override
    public DocumentKind kind() {
        return DocumentKind.ORGANIZATION_LIST;
    }

    @Override
    public ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException {
        Element select = html.selectFirst("select");
        if (select == null) {
            throw new ExtractionException("No organization selector on the organization list", html.text());
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        for (Element option : select.select("option")) {
            String label = HtmlText.text(option);
            if (label.isEmpty() || label.startsWith("--")) {
                continue;
            }
            Matcher matcher = OPTION.matcher(label);
            if (!matcher.matches()) {
                diagnostics.add("Unrecognized organization option '" + label + "'");
                continue;
            }
            records.add(new OrganizationRecord(matcher.group(1)).name(Field.ofText(matcher.group(2))));
        }
        return new ExtractionResult(records, diagnostics);
    }
}
