package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.CompetitionSeriesRecord;
import com.afttsync.domain.model.DateRange;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.UpstreamDocument;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Series of one competition: {@code Date | Heure | Série | Inscriptions | Actions}. Entries are
 * printed as {@code "36 / 40"} or as a bare count. A competition without series has no table.
 */
public class CompetitionSeriesExtractor implements DocumentExtractor {

    private static final Pattern ENTRIES = Pattern.compile("(?<!\\d)(\\d{1,9})\\s*/\\s*(\\d{1,9})(?!\\d)");

    @Override
    public DocumentKind kind() {
        return DocumentKind.COMPETITION_SERIES;
    }

    @Override
    public ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException {
        long competitionId = CompetitionPages.competitionId(source, html);

        Optional<Element> table = html.select("table").stream()
            .filter(candidate -> {
                List<String> headers = HtmlText.headerTexts(candidate);
                return headers.contains("Série") || (headers.contains("Date") && headers.contains("Heure"));
            })
            .findFirst();
        if (table.isEmpty()) {
            return ExtractionResult.empty();
        }

        List<ExtractedRecord> records = new ArrayList<>();
        Elements rows = table.get().select("tr");
        for (int i = 1; i < rows.size(); i++) {
            Elements cells = rows.get(i).select("td");
            if (cells.size() < 4) {
                continue;
            }
            Field<String> seriesName = HtmlText.cell(cells, 2);
            if (seriesName.isAbsent()) {
                continue;
            }
            String entries = HtmlText.text(cells.get(3));
            Field<Integer> count;
            Field<Integer> max;
            Matcher matcher = ENTRIES.matcher(entries);
            if (matcher.find()) {
                count = Field.of(Integer.parseInt(matcher.group(1)));
                max = Field.of(Integer.parseInt(matcher.group(2)));
            } else {
                count = HtmlText.integer(entries);
                max = Field.absent();
            }
            records.add(new CompetitionSeriesRecord(competitionId, seriesName.get())
                .date(Field.of(DateRangeParser.parse(HtmlText.text(cells.get(0))).map(DateRange::start).orElse(null)))
                .time(HtmlText.cell(cells, 1))
                .entriesCount(count)
                .entriesMax(max));
        }
        return new ExtractionResult(records, List.of());
    }
}
