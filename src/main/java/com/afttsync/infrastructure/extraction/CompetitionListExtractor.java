package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.CompetitionRecord;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One page of the competitions table: {@code Nom | Niveau | Date | Réf. | Séries | Actions}.
 * The competition id is read from the {@code t_id} parameter of the action links.
 */
public class CompetitionListExtractor implements DocumentExtractor {

    private static final Pattern COMPETITION_ID = Pattern.compile("t_id=(\\d{1,18})(?!\\d)");
    private static final Pattern PAGE = Pattern.compile("cur_page=(\\d{1,9})(?!\\d)");

    @Override
    public DocumentKind kind() {
        return DocumentKind.COMPETITION_LIST;
    }

    @Override
    public ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException {
        Element table = html.select("table").stream()
            .filter(candidate -> {
                List<String> headers = HtmlText.headerTexts(candidate);
                return headers.contains("Nom") && headers.contains("Niveau");
            })
            .findFirst()
            .orElseThrow(() -> new ExtractionException("No competitions table", html.text()));

        List<ExtractedRecord> records = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        Elements rows = table.select("tr");
        for (int i = 1; i < rows.size(); i++) {
            Elements cells = rows.get(i).select("td");
            if (cells.size() < 5) {
                // pagination row
                continue;
            }
            Field<String> name = HtmlText.cell(cells, 0);
            long competitionId = cells.size() > 5 ? competitionId(cells.get(5)) : 0L;
            if (competitionId <= 0 || name.isAbsent()) {
                diagnostics.add("Skipped competition row without id or name: '" + HtmlText.text(rows.get(i)) + "'");
                continue;
            }
            records.add(new CompetitionRecord(competitionId)
                .name(name)
                .level(HtmlText.cell(cells, 1))
                .dates(Field.of(DateRangeParser.parse(HtmlText.text(cells.get(2))).orElse(null)))
                .reference(HtmlText.cell(cells, 3))
                .seriesCount(HtmlText.integer(HtmlText.text(cells.get(4)))));
        }
        return new ExtractionResult(records, diagnostics, lastPage(html));
    }

    private static long competitionId(Element actions) {
        for (Element link : actions.select("a[href]")) {
            Matcher matcher = COMPETITION_ID.matcher(link.attr("href"));
            if (matcher.find()) {
                return Long.parseLong(matcher.group(1));
            }
        }
        return 0L;
    }

    private static int lastPage(Document html) {
        int lastPage = 1;
        for (Element link : html.select("a[href*=cur_page=]")) {
            Matcher matcher = PAGE.matcher(link.attr("href"));
            if (matcher.find()) {
                lastPage = Math.max(lastPage, Integer.parseInt(matcher.group(1)));
            }
        }
        return lastPage;
    }
}
