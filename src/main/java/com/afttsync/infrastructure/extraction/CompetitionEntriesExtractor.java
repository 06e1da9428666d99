package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.CompetitionEntryRecord;
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

/**
 * Entries of one competition: {@code Série | Index | Nom | Club | Classement | Actions}. The
 * {@code Index} column holds the player's licence.
 */
public class CompetitionEntriesExtractor implements DocumentExtractor {

    @Override
    public DocumentKind kind() {
        return DocumentKind.COMPETITION_ENTRIES;
    }

    @Override
    public ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException {
        long competitionId = CompetitionPages.competitionId(source, html);

        Optional<Element> table = html.select("table").stream()
            .filter(candidate -> {
                List<String> headers = HtmlText.headerTexts(candidate);
                return headers.contains("Index") && headers.contains("Nom");
            })
            .findFirst();
        if (table.isEmpty()) {
            return ExtractionResult.empty();
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        Elements rows = table.get().select("tr");
        for (int i = 1; i < rows.size(); i++) {
            Elements cells = rows.get(i).select("td");
            if (cells.size() < 5) {
                continue;
            }
            Field<String> licence = HtmlText.cell(cells, 1);
            Field<String> name = HtmlText.cell(cells, 2);
            if (licence.isAbsent() || name.isAbsent()) {
                diagnostics.add("Skipped entry without licence or name in competition " + competitionId);
                continue;
            }
            records.add(new CompetitionEntryRecord(competitionId, HtmlText.cell(cells, 0).orElse(""), licence.get())
                .playerName(name)
                .playerClub(HtmlText.cell(cells, 3))
                .playerRank(HtmlText.cell(cells, 4)));
        }
        return new ExtractionResult(records, diagnostics);
    }
}
