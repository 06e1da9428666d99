package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.MatchRecord;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.OpponentBucketStatRecord;
import com.afttsync.infrastructure.upstream.AfttCatalogRequests;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static com.afttsync.infrastructure.extraction.EntityExtractorTest.document;
import static org.junit.jupiter.api.Assertions.*;

class ProfileExtractorTest {

    private static final String SHEET = """
        <html><body>
        <h2>103603 - JEAN-FRANCOIS CULOT - D0</h2>
        <h5>Points de départ</h5><h3>1450.5 pts</h3>
        <h5>Points actuels</h5><h3>1502,25 pts</h3>
        <h5>Classement</h5><h3>152e</h3>
        <p>Dernière mise à jour : 15/02/2026</p>
        <table>
          <tr><th></th><th>NC</th><th>E6</th><th>D0</th></tr>
          <tr><td>Victoires</td><td>3</td><td>2</td><td>0</td></tr>
          <tr><td>Défaites</td><td>1</td><td>0</td><td>4</td></tr>
          <tr><td>Ratio</td><td>75%</td><td>100%</td><td>0%</td></tr>
        </table>
        <div class="card">
          <div class="card-header">10/01/2026 - P3A - CTT Ciney B Total: 2 matchs</div>
          <div class="card-body">
            <div class="match-card">
              <h6>DUPONT PIERRE</h6><input type="hidden" name="licence" value="654321">
              <small>E2</small><small>1210 pts</small>
              <h5 class="fw-bold">3 - 1</h5><span class="badge">+4.5 pts</span>
            </div>
            <div class="match-card">
              <h6>Martin Luc</h6><small>NC</small>
              <h5 class="fw-bold">1 - 3</h5><span class="badge">-2 pts</span>
            </div>
          </div>
        </div>
        </body></html>
        """;

    private final AfttCatalogRequests requests =
        new AfttCatalogRequests("https://data.aftt.be", "https://resultats.aftt.be", Duration.ofSeconds(5));

    private final EntityExtractor extractor = new EntityExtractor(List.of(
        new ProfileExtractor(CompetitionType.MEN), new ProfileExtractor(CompetitionType.WOMEN)));

    @Test
    void testMenSheet() throws ExtractionException {
        ExtractionResult result = extractor.parse(document(requests.profile("103603", CompetitionType.MEN), SHEET),
            DocumentKind.PROFILE_MEN);

        MemberRecord member = (MemberRecord) result.records().get(0);
        assertEquals("103603", member.licence());
        assertEquals("JEAN-FRANCOIS CULOT", member.name().get());
        assertEquals("D0", member.rank().get());
        assertEquals(1450.5, member.pointsStart().get());
        assertEquals(1502.25, member.pointsCurrent().get());
        assertEquals(152, member.rankingPosition().get());
        assertEquals(5, member.totalWins().get());
        assertEquals(5, member.totalLosses().get());
        assertEquals(LocalDate.of(2026, 2, 15), member.lastUpdate().get());

        List<MatchRecord> matches = result.recordsOf(MatchRecord.class);
        assertEquals(2, matches.size());
        MatchRecord first = matches.get(0);
        assertEquals("103603|MEN|2026-01-10|P3A|654321", first.naturalKey());
        assertEquals("E2", first.opponentRank().get());
        assertEquals(1210.0, first.opponentPoints().get());
        assertEquals(Boolean.TRUE, first.won().get());
        assertEquals(4.5, first.pointsDelta().get());
        MatchRecord second = matches.get(1);
        assertEquals("103603|MEN|2026-01-10|P3A|MARTIN_LUC", second.naturalKey());
        assertEquals(Boolean.FALSE, second.won().get());
        assertEquals(-2.0, second.pointsDelta().get());

        List<OpponentBucketStatRecord> stats = result.recordsOf(OpponentBucketStatRecord.class);
        assertEquals(3, stats.size());
        assertEquals("NC", stats.get(0).bucket());
        assertEquals(3, stats.get(0).wins());
        assertEquals(1, stats.get(0).losses());
        assertEquals(75.0, stats.get(0).ratio().get());
    }

    @Test
    void testWomenSheetFillsWomenAttributesOnly() throws ExtractionException {
        ExtractionResult result = extractor.parse(document(requests.profile("103603", CompetitionType.WOMEN), SHEET),
            DocumentKind.PROFILE_WOMEN);

        MemberRecord member = (MemberRecord) result.records().get(0);
        assertEquals("D0", member.womenRank().get());
        assertEquals(1502.25, member.womenPointsCurrent().get());
        assertEquals(5, member.womenTotalWins().get());
        assertFalse(member.attributes().containsKey(MemberRecord.NAME));
        assertFalse(member.attributes().containsKey(MemberRecord.RANK));
        assertTrue(result.recordsOf(MatchRecord.class).stream()
            .allMatch(match -> match.competitionType() == CompetitionType.WOMEN));
    }

    @Test
    void testEmptyWomenSheetContributesNothing() throws ExtractionException {
        String warning = "<br><b>Warning</b>: Undefined array key \"nom\" in fiche_women.php on line 12<br>";
        String noMatches = "<html><body><h2>103603 - JEAN-FRANCOIS CULOT - NC</h2></body></html>";

        assertTrue(extractor.parse(document(requests.profile("103603", CompetitionType.WOMEN), warning),
            DocumentKind.PROFILE_WOMEN).records().isEmpty());
        ExtractionResult result = extractor.parse(document(requests.profile("103603", CompetitionType.WOMEN),
            noMatches), DocumentKind.PROFILE_WOMEN);
        assertTrue(result.records().isEmpty());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void testOverlongNumbersAreLeftAbsent() throws ExtractionException {
        String sheet = SHEET
            .replace("<h3>152e</h3>", "<h3>99999999999999999999e</h3>")
            .replace("<h5 class=\"fw-bold\">3 - 1</h5>", "<h5 class=\"fw-bold\">31234567890123 - 1</h5>")
            .replace("<td>Victoires</td><td>3</td>", "<td>Victoires</td><td>30000000000</td>");

        ExtractionResult result = extractor.parse(document(requests.profile("103603", CompetitionType.MEN), sheet),
            DocumentKind.PROFILE_MEN);

        MemberRecord member = (MemberRecord) result.records().get(0);
        assertTrue(member.rankingPosition().isAbsent());
        assertEquals(1502.25, member.pointsCurrent().get());
        assertEquals(2, member.totalWins().get());
        List<MatchRecord> matches = result.recordsOf(MatchRecord.class);
        assertEquals(2, matches.size());
        assertTrue(matches.get(0).won().isAbsent());
        assertEquals(Boolean.FALSE, matches.get(1).won().get());
    }

    @Test
    void testMenSheetWithoutHeadingFails() {
        assertThrows(ExtractionException.class, () -> extractor.parse(
            document(requests.profile("103603", CompetitionType.MEN), "<html><body><p>Erreur</p></body></html>"),
            DocumentKind.PROFILE_MEN));
    }
}
