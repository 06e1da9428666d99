package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.CompetitionEntryRecord;
import com.afttsync.domain.model.CompetitionRecord;
import com.afttsync.domain.model.CompetitionSeriesRecord;
import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.OrganizationRecord;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.domain.model.UpstreamRequest;
import com.afttsync.infrastructure.upstream.AfttCatalogRequests;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EntityExtractor on the organization and competition pages.
 */
class EntityExtractorTest {

    private final AfttCatalogRequests requests =
        new AfttCatalogRequests("https://data.aftt.be", "https://resultats.aftt.be", Duration.ofSeconds(5));

    private final EntityExtractor extractor = new EntityExtractor(List.of(
        new OrganizationListExtractor(),
        new MemberDirectoryExtractor(),
        new ProfileExtractor(CompetitionType.MEN),
        new ProfileExtractor(CompetitionType.WOMEN),
        new CompetitionListExtractor(),
        new CompetitionSeriesExtractor(),
        new CompetitionEntriesExtractor()));

    static UpstreamDocument document(UpstreamRequest request, String html) {
        return new UpstreamDocument(request, 200, html);
    }

    @Test
    void testOrganizationList() throws ExtractionException {
        String html = """
            <html><body><form><select name="indice">
              <option value="">-- Choisir un club --</option>
              <option value="H004">H004 - CTT Mons</option>
              <option value="Vl-B123">Vl-B123 - TTC Leuven</option>
              <option value="X">Sans code</option>
            </select></form></body></html>
            """;

        ExtractionResult result = extractor.parse(document(requests.organizationList(), html),
            DocumentKind.ORGANIZATION_LIST);

        List<OrganizationRecord> organizations = result.recordsOf(OrganizationRecord.class);
        assertEquals(2, organizations.size());
        assertEquals("H004", organizations.get(0).code());
        assertEquals("CTT Mons", organizations.get(0).name().get());
        assertEquals("Vl-B123", organizations.get(1).code());
        assertEquals(1, result.diagnostics().size());
    }

    @Test
    void testOrganizationListWithoutSelector() {
        assertThrows(ExtractionException.class, () -> extractor.parse(
            document(requests.organizationList(), "<html><body><p>Maintenance</p></body></html>"),
            DocumentKind.ORGANIZATION_LIST));
    }

    @Test
    void testMemberDirectory() throws ExtractionException {
        String html = """
            <html><body>
            <select name="indice"><option value="H004" selected>H004 - CTT Mons</option></select>
            <div class="card"><div class="card-header">Informations du club</div><div class="card-body">
              <h4>Cercle de Tennis de Table de Mons</h4>
              <p>Email : info@cttmons.be</p>
              <p>Statut : ASBL</p>
              <p>Douches : Oui</p>
            </div></div>
            <div class="card"><div class="card-header">Équipes du club</div><div class="card-body">
              Dames : 2<br>Messieurs : 7<br>Jeunes : 3
            </div></div>
            <table>
              <tr><th>Pos</th><th>Licence</th><th>Nom</th><th>Cat.</th><th>Clt</th></tr>
              <tr><td>1</td><td>103603</td><td>JEAN-FRANCOIS CULOT</td><td>SEN</td><td>D0</td></tr>
              <tr><td>2</td><td>151410</td><td>LUCAS MENIER</td><td>JUN</td><td></td></tr>
              <tr><td>3</td><td>-</td><td>INVITE</td><td></td><td></td></tr>
            </table>
            </body></html>
            """;

        ExtractionResult result = extractor.parse(document(requests.organizationDirectory("H004"), html),
            DocumentKind.MEMBER_DIRECTORY);

        OrganizationRecord organization = result.recordsOf(OrganizationRecord.class).get(0);
        assertEquals("CTT Mons", organization.name().get());
        assertEquals("Cercle de Tennis de Table de Mons", organization.fullName().get());
        assertEquals("info@cttmons.be", organization.email().get());
        assertEquals(Boolean.TRUE, organization.hasShower().get());
        assertEquals(2, organization.teamsWomen().get());
        assertEquals(7, organization.teamsMen().get());

        List<MemberRecord> members = result.recordsOf(MemberRecord.class);
        assertEquals(2, members.size());
        assertEquals("103603", members.get(0).licence());
        assertEquals("D0", members.get(0).rank().get());
        assertEquals("H004", members.get(0).organizationCode().get());
        assertTrue(members.get(1).rank().isAbsent());
    }

    @Test
    void testMemberDirectoryIncompleteRows() throws ExtractionException {
        String html = """
            <html><body>
            <div class="card"><div class="card-header">Équipes du club</div><div class="card-body">
              Dames : 123456789012<br>Messieurs : 4
            </div></div>
            <table>
              <tr><th>Licence</th><th>Nom</th><th>Cat.</th><th>Clt</th></tr>
              <tr><td>103603</td><td></td><td>SEN</td><td>E2</td></tr>
              <tr><td></td><td>NO LICENCE GUY</td><td>SEN</td><td>E2</td></tr>
              <tr><td></td><td></td><td></td><td></td></tr>
            </table>
            </body></html>
            """;

        ExtractionResult result = extractor.parse(document(requests.organizationDirectory("H004"), html),
            DocumentKind.MEMBER_DIRECTORY);

        List<MemberRecord> members = result.recordsOf(MemberRecord.class);
        assertEquals(1, members.size());
        assertEquals("103603", members.get(0).licence());
        assertTrue(members.get(0).name().isAbsent());
        assertEquals("E2", members.get(0).rank().get());
        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).contains("NO LICENCE GUY"));

        OrganizationRecord organization = result.recordsOf(OrganizationRecord.class).get(0);
        assertTrue(organization.teamsWomen().isAbsent());
        assertEquals(4, organization.teamsMen().get());
    }

    @Test
    void testCompetitionList() throws ExtractionException {
        String html = """
            <html><body><table>
              <tr><th>Nom</th><th>Niveau</th><th>Date</th><th>Réf.</th><th>Séries</th><th>Actions</th></tr>
              <tr><td>Tournoi de Noël</td><td>Provincial</td><td>30/12-02/01/2026</td><td>T-123</td><td>4</td>
                  <td><a href="/?menu=7&amp;viewseries=1&amp;t_id=812">Séries</a></td></tr>
              <tr><td>Critérium</td><td>Régional</td><td>14/09/2025</td><td></td><td>2</td><td></td></tr>
              <tr><td colspan="6"><a href="/?menu=7&amp;cur_page=2">2</a> <a href="/?menu=7&amp;cur_page=5">5</a></td></tr>
            </table></body></html>
            """;

        ExtractionResult result = extractor.parse(document(requests.competitionList(1), html),
            DocumentKind.COMPETITION_LIST);

        List<CompetitionRecord> competitions = result.recordsOf(CompetitionRecord.class);
        assertEquals(1, competitions.size());
        assertEquals(812L, competitions.get(0).competitionId());
        assertEquals(LocalDate.of(2025, 12, 30), competitions.get(0).dateStart().get());
        assertEquals(LocalDate.of(2026, 1, 2), competitions.get(0).dateEnd().get());
        assertEquals(4, competitions.get(0).seriesCount().get());
        assertEquals(1, result.diagnostics().size());
        assertEquals(5, result.lastPage());
    }

    @Test
    void testCompetitionSeries() throws ExtractionException {
        String html = """
            <html><body><table>
              <tr><th>Date</th><th>Heure</th><th>Série</th><th>Inscriptions</th><th>Actions</th></tr>
              <tr><td>30/12/2025</td><td>09:00</td><td>Messieurs E</td><td>36 / 40</td><td></td></tr>
              <tr><td>31/12/2025</td><td>13:30</td><td>Dames</td><td>12</td><td></td></tr>
            </table></body></html>
            """;

        ExtractionResult result = extractor.parse(document(requests.competitionSeries(812), html),
            DocumentKind.COMPETITION_SERIES);

        List<CompetitionSeriesRecord> series = result.recordsOf(CompetitionSeriesRecord.class);
        assertEquals(2, series.size());
        assertEquals("812|Messieurs E", series.get(0).naturalKey());
        assertEquals(36, series.get(0).entriesCount().get());
        assertEquals(40, series.get(0).entriesMax().get());
        assertEquals(LocalDate.of(2025, 12, 30), series.get(0).date().get());
        assertEquals(12, series.get(1).entriesCount().get());
        assertTrue(series.get(1).entriesMax().isAbsent());
    }

    @Test
    void testCompetitionWithoutSeriesOrEntries() throws ExtractionException {
        String html = "<html><body><p>Aucune série</p></body></html>";

        assertTrue(extractor.parse(document(requests.competitionSeries(812), html),
            DocumentKind.COMPETITION_SERIES).records().isEmpty());
        assertTrue(extractor.parse(document(requests.competitionEntries(812), html),
            DocumentKind.COMPETITION_ENTRIES).records().isEmpty());
    }

    @Test
    void testCompetitionEntries() throws ExtractionException {
        String html = """
            <html><body><table>
              <tr><th>Série</th><th>Index</th><th>Nom</th><th>Club</th><th>Classement</th><th></th></tr>
              <tr><td>Messieurs E</td><td>103603</td><td>JEAN-FRANCOIS CULOT</td><td>H004</td><td>D0</td><td></td></tr>
              <tr><td>Messieurs E</td><td></td><td>INCONNU</td><td></td><td></td><td></td></tr>
            </table></body></html>
            """;

        ExtractionResult result = extractor.parse(document(requests.competitionEntries(812), html),
            DocumentKind.COMPETITION_ENTRIES);

        List<CompetitionEntryRecord> entries = result.recordsOf(CompetitionEntryRecord.class);
        assertEquals(1, entries.size());
        assertEquals("812|Messieurs E|103603", entries.get(0).naturalKey());
        assertEquals("D0", entries.get(0).playerRank().get());
        assertEquals(1, result.diagnostics().size());
    }
}
