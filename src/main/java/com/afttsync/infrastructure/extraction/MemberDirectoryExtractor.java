package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.OrganizationRecord;
import com.afttsync.domain.model.UpstreamDocument;
import com.afttsync.infrastructure.upstream.AfttCatalogRequests;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.ArrayList;
import java.util.List;

/**
 * Organization directory page: organization details from the Bootstrap cards and the members table.
 *
 * <p>The members table comes in two layouts: {@code Pos | Licence | Name | Category | Rank} and
 * {@code Licence | Name | Category | Rank}.
 */
public class MemberDirectoryExtractor implements DocumentExtractor {

    @Override
    public DocumentKind kind() {
        return DocumentKind.MEMBER_DIRECTORY;
    }

    @Override
    public ExtractionResult extract(Document html, UpstreamDocument source) throws ExtractionException {
        String code = source.request().parameter(AfttCatalogRequests.ORGANIZATION_PARAM);
        if (code == null || code.isBlank()) {
            throw new ExtractionException("Directory request carries no organization code", html.text());
        }
        if (html.selectFirst("select") == null && html.selectFirst("table") == null
                && html.selectFirst("div.card") == null) {
            throw new ExtractionException("Unrecognized directory page for " + code, html.text());
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();

        OrganizationRecord organization = new OrganizationRecord(code).name(selectedName(html, code));
        readCards(html, organization);
        records.add(organization);

        for (Element table : html.select("table")) {
            Elements rows = table.select("tr");
            for (int i = 1; i < rows.size(); i++) {
                Elements cells = rows.get(i).select("td");
                if (cells.size() < 4) {
                    continue;
                }
                int offset = cells.size() >= 5 ? 1 : 0;
                Field<String> licence = HtmlText.cell(cells, offset);
                Field<String> name = HtmlText.cell(cells, offset + 1);
                if (licence.isAbsent() || !licence.get().chars().anyMatch(Character::isDigit)) {
                    if (cells.stream().anyMatch(cell -> !HtmlText.text(cell).isEmpty())) {
                        diagnostics.add("Skipped member row without licence in organization " + code
                            + ": '" + HtmlText.text(rows.get(i)) + "'");
                    }
                    continue;
                }
                records.add(new MemberRecord(licence.get())
                    .name(name)
                    .category(HtmlText.cell(cells, offset + 2))
                    .rank(HtmlText.cell(cells, offset + 3))
                    .organizationCode(Field.of(organization.code())));
            }
        }
        return new ExtractionResult(records, diagnostics);
    }

    private static Field<String> selectedName(Document html, String code) {
        for (Element option : html.select("select option")) {
            if (code.equals(option.attr("value"))) {
                String label = HtmlText.text(option);
                int separator = label.indexOf(" - ");
                return separator >= 0 ? Field.ofText(label.substring(separator + 3)) : Field.absent();
            }
        }
        return Field.absent();
    }

    private static void readCards(Document html, OrganizationRecord organization) {
        for (Element card : html.select("div.card")) {
            Element header = card.selectFirst(".card-header");
            Element body = card.selectFirst(".card-body");
            if (header == null || body == null) {
                continue;
            }
            String title = HtmlText.lower(HtmlText.text(header));
            if (title.contains("informations du club")) {
                readInformation(body, organization);
            } else if (title.contains("locaux du club")) {
                readVenue(body, organization);
            } else if (title.contains("quipes du club") || title.contains("equipes")) {
                readTeams(body, organization);
            } else if (title.contains("labellisation") || title.contains("palette")) {
                readLabels(body, organization);
            }
        }
    }

    private static void readInformation(Element body, OrganizationRecord organization) {
        Element heading = body.selectFirst("h4");
        if (heading != null) {
            organization.fullName(Field.ofText(HtmlText.text(heading)));
        }
        for (String line : HtmlText.lines(body)) {
            HtmlText.keyValue(line).ifPresent(pair -> {
                String key = pair[0];
                String value = pair[1];
                if (key.contains("email")) {
                    organization.email(Field.ofText(value));
                } else if (key.contains("phone") || key.contains("téléphone") || key.contains("tel")) {
                    organization.phone(Field.ofText(value));
                } else if (key.contains("statut")) {
                    organization.status(Field.ofText(value));
                } else if (key.contains("douche")) {
                    organization.hasShower(HtmlText.yesNo(value));
                }
            });
        }
        Element link = body.selectFirst("a[href]");
        if (link != null && link.attr("href").contains("http")) {
            organization.website(Field.ofText(link.attr("href")));
        }
    }

    private static void readVenue(Element body, OrganizationRecord organization) {
        for (String line : HtmlText.lines(body)) {
            HtmlText.keyValue(line).ifPresent(pair -> {
                String key = pair[0];
                String value = pair[1];
                if (key.equals("nom")) {
                    organization.venueName(Field.ofText(value));
                } else if (key.contains("adresse")) {
                    organization.venueAddress(Field.ofText(value));
                } else if (key.contains("phone") || key.contains("téléphone") || key.contains("tel")) {
                    organization.venuePhone(Field.ofText(value));
                } else if (key.contains("pmr") || key.contains("accès")) {
                    organization.venueAccessible(HtmlText.yesNo(value));
                } else if (key.contains("remarque")) {
                    organization.venueRemarks(Field.ofText(value));
                }
            });
        }
    }

    private static void readTeams(Element body, OrganizationRecord organization) {
        for (String line : HtmlText.lines(body)) {
            HtmlText.keyValue(line).ifPresent(pair -> {
                String key = pair[0];
                Field<Integer> count = HtmlText.integer(pair[1]);
                if (key.contains("dames") || key.contains("women")) {
                    organization.teamsWomen(count);
                } else if (key.contains("messieurs") || key.contains("men")) {
                    organization.teamsMen(count);
                } else if (key.contains("jeunes") || key.contains("youth")) {
                    organization.teamsYouth(count);
                } else if (key.contains("térans") || key.contains("veterans")) {
                    organization.teamsVeterans(count);
                }
            });
        }
    }

    private static void readLabels(Element body, OrganizationRecord organization) {
        for (String line : HtmlText.lines(body)) {
            HtmlText.keyValue(line).ifPresent(pair -> {
                String key = pair[0];
                String value = pair[1];
                if (key.contains("label") && !key.contains("palette")) {
                    organization.label(HtmlText.lower(value).equals("aucun") ? Field.absent() : Field.ofText(value));
                } else if (key.contains("palette")) {
                    organization.palette(HtmlText.lower(value).contains("aucune") ? Field.absent() : Field.ofText(value));
                }
            });
        }
    }
}
