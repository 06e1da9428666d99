package com.afttsync.infrastructure.upstream;

import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.UpstreamRequest;
import com.afttsync.domain.ports.CatalogRequests;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request layout of the two catalog sites: {@code data.aftt.be} for organizations and profiles,
 * {@code resultats.aftt.be} for competitions.
 */
public class AfttCatalogRequests implements CatalogRequests {

    public static final String ORGANIZATION_PARAM = "indice";
    public static final String LICENCE_PARAM = "licenceID";
    public static final String COMPETITION_PARAM = "t_id";
    public static final String PAGE_PARAM = "cur_page";

    private final String dataBaseUrl;
    private final String resultsBaseUrl;
    private final Duration timeout;

    public AfttCatalogRequests(String dataBaseUrl, String resultsBaseUrl, Duration timeout) {
        this.dataBaseUrl = stripTrailingSlash(dataBaseUrl);
        this.resultsBaseUrl = stripTrailingSlash(resultsBaseUrl);
        this.timeout = timeout;
    }

    @Override
    public UpstreamRequest organizationList() {
        return UpstreamRequest.get(dataBaseUrl + "/interclubs/rankings.php", Map.of(), timeout);
    }

    @Override
    public UpstreamRequest organizationDirectory(String organizationCode) {
        return UpstreamRequest.postForm(dataBaseUrl + "/annuaire/membres.php",
            Map.of(ORGANIZATION_PARAM, organizationCode), timeout);
    }

    @Override
    public UpstreamRequest profile(String licence, CompetitionType type) {
        String page = type == CompetitionType.WOMEN ? "/tools/fiche_women.php" : "/tools/fiche.php";
        return UpstreamRequest.get(dataBaseUrl + page, Map.of(LICENCE_PARAM, licence), timeout);
    }

    @Override
    public UpstreamRequest competitionList(int page) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("menu", "7");
        if (page > 1) {
            parameters.put(PAGE_PARAM, Integer.toString(page));
        }
        return UpstreamRequest.get(resultsBaseUrl + "/", parameters, timeout);
    }

    @Override
    public UpstreamRequest competitionSeries(long competitionId) {
        return competitionView("viewseries", competitionId);
    }

    @Override
    public UpstreamRequest competitionEntries(long competitionId) {
        return competitionView("viewplayers", competitionId);
    }

    private UpstreamRequest competitionView(String view, long competitionId) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("menu", "7");
        parameters.put(view, "1");
        parameters.put(COMPETITION_PARAM, Long.toString(competitionId));
        return UpstreamRequest.get(resultsBaseUrl + "/", parameters, timeout);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
