package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.TaskKind;

import java.util.List;

/**
 * Every stored licence, one unit each: the men's sheet and the women's sheet.
 */
public class ProfilesPlan implements ScrapePlan {

    @Override
    public TaskKind kind() {
        return TaskKind.PROFILES_ALL;
    }

    @Override
    public List<WorkUnit> enumerate(ScrapeContext context) {
        List<String> licences = context.store().listMemberLicences();
        context.log().info(licences.size() + " licence(s) to refresh");
        return licences.stream().map(licence -> (WorkUnit) new ProfileUnit(licence)).toList();
    }

    static class ProfileUnit implements WorkUnit {

        private final String licence;

        ProfileUnit(String licence) {
            this.licence = licence;
        }

        @Override
        public String label() {
            return licence;
        }

        @Override
        public UnitHarvest collect(ScrapeContext context) throws UpstreamException, ExtractionException {
            UnitHarvest harvest = new UnitHarvest();
            collectProfile(context, licence, harvest);
            return harvest;
        }
    }

    /**
     * Fetches both sheets of a licence into the harvest. A men's sheet failure propagates; a women's
     * sheet failure is recorded as a problem only.
     */
    static void collectProfile(ScrapeContext context, String licence, UnitHarvest harvest)
            throws UpstreamException, ExtractionException {
        harvest.addAll(context.fetch(context.requests().profile(licence, CompetitionType.MEN), DocumentKind.PROFILE_MEN));
        try {
            harvest.addAll(context.fetch(context.requests().profile(licence, CompetitionType.WOMEN),
                DocumentKind.PROFILE_WOMEN));
        } catch (UpstreamException | ExtractionException e) {
            harvest.problem("women's sheet of " + licence + ": " + e.getMessage());
        }
    }
}
