package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.Organization;
import com.afttsync.domain.model.OrganizationRecord;
import com.afttsync.domain.model.TaskKind;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Complete run, one unit per organization: its directory page, then both sheets of every member.
 *
 * <p>Organizations come from the store; the upstream list is used when the store has none yet.
 * A failed profile sheet is recorded without failing the organization's unit.
 */
public class FullScrapePlan implements ScrapePlan {

    @Override
    public TaskKind kind() {
        return TaskKind.FULL;
    }

    @Override
    public List<WorkUnit> enumerate(ScrapeContext context) throws UpstreamException, ExtractionException {
        List<Organization> stored = context.store().listOrganizations();
        if (!stored.isEmpty()) {
            context.log().info(stored.size() + " stored organization(s) to process");
            return stored.stream()
                .map(organization -> (WorkUnit) new OrganizationUnit(organization.getCode(), null))
                .toList();
        }

        context.log().info("No stored organization, reading the upstream list");
        ExtractionResult list = context.fetch(context.requests().organizationList(), DocumentKind.ORGANIZATION_LIST);
        return list.recordsOf(OrganizationRecord.class).stream()
            .map(seed -> (WorkUnit) new OrganizationUnit(seed.code(), seed))
            .toList();
    }

    static class OrganizationUnit implements WorkUnit {

        private final String code;
        private final OrganizationRecord seed;

        OrganizationUnit(String code, OrganizationRecord seed) {
            this.code = code;
            this.seed = seed;
        }

        @Override
        public String label() {
            return code;
        }

        @Override
        public UnitHarvest collect(ScrapeContext context) throws UpstreamException, ExtractionException {
            UnitHarvest harvest = new UnitHarvest();
            if (seed != null) {
                harvest.add(seed);
            }
            ExtractionResult directory = context.fetch(context.requests().organizationDirectory(code),
                DocumentKind.MEMBER_DIRECTORY);
            harvest.addAll(directory);

            Set<String> licences = new LinkedHashSet<>();
            directory.recordsOf(MemberRecord.class).forEach(member -> licences.add(member.licence()));
            context.log().info(code + ": " + licences.size() + " member(s) found");

            int done = 0;
            for (String licence : licences) {
                if (done > 0) {
                    context.pauseBetweenFetches();
                }
                try {
                    ProfilesPlan.collectProfile(context, licence, harvest);
                } catch (UpstreamException | ExtractionException e) {
                    harvest.problem("profile " + licence + ": " + e.getMessage());
                }
                done++;
                if (done % 10 == 0) {
                    context.log().info(code + ": " + done + "/" + licences.size() + " profile(s) fetched");
                }
            }
            return harvest;
        }
    }
}
