package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.OrganizationRecord;
import com.afttsync.domain.model.TaskKind;

import java.util.List;

/**
 * Organization list, then one unit per organization: its directory page (details and members).
 */
public class OrganizationsPlan implements ScrapePlan {

    @Override
    public TaskKind kind() {
        return TaskKind.ORGANIZATIONS;
    }

    @Override
    public List<WorkUnit> enumerate(ScrapeContext context) throws UpstreamException, ExtractionException {
        ExtractionResult list = context.fetch(context.requests().organizationList(), DocumentKind.ORGANIZATION_LIST);
        context.log().info("Organization list holds " + list.records().size() + " organization(s)");
        return list.recordsOf(OrganizationRecord.class).stream()
            .map(seed -> (WorkUnit) new DirectoryUnit(seed))
            .toList();
    }

    /**
     * Directory page of one organization, merged together with its listing record.
     */
    static class DirectoryUnit implements WorkUnit {

        private final OrganizationRecord seed;

        DirectoryUnit(OrganizationRecord seed) {
            this.seed = seed;
        }

        @Override
        public String label() {
            return seed.code();
        }

        @Override
        public UnitHarvest collect(ScrapeContext context) throws UpstreamException, ExtractionException {
            ExtractionResult directory = context.fetch(context.requests().organizationDirectory(seed.code()),
                DocumentKind.MEMBER_DIRECTORY);
            return new UnitHarvest().add(seed).addAll(directory);
        }
    }
}
