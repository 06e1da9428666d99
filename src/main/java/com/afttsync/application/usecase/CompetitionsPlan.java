package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.CompetitionRecord;
import com.afttsync.domain.model.DocumentKind;
import com.afttsync.domain.model.ExtractionResult;
import com.afttsync.domain.model.TaskKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Every page of the competition list, then one unit per competition: series and entries pages.
 */
public class CompetitionsPlan implements ScrapePlan {

    @Override
    public TaskKind kind() {
        return TaskKind.COMPETITIONS;
    }

    @Override
    public List<WorkUnit> enumerate(ScrapeContext context) throws UpstreamException, ExtractionException {
        ExtractionResult first = context.fetch(context.requests().competitionList(1), DocumentKind.COMPETITION_LIST);
        int lastPage = Math.max(1, first.lastPage());
        context.log().info("Competition list spans " + lastPage + " page(s)");

        List<CompetitionRecord> competitions = new ArrayList<>(first.recordsOf(CompetitionRecord.class));
        for (int page = 2; page <= lastPage; page++) {
            if (context.isCancelled()) {
                break;
            }
            context.pauseBetweenFetches();
            ExtractionResult result = context.fetch(context.requests().competitionList(page),
                DocumentKind.COMPETITION_LIST);
            competitions.addAll(result.recordsOf(CompetitionRecord.class));
        }
        return competitions.stream().map(seed -> (WorkUnit) new CompetitionUnit(seed)).toList();
    }

    static class CompetitionUnit implements WorkUnit {

        private final CompetitionRecord seed;

        CompetitionUnit(CompetitionRecord seed) {
            this.seed = seed;
        }

        @Override
        public String label() {
            return "competition " + seed.competitionId();
        }

        @Override
        public UnitHarvest collect(ScrapeContext context) throws UpstreamException, ExtractionException {
            long id = seed.competitionId();
            ExtractionResult series = context.fetch(context.requests().competitionSeries(id),
                DocumentKind.COMPETITION_SERIES);
            ExtractionResult entries = context.fetch(context.requests().competitionEntries(id),
                DocumentKind.COMPETITION_ENTRIES);
            return new UnitHarvest().add(seed).addAll(series).addAll(entries);
        }
    }
}
