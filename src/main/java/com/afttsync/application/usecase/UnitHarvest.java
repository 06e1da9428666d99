package com.afttsync.application.usecase;

import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.ExtractionResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Records collected by one unit before anything is merged, with the problems that did not fail the unit.
 */
public class UnitHarvest {

    private final List<ExtractedRecord> records = new ArrayList<>();
    private final List<String> problems = new ArrayList<>();

    public UnitHarvest add(ExtractedRecord record) {
        records.add(record);
        return this;
    }

    public UnitHarvest addAll(ExtractionResult result) {
        records.addAll(result.records());
        problems.addAll(result.diagnostics());
        return this;
    }

    public UnitHarvest problem(String message) {
        problems.add(message);
        return this;
    }

    public List<ExtractedRecord> records() {
        return records;
    }

    public List<String> problems() {
        return problems;
    }
}
