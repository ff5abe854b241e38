package com.github.salilvnair.funnelengine.api.dto;

import com.github.salilvnair.funnelengine.batch.BatchItemError;
import com.github.salilvnair.funnelengine.batch.BatchReport;

import java.util.List;

public record BatchRunResponse(String batch, int scanned, int affected, boolean interrupted, List<BatchItemError> errors) {

    public static BatchRunResponse of(BatchReport report) {
        return new BatchRunResponse(report.batch(), report.scanned(), report.affected(), report.interrupted(), report.errors());
    }
}
