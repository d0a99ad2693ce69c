package com.slotplanner.slotplanner_api.dto;

public record JobStatusResponse(String problemId,
                                String status,
                                String searchState,
                                int bestCoverage,
                                double bestScore,
                                long elapsedMillis) {
}
