package com.example.shortsbot_backend.dto;

import java.util.List;

public record BatchReport(String platform, int requested, List<BuildOutcome> outcomes) {
    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public long built() {
        return outcomes.stream().filter(BuildOutcome::isBuilt).count();
    }

    /** {@code built x/y}. */
    public String summary() {
        return "built " + built() + "/" + outcomes.size();
    }
}
