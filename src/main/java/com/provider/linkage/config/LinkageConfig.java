package com.provider.linkage.config;

import com.provider.linkage.aggregate.SourcePriorityTable;
import com.provider.linkage.scoring.ScoringRules;

import java.util.Objects;

/**
 * Validated configuration of a run.
 *
 * @param pipeline   input files and worker settings
 * @param priorities hierarchy of truth
 * @param scoring    scoring ruleset
 */
public record LinkageConfig(PipelineConfig pipeline, SourcePriorityTable priorities, ScoringRules scoring) {
    public LinkageConfig {
        Objects.requireNonNull(pipeline, "pipeline is required");
        Objects.requireNonNull(priorities, "priorities is required");
        Objects.requireNonNull(scoring, "scoring is required");
    }
}
