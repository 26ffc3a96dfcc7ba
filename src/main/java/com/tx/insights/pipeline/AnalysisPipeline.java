package com.tx.insights.pipeline;

import com.tx.insights.config.AnalysisConfig;

import java.util.UUID;

/**
 * Entry point of the analysis library: builds the taxonomy, matches facts, aggregates,
 * scores and benchmarks. The pipeline itself is stateless; each call creates an independent
 * {@link AggregationRun}.
 */
public class AnalysisPipeline {

    private final AnalysisConfig config;

    public AnalysisPipeline() {
        this(new AnalysisConfig());
    }

    public AnalysisPipeline(AnalysisConfig config) {
        config.validate();
        this.config = config;
    }

    /**
     * Creates a run without executing any phase. Drive it with {@link AggregationRun#advance()}.
     */
    public AggregationRun start(AnalysisInput input) {
        return new AggregationRun(UUID.randomUUID().toString(), config, input);
    }

    public AnalysisReport run(AnalysisInput input) {
        return start(input).runToCompletion();
    }

    public AnalysisConfig getConfig() {
        return config;
    }
}
