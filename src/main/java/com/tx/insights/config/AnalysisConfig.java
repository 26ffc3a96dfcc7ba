package com.tx.insights.config;

import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;

public class AnalysisConfig {

    // Pipeline
    private int threads = 4;
    private int aggregationThreads = 1;
    private boolean strictTaxonomy = false;
    private long matchTimeoutMinutes = 60;

    // Scoring and insights
    private ScoringConfig scoring = new ScoringConfig();
    private InsightConfig insights = new InsightConfig();

    // Output
    private OutputFormat outputFormat = OutputFormat.TEXT;
    private boolean quiet = false;
    private int topNodes = 20;

    public AnalysisConfig() {
    }

    public static AnalysisConfig fromYaml(String filePath) throws IOException {
        try (InputStream input = new FileInputStream(filePath)) {
            return fromYaml(input);
        }
    }

    public static AnalysisConfig fromYaml(InputStream input) {
        Yaml yaml = new Yaml();
        Map<String, Object> data = yaml.load(input);
        return fromMap(data == null ? Map.of() : data);
    }

    @SuppressWarnings("unchecked")
    private static AnalysisConfig fromMap(Map<String, Object> data) {
        AnalysisConfig config = new AnalysisConfig();

        if (data.containsKey("pipeline")) {
            Map<String, Object> pipeline = (Map<String, Object>) data.get("pipeline");
            if (pipeline.containsKey("threads")) {
                config.threads = ((Number) pipeline.get("threads")).intValue();
            }
            if (pipeline.containsKey("aggregationThreads")) {
                config.aggregationThreads = ((Number) pipeline.get("aggregationThreads")).intValue();
            }
            if (pipeline.containsKey("strictTaxonomy")) {
                config.strictTaxonomy = (Boolean) pipeline.get("strictTaxonomy");
            }
            if (pipeline.containsKey("matchTimeoutMinutes")) {
                config.matchTimeoutMinutes = ((Number) pipeline.get("matchTimeoutMinutes")).longValue();
            }
        }

        if (data.containsKey("scoring")) {
            Map<String, Object> scoring = (Map<String, Object>) data.get("scoring");
            ScoringConfig sc = config.scoring;

            if (scoring.containsKey("weights")) {
                Map<String, Object> w = (Map<String, Object>) scoring.get("weights");
                ScoringWeights defaults = ScoringWeights.DEFAULT;
                sc.setWeights(new ScoringWeights(
                    number(w, "traffic", defaults.traffic()),
                    number(w, "revenue", defaults.revenue()),
                    number(w, "pricing", defaults.pricing()),
                    number(w, "competitive", defaults.competitive()),
                    number(w, "content", defaults.content())));
            }
            if (scoring.containsKey("thresholds")) {
                Map<String, Object> t = (Map<String, Object>) scoring.get("thresholds");
                sc.setHighScoreThreshold(number(t, "highScore", sc.getHighScoreThreshold()));
                sc.setMediumScoreThreshold(number(t, "mediumScore", sc.getMediumScoreThreshold()));
                sc.setLowEffortThreshold((int) number(t, "lowEffort", sc.getLowEffortThreshold()));
                sc.setMediumEffortThreshold((int) number(t, "mediumEffort", sc.getMediumEffortThreshold()));
            }
            if (scoring.containsKey("benchmarks")) {
                Map<String, Object> b = (Map<String, Object>) scoring.get("benchmarks");
                sc.setBenchmarkConversionRate(number(b, "conversionRate", sc.getBenchmarkConversionRate()));
                sc.setBenchmarkAverageOrderValue(number(b, "averageOrderValue", sc.getBenchmarkAverageOrderValue()));
                sc.setBenchmarkRevenuePerSession(number(b, "revenuePerSession", sc.getBenchmarkRevenuePerSession()));
            }
            sc.setDefaultPosition(number(scoring, "defaultPosition", sc.getDefaultPosition()));
            sc.setTargetPosition(number(scoring, "targetPosition", sc.getTargetPosition()));
            sc.setMarginTarget(number(scoring, "marginTarget", sc.getMarginTarget()));
            sc.setPricingTolerance(number(scoring, "pricingTolerance", sc.getPricingTolerance()));
        }

        if (data.containsKey("insights")) {
            Map<String, Object> insights = (Map<String, Object>) data.get("insights");
            InsightConfig ic = config.insights;
            ic.setMinImpressions((long) number(insights, "minImpressions", ic.getMinImpressions()));
            ic.setCriticalImpressions((long) number(insights, "criticalImpressions", ic.getCriticalImpressions()));
            ic.setCriticalCtr(number(insights, "criticalCtr", ic.getCriticalCtr()));
            ic.setHighPriorityCtrDeficitPercent(
                number(insights, "highPriorityCtrDeficit", ic.getHighPriorityCtrDeficitPercent()));
            ic.setConversionFocusClicks((long) number(insights, "conversionFocusClicks", ic.getConversionFocusClicks()));
            ic.setConversionFocusRate(number(insights, "conversionFocusRate", ic.getConversionFocusRate()));
            ic.setReviewPerformanceScore(number(insights, "reviewPerformanceScore", ic.getReviewPerformanceScore()));
            ic.setReviewMinProducts((int) number(insights, "reviewMinProducts", ic.getReviewMinProducts()));
        }

        if (data.containsKey("output")) {
            Map<String, Object> output = (Map<String, Object>) data.get("output");
            if (output.containsKey("format")) {
                config.outputFormat = OutputFormat.valueOf(((String) output.get("format")).toUpperCase(Locale.ROOT));
            }
            if (output.containsKey("quiet")) {
                config.quiet = (Boolean) output.get("quiet");
            }
            if (output.containsKey("topNodes")) {
                config.topNodes = ((Number) output.get("topNodes")).intValue();
            }
        }

        config.validate();
        return config;
    }

    private static double number(Map<String, Object> section, String key, double defaultValue) {
        Object value = section.get(key);
        return value == null ? defaultValue : ((Number) value).doubleValue();
    }

    /**
     * @throws IllegalArgumentException when a value is out of range
     */
    public void validate() {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        if (aggregationThreads < 1) {
            throw new IllegalArgumentException("aggregationThreads must be at least 1: " + aggregationThreads);
        }
        if (insights.getMinImpressions() < 0) {
            throw new IllegalArgumentException("minImpressions must not be negative: " + insights.getMinImpressions());
        }
        scoring.validate();
    }

    // Getters and setters
    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public int getAggregationThreads() {
        return aggregationThreads;
    }

    public void setAggregationThreads(int aggregationThreads) {
        this.aggregationThreads = aggregationThreads;
    }

    public boolean isStrictTaxonomy() {
        return strictTaxonomy;
    }

    public void setStrictTaxonomy(boolean strictTaxonomy) {
        this.strictTaxonomy = strictTaxonomy;
    }

    public long getMatchTimeoutMinutes() {
        return matchTimeoutMinutes;
    }

    public void setMatchTimeoutMinutes(long matchTimeoutMinutes) {
        this.matchTimeoutMinutes = matchTimeoutMinutes;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring;
    }

    public InsightConfig getInsights() {
        return insights;
    }

    public void setInsights(InsightConfig insights) {
        this.insights = insights;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }

    public int getTopNodes() {
        return topNodes;
    }

    public void setTopNodes(int topNodes) {
        this.topNodes = topNodes;
    }
}
