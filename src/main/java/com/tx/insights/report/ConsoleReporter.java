package com.tx.insights.report;

import com.tx.insights.aggregation.AggregatedMetrics;
import com.tx.insights.benchmark.BenchmarkResult;
import com.tx.insights.benchmark.Insight;
import com.tx.insights.config.AnalysisConfig;
import com.tx.insights.dataset.Dataset;
import com.tx.insights.matching.MatchStatistics;
import com.tx.insights.matching.MatchStrategy;
import com.tx.insights.matching.MatchWarning;
import com.tx.insights.pipeline.AnalysisInput;
import com.tx.insights.pipeline.AnalysisReport;
import com.tx.insights.pipeline.PhaseMetrics;
import com.tx.insights.pipeline.RunDiagnostics;
import com.tx.insights.scoring.OpportunityCategory;
import com.tx.insights.scoring.OpportunityScore;
import com.tx.insights.taxonomy.TaxonomyNode;
import com.tx.insights.taxonomy.TreeAnomaly;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Console reporter for analysis results: text tables, CSV and JSON.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_LISTED = 10;

    private final PrintStream out;
    private final boolean quiet;

    public ConsoleReporter(boolean quiet) {
        this(System.out, quiet);
    }

    public ConsoleReporter(PrintStream out, boolean quiet) {
        this.out = out;
        this.quiet = quiet;
    }

    public void printAnalysisHeader(String source, AnalysisInput input, AnalysisConfig config) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("              Taxonomy Insights - Performance Analysis");
        out.println(SEPARATOR);
        out.println();
        out.printf("Dataset:         %s%n", source);
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Configuration:");
        out.printf("  Match Threads:   %d%n", config.getThreads());
        out.printf("  Agg. Threads:    %d%n", config.getAggregationThreads());
        out.printf("  Strict Taxonomy: %s%n", config.isStrictTaxonomy());
        out.println();
        out.println("Input:");
        out.printf("  Categories:      %,d%n", input.getCategoryPaths().size());
        out.printf("  Products:        %,d%n", input.getProducts().size());
        out.printf("  Facts:           %,d%n", input.getFacts().size());
        out.printf("  Pricing:         %,d%n", input.getPricing().size());
        out.println();
    }

    public void printReport(AnalysisReport report, int topNodes) {
        if (quiet) {
            printReportCompact(report);
            return;
        }

        AggregatedMetrics total = report.getAggregation().getGrandTotal();
        out.println(SEPARATOR);
        out.println("                           Results Summary");
        out.println(SEPARATOR);
        out.println();
        out.printf("Nodes:           %,d (max depth %d)%n", report.getTree().size(), report.getTree().maxDepth());
        out.printf("Impressions:     %,d%n", total.getImpressions());
        out.printf("Clicks:          %,d (CTR %.2f%%)%n", total.getClicks(), total.getCtr() * 100);
        out.printf("Conversions:     %,d (CR %.2f%%)%n", total.getConversions(), total.getConversionRate() * 100);
        out.printf("Revenue:         %,.2f%n", total.getRevenue());
        out.printf("Revenue Impact:  %,.2f%n", report.getTotalRevenueImpact());
        out.println();

        out.println("Opportunities:");
        for (Map.Entry<OpportunityCategory, Integer> e : report.countByCategory().entrySet()) {
            out.printf("  %-14s %,d%n", e.getKey().getLabel(), e.getValue());
        }

        printTopOpportunities(report, topNodes);
        printInsights(report);
        printDiagnostics(report.getDiagnostics());
        printPhaseMetrics(report.getPhaseMetrics());

        out.println();
        out.printf("Completed:       %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println(SEPARATOR);
    }

    private void printTopOpportunities(AnalysisReport report, int topNodes) {
        out.println();
        out.println(THIN_SEPARATOR);
        out.printf("Top %d Opportunities%n", topNodes);
        out.println(THIN_SEPARATOR);
        out.printf("%-32s %10s %8s %12s %6s %-12s%n",
            "Category", "Impr.", "CTR", "Revenue", "Score", "Bucket");
        for (OpportunityScore score : report.topOpportunities(topNodes)) {
            AggregatedMetrics m = report.getAggregation().get(score.getNodeId());
            out.printf("%-32s %,10d %7.2f%% %,12.2f %6.1f %-12s%n",
                truncate(pathOf(report, score.getNodeId()), 32),
                m.getImpressions(),
                m.getCtr() * 100,
                m.getRevenue(),
                score.getScore(),
                score.getCategory().getLabel());
        }
    }

    private void printInsights(AnalysisReport report) {
        List<Map.Entry<String, BenchmarkResult>> flagged = report.getBenchmarks().entrySet().stream()
            .filter(e -> !e.getValue().insights().isEmpty())
            .toList();
        if (flagged.isEmpty()) return;

        out.println();
        out.println(THIN_SEPARATOR);
        out.printf("Insights (%d categories flagged)%n", flagged.size());
        out.println(THIN_SEPARATOR);
        for (Map.Entry<String, BenchmarkResult> e : flagged.subList(0, Math.min(MAX_LISTED, flagged.size()))) {
            out.printf("%s  (rank %.0f%% of %d peers)%n", pathOf(report, e.getKey()),
                e.getValue().relativeRank(), e.getValue().cohortSize());
            for (Insight insight : e.getValue().insights()) {
                out.printf("  [%s] %s: %s. %s%n", insight.priority(), insight.issue(),
                    insight.recommendation(), insight.potentialImpact());
            }
        }
        if (flagged.size() > MAX_LISTED) {
            out.printf("... and %d more%n", flagged.size() - MAX_LISTED);
        }
    }

    private void printDiagnostics(RunDiagnostics diagnostics) {
        out.println();
        out.println(THIN_SEPARATOR);
        out.println("Diagnostics");
        out.println(THIN_SEPARATOR);
        printMatchStatistics(diagnostics.matchStatistics());
        out.printf("  Unassigned:      %,d%n", diagnostics.unassignedFacts());
        out.printf("  Warnings:        %,d%n", diagnostics.warnings().size());
        out.printf("  Tree anomalies:  %,d%n", diagnostics.anomalies().size());
        for (TreeAnomaly anomaly : diagnostics.anomalies().subList(0, Math.min(MAX_LISTED, diagnostics.anomalies().size()))) {
            out.printf("    %-16s %s%n", anomaly.type(), anomaly.detail());
        }
        if (!diagnostics.unresolvedPricing().isEmpty()) {
            out.printf("  Unresolved pricing: %s%n", diagnostics.unresolvedPricing());
        }
    }

    private void printMatchStatistics(MatchStatistics stats) {
        out.printf("  Facts:           %,d%n", stats.getTotal());
        out.printf("  Matched:         %,d (%.1f%%, avg confidence %.2f)%n",
            stats.getMatched(), stats.getMatchRate() * 100, stats.getAverageConfidence());
        for (Map.Entry<MatchStrategy, Integer> e : stats.getByStrategy().entrySet()) {
            if (e.getValue() > 0) {
                out.printf("    %-18s %,d%n", e.getKey(), e.getValue());
            }
        }
        List<String> unmatched = stats.getUnmatchedSubjects();
        out.printf("  Unmatched:       %,d facts, %,d subjects%n", stats.getUnmatched(), unmatched.size());
        for (String subject : unmatched.subList(0, Math.min(MAX_LISTED, unmatched.size()))) {
            out.printf("    %s%n", subject);
        }
        if (unmatched.size() > MAX_LISTED) {
            out.printf("    ... and %d more%n", unmatched.size() - MAX_LISTED);
        }
    }

    private void printPhaseMetrics(Map<?, PhaseMetrics> phaseMetrics) {
        out.println();
        out.println(THIN_SEPARATOR);
        out.printf("%-12s %10s %12s %10s %10s %10s %12s%n",
            "Phase", "Items", "Throughput", "Avg (ms)", "P95 (ms)", "P99 (ms)", "Elapsed");
        out.println(THIN_SEPARATOR);
        long totalMs = 0;
        for (PhaseMetrics m : phaseMetrics.values()) {
            out.printf("%-12s %,10d %,10.0f/s %10s %10s %10s %12s%n",
                m.getPhase(), m.getItemsProcessed(), m.getThroughput(),
                latency(m, m.getAvgLatencyMs()), latency(m, m.getP95LatencyMs()), latency(m, m.getP99LatencyMs()),
                formatDuration(m.getElapsedTimeMs()));
            totalMs += m.getElapsedTimeMs();
        }
        out.println(THIN_SEPARATOR);
        out.printf("Total Time: %s%n", formatDuration(totalMs));
    }

    private void printReportCompact(AnalysisReport report) {
        MatchStatistics stats = report.getDiagnostics().matchStatistics();
        long totalMs = report.getPhaseMetrics().values().stream().mapToLong(PhaseMetrics::getElapsedTimeMs).sum();
        out.printf("Analyzed %,d nodes, %,d facts (%.1f%% matched) in %s, %d quick wins%n",
            report.getTree().size(), stats.getTotal(), stats.getMatchRate() * 100, formatDuration(totalMs),
            report.countByCategory().get(OpportunityCategory.QUICK_WIN));
    }

    public void printMatchResults(MatchStatistics stats, List<MatchWarning> warnings) {
        if (quiet) {
            out.printf("Matched %,d of %,d facts (%.1f%%), %d warnings%n",
                stats.getMatched(), stats.getTotal(), stats.getMatchRate() * 100, warnings.size());
            return;
        }

        out.println();
        out.println(SEPARATOR);
        out.println("                           Match Results");
        out.println(SEPARATOR);
        printMatchStatistics(stats);
        if (!warnings.isEmpty()) {
            out.println();
            out.printf("Warnings (%d):%n", warnings.size());
            for (MatchWarning warning : warnings.subList(0, Math.min(MAX_LISTED, warnings.size()))) {
                out.printf("  %-14s %s: %s%n", warning.type(), warning.subjectKey(), warning.detail());
            }
        }
        out.println(SEPARATOR);
    }

    public void printGenerated(Dataset dataset, String target) {
        out.printf("Generated %,d categories, %,d products, %,d facts and %,d pricing entries into %s%n",
            dataset.getCategories().size(), dataset.getProducts().size(), dataset.getFacts().size(),
            dataset.getPricing().size(), target);
    }

    public void printReportCsv(AnalysisReport report) {
        out.println("node_id,path,depth,impressions,clicks,ctr,conversions,conversion_rate,revenue," +
            "total_products,score,category,confidence,revenue_impact,ctr_delta,relative_rank,insights");

        for (TaxonomyNode node : report.getTree().nodes()) {
            AggregatedMetrics m = report.getAggregation().get(node.getId());
            OpportunityScore s = report.getScores().get(node.getId());
            BenchmarkResult b = report.getBenchmarks().get(node.getId());
            out.println(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%.6f,%d,%.6f,%.2f,%d,%.2f,%s,%s,%.2f,%.2f,%.1f,%s",
                csv(node.getId()),
                csv(node.getCanonicalPath()),
                node.getDepth(),
                m.getImpressions(),
                m.getClicks(),
                m.getCtr(),
                m.getConversions(),
                m.getConversionRate(),
                m.getRevenue(),
                m.getTotalProductCount(),
                s.getScore(),
                s.getCategory().getLabel(),
                s.getConfidence(),
                s.getRevenueImpactEstimate(),
                b.ctrDelta(),
                b.relativeRank(),
                csv(b.triggers().toString())));
        }
    }

    public void printReportJson(AnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        sb.append(String.format("  \"runId\": \"%s\",\n", escape(report.getRunId())));
        sb.append("  \"nodes\": [\n");

        List<TaxonomyNode> nodes = report.getTree().nodes();
        for (int i = 0; i < nodes.size(); i++) {
            TaxonomyNode node = nodes.get(i);
            AggregatedMetrics m = report.getAggregation().get(node.getId());
            OpportunityScore s = report.getScores().get(node.getId());
            BenchmarkResult b = report.getBenchmarks().get(node.getId());
            sb.append("    {\n");
            sb.append(String.format("      \"id\": \"%s\",\n", escape(node.getId())));
            sb.append(String.format("      \"path\": \"%s\",\n", escape(node.getCanonicalPath())));
            sb.append(String.format("      \"parentId\": %s,\n",
                node.getParentId() == null ? "null" : "\"" + escape(node.getParentId()) + "\""));
            sb.append(String.format("      \"depth\": %d,\n", node.getDepth()));
            sb.append(String.format("      \"impressions\": %d,\n", m.getImpressions()));
            sb.append(String.format("      \"clicks\": %d,\n", m.getClicks()));
            sb.append(String.format(Locale.ROOT, "      \"ctr\": %.6f,\n", m.getCtr()));
            sb.append(String.format("      \"conversions\": %d,\n", m.getConversions()));
            sb.append(String.format(Locale.ROOT, "      \"conversionRate\": %.6f,\n", m.getConversionRate()));
            sb.append(String.format(Locale.ROOT, "      \"revenue\": %.2f,\n", m.getRevenue()));
            sb.append(String.format(Locale.ROOT, "      \"averageOrderValue\": %.2f,\n", m.getAverageOrderValue()));
            sb.append(String.format("      \"totalProducts\": %d,\n", m.getTotalProductCount()));
            sb.append(String.format(Locale.ROOT, "      \"score\": %.2f,\n", s.getScore()));
            sb.append(String.format("      \"category\": \"%s\",\n", s.getCategory().getLabel()));
            sb.append(String.format("      \"priority\": %d,\n", s.getCategorization().priority()));
            sb.append(String.format("      \"confidence\": \"%s\",\n", s.getConfidence()));
            sb.append(String.format(Locale.ROOT, "      \"revenueImpact\": %.2f,\n", s.getRevenueImpactEstimate()));
            sb.append(String.format(Locale.ROOT, "      \"ctrDelta\": %.2f,\n", b.ctrDelta()));
            sb.append(String.format(Locale.ROOT, "      \"relativeRank\": %.1f,\n", b.relativeRank()));
            sb.append(String.format("      \"insights\": [%s]\n", insightList(b)));
            sb.append("    }");
            if (i < nodes.size() - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }
        sb.append("  ],\n");

        MatchStatistics stats = report.getDiagnostics().matchStatistics();
        sb.append("  \"diagnostics\": {\n");
        sb.append(String.format("    \"facts\": %d,\n", stats.getTotal()));
        sb.append(String.format("    \"matched\": %d,\n", stats.getMatched()));
        sb.append(String.format(Locale.ROOT, "    \"matchRate\": %.4f,\n", stats.getMatchRate()));
        sb.append(String.format("    \"unmatchedSubjects\": [%s],\n", stringList(stats.getUnmatchedSubjects())));
        sb.append(String.format("    \"warnings\": %d,\n", report.getDiagnostics().warnings().size()));
        sb.append(String.format("    \"anomalies\": %d,\n", report.getDiagnostics().anomalies().size()));
        sb.append(String.format("    \"unassignedFacts\": %d\n", report.getDiagnostics().unassignedFacts()));
        sb.append("  },\n");
        sb.append(String.format("  \"timestamp\": \"%s\"\n", LocalDateTime.now().format(DT_FORMAT)));
        sb.append("}\n");

        out.print(sb);
    }

    private String insightList(BenchmarkResult benchmark) {
        StringBuilder sb = new StringBuilder();
        for (Insight insight : benchmark.insights()) {
            if (sb.length() > 0) sb.append(", ");
            sb.append('"').append(insight.trigger()).append('"');
        }
        return sb.toString();
    }

    private String stringList(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            if (sb.length() > 0) sb.append(", ");
            sb.append('"').append(escape(value)).append('"');
        }
        return sb.toString();
    }

    private static String latency(PhaseMetrics metrics, double valueMs) {
        return metrics.hasLatencies() ? String.format("%.3f", valueMs) : "-";
    }

    private static String pathOf(AnalysisReport report, String nodeId) {
        return report.getTree().find(nodeId).map(TaxonomyNode::getCanonicalPath).orElse(nodeId);
    }

    private static String truncate(String value, int width) {
        return value.length() <= width ? value : "..." + value.substring(value.length() - width + 3);
    }

    private static String csv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    static String escape(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
    }

    static String formatDuration(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60_000) {
            return String.format("%.1f seconds", millis / 1000.0);
        } else if (millis < 3600_000) {
            long minutes = millis / 60_000;
            long seconds = (millis % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        } else {
            long hours = millis / 3600_000;
            long minutes = (millis % 3600_000) / 60_000;
            return String.format("%d hr %d min", hours, minutes);
        }
    }
}
