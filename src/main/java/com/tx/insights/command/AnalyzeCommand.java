package com.tx.insights.command;

import com.tx.insights.config.AnalysisConfig;
import com.tx.insights.config.OutputFormat;
import com.tx.insights.dataset.Dataset;
import com.tx.insights.dataset.DatasetLoader;
import com.tx.insights.pipeline.AggregationRun;
import com.tx.insights.pipeline.AnalysisInput;
import com.tx.insights.pipeline.AnalysisPipeline;
import com.tx.insights.pipeline.AnalysisReport;
import com.tx.insights.pipeline.ProgressSnapshot;
import com.tx.insights.report.ConsoleReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "analyze",
    description = "Aggregate, score and benchmark a dataset over its category taxonomy",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, description = "Dataset file (YAML or JSON)", required = true)
    private Path input;

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    private String configFile;

    @Option(names = {"-t", "--threads"}, description = "Matching threads")
    private Integer threads;

    @Option(names = {"--aggregation-threads"}, description = "Threads for root subtree roll-up")
    private Integer aggregationThreads;

    @Option(names = {"--strict"}, description = "Fail on conflicting category paths")
    private Boolean strict;

    @Option(names = {"-o", "--output-format"}, description = "Output format: TEXT, CSV, JSON")
    private OutputFormat outputFormat;

    @Option(names = {"-n", "--top"}, description = "Number of top opportunities to list")
    private Integer topNodes;

    @Option(names = {"-q", "--quiet"}, description = "Print a one-line summary only", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            AnalysisConfig config = buildConfig();
            return executeAnalysis(config);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    AnalysisConfig buildConfig() throws IOException {
        AnalysisConfig config = configFile != null ? AnalysisConfig.fromYaml(configFile) : new AnalysisConfig();

        // CLI options override config file
        if (threads != null) {
            config.setThreads(threads);
        }
        if (aggregationThreads != null) {
            config.setAggregationThreads(aggregationThreads);
        }
        if (strict != null) {
            config.setStrictTaxonomy(strict);
        }
        if (outputFormat != null) {
            config.setOutputFormat(outputFormat);
        }
        if (topNodes != null) {
            config.setTopNodes(topNodes);
        }
        if (quiet) {
            config.setQuiet(true);
        }
        config.validate();
        return config;
    }

    private int executeAnalysis(AnalysisConfig config) {
        Dataset dataset = new DatasetLoader().load(input);
        AnalysisInput analysisInput = dataset.toInput();

        // tables only go with text output, CSV and JSON stay machine-readable
        boolean text = config.getOutputFormat() == OutputFormat.TEXT;
        ConsoleReporter reporter = new ConsoleReporter(config.isQuiet() || !text);
        reporter.printAnalysisHeader(input.toString(), analysisInput, config);

        AggregationRun run = new AnalysisPipeline(config).start(analysisInput);
        while (!run.isComplete()) {
            ProgressSnapshot progress = run.advance();
            if (text && !config.isQuiet()) {
                System.out.printf("  Phase %d/%d %5.1f%% - %,d items, %,d ms%n",
                    progress.completedPhases(), progress.totalPhases(), progress.percentComplete(),
                    progress.itemsProcessed(), progress.elapsedMs());
            }
        }
        AnalysisReport report = run.report();

        switch (config.getOutputFormat()) {
            case CSV -> reporter.printReportCsv(report);
            case JSON -> reporter.printReportJson(report);
            default -> new ConsoleReporter(config.isQuiet()).printReport(report, config.getTopNodes());
        }
        return 0;
    }
}
