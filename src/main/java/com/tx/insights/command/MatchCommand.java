package com.tx.insights.command;

import com.tx.insights.dataset.Dataset;
import com.tx.insights.dataset.DatasetLoader;
import com.tx.insights.matching.FactMatcher;
import com.tx.insights.matching.MatchBatch;
import com.tx.insights.pipeline.AnalysisInput;
import com.tx.insights.report.ConsoleReporter;
import com.tx.insights.taxonomy.TaxonomyBuilder;
import com.tx.insights.taxonomy.TaxonomyTree;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "match",
    description = "Match a dataset's facts to its taxonomy and report match diagnostics",
    mixinStandardHelpOptions = true
)
public class MatchCommand implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, description = "Dataset file (YAML or JSON)", required = true)
    private Path input;

    @Option(names = {"-t", "--threads"}, description = "Matching threads", defaultValue = "4")
    private int threads;

    @Option(names = {"--strict"}, description = "Fail on conflicting category paths", defaultValue = "false")
    private boolean strict;

    @Option(names = {"--min-match-rate"}, description = "Exit with 2 when the match rate is below this fraction")
    private Double minMatchRate;

    @Option(names = {"-q", "--quiet"}, description = "Print a one-line summary only", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            Dataset dataset = new DatasetLoader().load(input);
            AnalysisInput analysisInput = dataset.toInput();

            TaxonomyTree tree = new TaxonomyBuilder(strict).build(analysisInput.getCategoryPaths(),
                analysisInput.getProducts(), analysisInput.getCategoryUrls());
            MatchBatch batch = new FactMatcher(threads).matchAll(analysisInput.getFacts(), tree,
                analysisInput.getProducts());

            new ConsoleReporter(quiet).printMatchResults(batch.statistics(), batch.warnings());

            if (minMatchRate != null && batch.statistics().getMatchRate() < minMatchRate) {
                System.err.printf("Match rate %.3f is below %.3f%n", batch.statistics().getMatchRate(), minMatchRate);
                return 2;
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
