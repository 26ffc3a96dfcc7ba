package com.tx.insights.command;

import com.tx.insights.dataset.Dataset;
import com.tx.insights.dataset.DatasetWriter;
import com.tx.insights.generator.CatalogGenerator;
import com.tx.insights.generator.RandomDataProvider;
import com.tx.insights.report.ConsoleReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "generate",
    description = "Generate a synthetic dataset",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    @Option(names = {"-o", "--output"}, description = "Dataset file to write", required = true)
    private Path output;

    @Option(names = {"-p", "--products"}, description = "Number of products", defaultValue = "200")
    private int products;

    @Option(names = {"-r", "--roots"}, description = "Number of top-level categories", defaultValue = "5")
    private int roots;

    @Option(names = {"-d", "--depth"}, description = "Category levels below the roots (0-2)", defaultValue = "2")
    private int depth;

    @Option(names = {"-u", "--unmatched-ratio"}, description = "Share of extra facts matching nothing",
        defaultValue = "0.05")
    private double unmatchedRatio;

    @Option(names = {"-s", "--seed"}, description = "Random seed", defaultValue = "42")
    private long seed;

    @Override
    public Integer call() {
        try {
            CatalogGenerator generator = new CatalogGenerator(new RandomDataProvider(seed), products, roots, depth,
                unmatchedRatio);
            Dataset dataset = generator.generate();
            new DatasetWriter().write(dataset, output);
            new ConsoleReporter(false).printGenerated(dataset, output.toString());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
