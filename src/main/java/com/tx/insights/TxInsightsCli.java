package com.tx.insights;

import ch.qos.logback.classic.Level;
import com.tx.insights.command.AnalyzeCommand;
import com.tx.insights.command.GenerateCommand;
import com.tx.insights.command.MatchCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "tx-insights",
    mixinStandardHelpOptions = true,
    version = "tx-insights 1.0.0",
    description = "Category taxonomy performance analysis for product catalogs",
    subcommands = {
        AnalyzeCommand.class,
        MatchCommand.class,
        GenerateCommand.class
    }
)
public class TxInsightsCli implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    boolean verbose;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        TxInsightsCli cli = new TxInsightsCli();
        CommandLine commandLine = new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            if (cli.verbose) {
                enableDebugLogging();
            }
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger("com.tx.insights");
        if (logger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) logger).setLevel(Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
