// com/implgraph/application/ImplicationGraphAnalyzer.java
package com.implgraph.application;

import com.implgraph.analysis.ChainAnalysisService;
import com.implgraph.config.AnalysisConfiguration;
import com.implgraph.graph.ImplicationGraphBuilder;
import com.implgraph.output.HybridReportService;
import com.implgraph.output.ReportService;
import com.implgraph.processing.ProcessingResult;
import com.implgraph.processing.RuleSetProcessor;
import com.implgraph.rules.RuleFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Command line entry point.
 * Usage: {@code [rulesPath] [outputDirectory] [startPredicate ...]}; arguments override configuration.
 */
@SpringBootApplication(scanBasePackages = "com.implgraph")
@EnableConfigurationProperties(AnalysisConfiguration.class)
public class ImplicationGraphAnalyzer implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImplicationGraphAnalyzer.class);

    @Autowired
    private AnalysisConfiguration config;

    @Autowired
    private RuleFileLoader ruleFileLoader;

    @Autowired
    private ImplicationGraphBuilder graphBuilder;

    @Autowired
    private ChainAnalysisService analysisService;

    public static void main(String[] args) {
        SpringApplication.run(ImplicationGraphAnalyzer.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        if (args.length > 0) {
            config.setRulesPath(args[0]);
        }
        if (args.length > 1) {
            config.setOutputDirectory(args[1]);
        }
        if (args.length > 2) {
            config.setStartPredicates(Arrays.asList(args).subList(2, args.length));
        }

        LOGGER.info("=== Implication Graph Analyzer ===");
        logConfiguration();

        ReportService reportService = config.isWriteReports()
                ? new HybridReportService(Path.of(config.getOutputDirectory()))
                : analysis -> LOGGER.debug("Report output disabled, skipping {}", analysis.getSource());

        RuleSetProcessor processor = new RuleSetProcessor(ruleFileLoader, graphBuilder, analysisService, reportService);
        ProcessingResult result = processor.process(Path.of(config.getRulesPath()), config.getStartPredicates());
        logResults(result);
    }

    private void logConfiguration() {
        LOGGER.info("Configuration:");
        LOGGER.info("  Rules path: {}", config.getRulesPath());
        LOGGER.info("  Output directory: {}", config.getOutputDirectory());
        LOGGER.info("  Parse policy: {}", config.getParsePolicy().getDisplayName());
        LOGGER.info("  Fold case: {}", config.isFoldCase());
        LOGGER.info("  Thread pool size: {}", config.getThreadPoolSize());
        LOGGER.info("  Start predicates: {}", config.getStartPredicates());
        if (config.isEnableDetailedLogging()) {
            LOGGER.info("  Full configuration: {}", config);
        }
    }

    private void logResults(ProcessingResult result) {
        LOGGER.info("=== PROCESSING COMPLETED ===");
        LOGGER.info("  Rule files processed: {}", result.getProcessedFiles());
        LOGGER.info("  Rules: {}", result.getTotalRules());
        LOGGER.info("  Nodes: {}", result.getTotalNodes());
        LOGGER.info("  Edges: {}", result.getTotalEdges());
        LOGGER.info("  Reachability queries: {}", result.getReachabilityQueries());
        if (result.getLongestChainSource() != null) {
            LOGGER.info("  Longest chain: {} ({})", result.getLongestChainDistance(), result.getLongestChainSource());
        }
        LOGGER.info("  Processing time: {} ms", result.getProcessingTimeMs());
        LOGGER.info("  Success: {}", result.isSuccess());

        if (result.hasErrors()) {
            LOGGER.warn("Errors encountered ({}): ", result.getErrors().size());
            result.getErrors().forEach(error -> LOGGER.warn("  - {}", error));
        }
        if (result.hasWarnings()) {
            LOGGER.info("Warnings ({}): ", result.getWarnings().size());
            result.getWarnings().forEach(warning -> LOGGER.info("  - {}", warning));
        }
    }
}
