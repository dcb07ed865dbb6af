// com/implgraph/processing/RuleSetProcessor.java
package com.implgraph.processing;

import com.implgraph.analysis.ChainAnalysisService;
import com.implgraph.analysis.LongestChainResult;
import com.implgraph.analysis.ReachabilityResult;
import com.implgraph.analysis.UnknownPredicateException;
import com.implgraph.graph.GraphStats;
import com.implgraph.graph.ImplicationGraph;
import com.implgraph.graph.ImplicationGraphBuilder;
import com.implgraph.output.ChainFormatter;
import com.implgraph.output.ReportService;
import com.implgraph.rules.ImplicationGraphException;
import com.implgraph.rules.MalformedRuleException;
import com.implgraph.rules.ParsedRules;
import com.implgraph.rules.RuleFileLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs parse, build and analysis for every rule file under a path, one file at a time.
 * A file that fails is recorded as an error and the next file is still processed.
 */
public class RuleSetProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleSetProcessor.class);

    private final RuleFileLoader loader;
    private final ImplicationGraphBuilder graphBuilder;
    private final ChainAnalysisService analysisService;
    private final ReportService reportService;
    private final PerformanceTracker performanceTracker;

    public RuleSetProcessor(RuleFileLoader loader,
                            ImplicationGraphBuilder graphBuilder,
                            ChainAnalysisService analysisService,
                            ReportService reportService) {
        this.loader = loader;
        this.graphBuilder = graphBuilder;
        this.analysisService = analysisService;
        this.reportService = reportService;
        this.performanceTracker = new PerformanceTracker();
    }

    public ProcessingResult process(Path rulesPath, List<String> startPredicates) {
        ProcessingResult result = new ProcessingResult();
        long started = System.currentTimeMillis();

        try {
            LOGGER.info("Processing rules from: {}", rulesPath);
            reportService.initialize();

            List<Path> ruleFiles = loader.discoverRuleFiles(rulesPath);
            if (ruleFiles.isEmpty()) {
                result.addError("No rule files found under " + rulesPath);
                return result;
            }

            for (int i = 0; i < ruleFiles.size(); i++) {
                Path ruleFile = ruleFiles.get(i);
                LOGGER.info("Processing file {}/{}: {}", i + 1, ruleFiles.size(), ruleFile.getFileName());
                processRuleFile(ruleFile, startPredicates, result);
            }

        } catch (ImplicationGraphException | IOException e) {
            LOGGER.error("Processing of {} failed", rulesPath, e);
            result.addError("Processing failed: " + e.getMessage());
        } finally {
            closeReports(result);
            result.setProcessingTimeMs(System.currentTimeMillis() - started);
            performanceTracker.logSummary();
        }

        return result;
    }

    /**
     * Analyze one rule file and hand the outcome to the report service.
     */
    RuleSetAnalysis processRuleFile(Path ruleFile, List<String> startPredicates, ProcessingResult result) {
        String name = ruleFile.getFileName().toString();
        try {
            performanceTracker.start("parse");
            ParsedRules parsed = loader.load(ruleFile);
            performanceTracker.end("parse");
            for (MalformedRuleException skipped : parsed.getSkipped()) {
                result.addWarning(name + ": " + skipped.getMessage());
            }

            performanceTracker.start("build");
            ImplicationGraph graph = graphBuilder.build(parsed.getRules());
            GraphStats stats = graphBuilder.statsFor(graph, parsed.getRules());
            performanceTracker.end("build");
            LOGGER.info("Graph has {} nodes and {} edges", stats.getNodeCount(), stats.getEdgeCount());

            performanceTracker.start("longest_chain");
            LongestChainResult longestChain = analysisService.longestChain(graph);
            performanceTracker.end("longest_chain");
            ChainFormatter.formatLongestChain(longestChain).forEach(LOGGER::info);

            RuleSetAnalysis analysis = new RuleSetAnalysis(parsed, graph, stats, longestChain);

            performanceTracker.start("reachability");
            for (String startLabel : startPredicates) {
                try {
                    ReachabilityResult reachable = analysisService.reachableFrom(graph, startLabel);
                    analysis.addReachability(startLabel, reachable);
                    ChainFormatter.formatReachability(reachable).forEach(LOGGER::info);
                } catch (UnknownPredicateException e) {
                    LOGGER.warn("Node '{}' is not in the graph of {}", startLabel, name);
                    analysis.addUnknownStartPredicate(startLabel);
                    result.addWarning(name + ": " + e.getMessage());
                }
            }
            performanceTracker.end("reachability");

            reportService.writeAnalysis(analysis);
            result.addAnalysis(analysis);
            return analysis;

        } catch (ImplicationGraphException | IOException e) {
            LOGGER.warn("Error processing rule file {}: {}", name, e.getMessage());
            result.addError("Failed to process file " + name + ": " + e.getMessage());
            return null;
        }
    }

    private void closeReports(ProcessingResult result) {
        try {
            reportService.close();
        } catch (IOException e) {
            LOGGER.error("Could not close report output", e);
            result.addError("Could not close report output: " + e.getMessage());
        }
    }
}
