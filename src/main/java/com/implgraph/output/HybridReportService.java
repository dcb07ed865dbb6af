// com/implgraph/output/HybridReportService.java
package com.implgraph.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.implgraph.analysis.ImplicationPath;
import com.implgraph.analysis.LongestChainResult;
import com.implgraph.analysis.ReachabilityResult;
import com.implgraph.graph.Edge;
import com.implgraph.graph.GraphStats;
import com.implgraph.graph.ImplicationGraph;
import com.implgraph.processing.RuleSetAnalysis;
import com.implgraph.rules.MalformedRuleException;
import com.implgraph.rules.Predicate;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes the edge list of every analyzed rule file to CSV and the full analysis to one JSON document.
 * The JSON node and edge lists are what a graph renderer consumes.
 */
public class HybridReportService implements ReportService {
    private static final Logger LOGGER = LoggerFactory.getLogger(HybridReportService.class);

    public static final String EDGES_FILE = "implication_edges.csv";
    public static final String ANALYSIS_FILE = "analysis.json";

    private final Path outputDirectory;
    private final ObjectMapper jsonMapper;

    private CSVPrinter csvPrinter;
    private ObjectNode rootNode;
    private ArrayNode ruleSetsNode;
    private boolean initialized = false;

    public HybridReportService(Path outputDirectory) {
        this(outputDirectory, new ObjectMapper());
    }

    public HybridReportService(Path outputDirectory, ObjectMapper jsonMapper) {
        this.outputDirectory = outputDirectory;
        this.jsonMapper = jsonMapper;
    }

    @Override
    public synchronized void initialize() throws IOException {
        if (initialized) return;

        LOGGER.info("Initializing report output in directory: {}", outputDirectory.toAbsolutePath());
        Files.createDirectories(outputDirectory);

        BufferedWriter csvWriter = Files.newBufferedWriter(outputDirectory.resolve(EDGES_FILE), StandardCharsets.UTF_8);
        CSVFormat csvFormat = CSVFormat.DEFAULT
                .withQuoteMode(QuoteMode.ALL)
                .withRecordSeparator("\n")
                .withHeader("Rule File", "Antecedent", "Consequent");
        this.csvPrinter = new CSVPrinter(csvWriter, csvFormat);

        this.rootNode = jsonMapper.createObjectNode();
        this.ruleSetsNode = rootNode.putArray("ruleSets");
        initialized = true;
    }

    @Override
    public synchronized void writeAnalysis(RuleSetAnalysis analysis) throws IOException {
        if (!initialized) {
            throw new IllegalStateException("Report output has not been initialized");
        }

        for (Edge edge : analysis.getGraph().getEdges()) {
            csvPrinter.printRecord(analysis.getSource(), edge.getFrom().getLabel(), edge.getTo().getLabel());
        }
        csvPrinter.flush();

        ruleSetsNode.add(toJson(analysis));
        LOGGER.debug("Recorded analysis of {}", analysis.getSource());
    }

    @Override
    public synchronized void close() throws IOException {
        if (!initialized) return;

        try {
            csvPrinter.close();
        } finally {
            jsonMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(outputDirectory.resolve(ANALYSIS_FILE).toFile(), rootNode);
            initialized = false;
            LOGGER.info("Reports written: {}, {}", EDGES_FILE, ANALYSIS_FILE);
        }
    }

    ObjectNode toJson(RuleSetAnalysis analysis) {
        ObjectNode node = jsonMapper.createObjectNode();
        node.put("source", analysis.getSource());
        node.set("stats", statsToJson(analysis.getStats()));

        ImplicationGraph graph = analysis.getGraph();
        ArrayNode nodesArray = node.putArray("nodes");
        graph.getNodes().forEach(p -> nodesArray.add(p.getLabel()));

        ArrayNode edgesArray = node.putArray("edges");
        for (Edge edge : graph.getEdges()) {
            edgesArray.addObject()
                    .put("from", edge.getFrom().getLabel())
                    .put("to", edge.getTo().getLabel());
        }

        ArrayNode skippedArray = node.putArray("skippedLines");
        for (MalformedRuleException skipped : analysis.getRules().getSkipped()) {
            skippedArray.addObject()
                    .put("line", skipped.getLineNumber())
                    .put("reason", skipped.getReason())
                    .put("text", skipped.getLine());
        }

        node.set("longestChain", longestChainToJson(analysis.getLongestChain()));

        ObjectNode reachabilityNode = node.putObject("reachability");
        for (Map.Entry<String, ReachabilityResult> entry : analysis.getReachability().entrySet()) {
            reachabilityNode.set(entry.getKey(), reachabilityToJson(entry.getValue()));
        }

        ArrayNode unknownArray = node.putArray("unknownStartPredicates");
        analysis.getUnknownStartPredicates().forEach(unknownArray::add);
        return node;
    }

    private ObjectNode statsToJson(GraphStats stats) {
        ObjectNode node = jsonMapper.createObjectNode();
        node.put("nodes", stats.getNodeCount());
        node.put("edges", stats.getEdgeCount());
        node.put("rules", stats.getRuleCount());
        node.put("conjunctiveRules", stats.getConjunctiveRuleCount());
        node.put("selfLoops", stats.getSelfLoopCount());
        node.put("roots", stats.getRootCount());
        node.put("leaves", stats.getLeafCount());
        return node;
    }

    private ObjectNode longestChainToJson(LongestChainResult result) {
        ObjectNode node = jsonMapper.createObjectNode();
        node.put("outcome", result.getOutcome().name());
        node.put("distance", result.getDistance());
        result.getWitness().ifPresent(path -> {
            node.set("path", pathToJson(path));
            node.putObject("concludes")
                    .put("from", path.getSource().getLabel())
                    .put("to", path.getTarget().getLabel());
        });
        return node;
    }

    private ObjectNode reachabilityToJson(ReachabilityResult result) {
        ObjectNode node = jsonMapper.createObjectNode();
        node.put("start", result.getStart().getLabel());
        ObjectNode reachableNode = node.putObject("reachable");
        for (Map.Entry<Predicate, ImplicationPath> entry : result.getPaths().entrySet()) {
            ObjectNode target = reachableNode.putObject(entry.getKey().getLabel());
            target.put("distance", entry.getValue().length());
            target.set("path", pathToJson(entry.getValue()));
        }
        return node;
    }

    private ArrayNode pathToJson(ImplicationPath path) {
        ArrayNode array = jsonMapper.createArrayNode();
        path.labels().forEach(array::add);
        return array;
    }
}
