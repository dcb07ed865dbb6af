package com.implgraph.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.implgraph.analysis.BreadthFirstChainAnalysisService;
import com.implgraph.graph.ImplicationGraphBuilder;
import com.implgraph.processing.ProcessingResult;
import com.implgraph.processing.RuleSetProcessor;
import com.implgraph.rules.DefaultRuleParser;
import com.implgraph.rules.PredicateNormalizer;
import com.implgraph.rules.RuleFileLoader;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HybridReportServiceTest {

    @TempDir
    Path tempDir;

    private ProcessingResult runOn(Path rules, Path output, List<String> starts) {
        RuleSetProcessor processor = new RuleSetProcessor(
                new RuleFileLoader(new DefaultRuleParser(), ".txt"),
                new ImplicationGraphBuilder(),
                new BreadthFirstChainAnalysisService(new PredicateNormalizer(), 1),
                new HybridReportService(output));
        return processor.process(rules, starts);
    }

    @Test
    void whenClosing_givenAnalyzedFile_shouldWriteJsonConsumableByRenderer() throws IOException {
        Path rules = Files.writeString(tempDir.resolve("rules.txt"), "A & X -> B\nB -> C\nbroken line\n");
        Path output = tempDir.resolve("out");

        ProcessingResult result = runOn(rules, output, List.of("A", "Nope"));

        assertTrue(result.isSuccess());
        JsonNode ruleSet = new ObjectMapper().readTree(output.resolve(HybridReportService.ANALYSIS_FILE).toFile())
                .get("ruleSets").get(0);
        assertEquals("rules.txt", ruleSet.get("source").asText());
        assertEquals(4, ruleSet.get("nodes").size());
        assertEquals(3, ruleSet.get("edges").size());
        assertEquals(3, ruleSet.get("stats").get("edges").asInt());
        assertEquals(3, ruleSet.get("skippedLines").get(0).get("line").asInt());

        JsonNode longest = ruleSet.get("longestChain");
        assertEquals("CHAIN_FOUND", longest.get("outcome").asText());
        assertEquals(2, longest.get("distance").asInt());
        assertEquals("A", longest.get("concludes").get("from").asText());
        assertEquals("C", longest.get("concludes").get("to").asText());

        JsonNode reachableFromA = ruleSet.get("reachability").get("A").get("reachable");
        assertEquals(2, reachableFromA.get("C").get("distance").asInt());
        assertEquals("B", reachableFromA.get("C").get("path").get(1).asText());
        assertEquals("Nope", ruleSet.get("unknownStartPredicates").get(0).asText());
    }

    @Test
    void whenClosing_givenDegenerateGraph_shouldOmitWitness() throws IOException {
        Path rules = Files.writeString(tempDir.resolve("loops.txt"), "A -> A\n");
        Path output = tempDir.resolve("out");

        runOn(rules, output, List.of());

        JsonNode longest = new ObjectMapper().readTree(output.resolve(HybridReportService.ANALYSIS_FILE).toFile())
                .get("ruleSets").get(0).get("longestChain");
        assertEquals("NO_REACHABLE_PAIRS", longest.get("outcome").asText());
        assertEquals(0, longest.get("distance").asInt());
        assertFalse(longest.has("path"));
    }

    @Test
    void whenClosing_givenSeveralFiles_shouldWriteOneCsvRowPerEdge() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("rules"));
        Files.writeString(dir.resolve("a.txt"), "A -> B\n");
        Files.writeString(dir.resolve("b.txt"), "x & y -> \"z\"\n");
        Path output = tempDir.resolve("out");

        runOn(dir, output, List.of());

        try (Reader reader = Files.newBufferedReader(output.resolve(HybridReportService.EDGES_FILE), StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.withFirstRecordAsHeader().parse(reader)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals(3, records.size());
            assertEquals("a.txt", records.get(0).get("Rule File"));
            assertEquals("x", records.get(1).get("Antecedent"));
            assertEquals("\"z\"", records.get(2).get("Consequent"));
        }
    }

    @Test
    void whenWriting_givenUninitializedService_shouldThrowException() {
        HybridReportService service = new HybridReportService(tempDir);

        assertThrows(IllegalStateException.class, () -> service.writeAnalysis(null));
    }
}
