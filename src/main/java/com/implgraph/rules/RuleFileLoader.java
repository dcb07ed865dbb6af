// com/implgraph/rules/RuleFileLoader.java
package com.implgraph.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads rule files from disk and hands their lines to a {@link RuleParser}.
 */
public class RuleFileLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleFileLoader.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final RuleParser parser;
    private final String ruleFileExtension;

    public RuleFileLoader(RuleParser parser, String ruleFileExtension) {
        this.parser = parser;
        this.ruleFileExtension = ruleFileExtension == null ? "" : ruleFileExtension.toLowerCase(Locale.ROOT);
    }

    /**
     * Load and parse a single UTF-8 rule file.
     */
    public ParsedRules load(Path ruleFile) {
        LOGGER.debug("Loading rules from file: {}", ruleFile.toAbsolutePath());
        List<String> lines;
        try {
            lines = new ArrayList<>(Files.readAllLines(ruleFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RuleLoadingException("Failed to read rule file " + ruleFile + ": " + e.getMessage(), e);
        }
        if (!lines.isEmpty() && !lines.get(0).isEmpty() && lines.get(0).charAt(0) == BYTE_ORDER_MARK) {
            lines.set(0, lines.get(0).substring(1));
        }

        ParsedRules parsed = parser.parse(ruleFile.getFileName().toString(), lines);
        LOGGER.info("Loaded {} implications from {}", parsed.size(), ruleFile.getFileName());
        return parsed;
    }

    /**
     * A regular file yields itself. A directory yields its rule files, sorted by name.
     */
    public List<Path> discoverRuleFiles(Path rulesPath) {
        if (rulesPath == null || !Files.exists(rulesPath)) {
            throw new RuleLoadingException("Rules path does not exist: " + rulesPath);
        }
        if (Files.isRegularFile(rulesPath)) {
            return List.of(rulesPath);
        }

        try (Stream<Path> entries = Files.list(rulesPath)) {
            List<Path> files = entries
                    .filter(Files::isRegularFile)
                    .filter(this::isRuleFile)
                    .sorted()
                    .collect(Collectors.toCollection(ArrayList::new));
            if (files.isEmpty()) {
                LOGGER.warn("No rule files ending in '{}' found in directory: {}", ruleFileExtension, rulesPath);
            }
            return files;
        } catch (IOException e) {
            throw new RuleLoadingException("Failed to list rules directory " + rulesPath + ": " + e.getMessage(), e);
        }
    }

    private boolean isRuleFile(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ruleFileExtension);
    }
}
