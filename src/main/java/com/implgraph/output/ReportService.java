// com/implgraph/output/ReportService.java
package com.implgraph.output;

import com.implgraph.processing.RuleSetAnalysis;

import java.io.IOException;

public interface ReportService {
    default void initialize() throws IOException {
    }

    void writeAnalysis(RuleSetAnalysis analysis) throws IOException;

    default void close() throws IOException {
    }
}
