// com/implgraph/config/AnalysisConfiguration.java
package com.implgraph.config;

import com.implgraph.rules.ParsePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for rule parsing and graph analysis
 */
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfiguration {

    private String rulesPath = "rules";
    private String outputDirectory = "./output";
    private String ruleFileExtension = ".txt";
    private ParsePolicy parsePolicy = ParsePolicy.SKIP_WITH_WARNING;
    private boolean foldCase = false;
    private int threadPoolSize = 1;
    private List<String> startPredicates = new ArrayList<>();
    private boolean writeReports = true;
    private boolean enableDetailedLogging = false;

    public String getRulesPath() { return rulesPath; }
    public void setRulesPath(String rulesPath) { this.rulesPath = rulesPath; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public String getRuleFileExtension() { return ruleFileExtension; }
    public void setRuleFileExtension(String ruleFileExtension) { this.ruleFileExtension = ruleFileExtension; }

    public ParsePolicy getParsePolicy() { return parsePolicy; }
    public void setParsePolicy(ParsePolicy parsePolicy) { this.parsePolicy = parsePolicy; }

    public boolean isFoldCase() { return foldCase; }
    public void setFoldCase(boolean foldCase) { this.foldCase = foldCase; }

    public int getThreadPoolSize() { return threadPoolSize; }
    public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }

    public List<String> getStartPredicates() { return startPredicates; }
    public void setStartPredicates(List<String> startPredicates) {
        this.startPredicates = startPredicates != null ? new ArrayList<>(startPredicates) : new ArrayList<>();
    }

    public boolean isWriteReports() { return writeReports; }
    public void setWriteReports(boolean writeReports) { this.writeReports = writeReports; }

    public boolean isEnableDetailedLogging() { return enableDetailedLogging; }
    public void setEnableDetailedLogging(boolean enableDetailedLogging) {
        this.enableDetailedLogging = enableDetailedLogging;
    }

    @Override
    public String toString() {
        return "AnalysisConfiguration{" +
                "rulesPath='" + rulesPath + '\'' +
                ", outputDirectory='" + outputDirectory + '\'' +
                ", ruleFileExtension='" + ruleFileExtension + '\'' +
                ", parsePolicy=" + parsePolicy +
                ", foldCase=" + foldCase +
                ", threadPoolSize=" + threadPoolSize +
                ", startPredicates=" + startPredicates +
                ", writeReports=" + writeReports +
                '}';
    }
}
