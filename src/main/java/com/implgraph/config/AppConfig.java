// com/implgraph/config/AppConfig.java
package com.implgraph.config;

import com.implgraph.analysis.BreadthFirstChainAnalysisService;
import com.implgraph.analysis.ChainAnalysisService;
import com.implgraph.graph.ImplicationGraphBuilder;
import com.implgraph.rules.DefaultRuleParser;
import com.implgraph.rules.PredicateNormalizer;
import com.implgraph.rules.RuleFileLoader;
import com.implgraph.rules.RuleParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    @Bean
    public PredicateNormalizer predicateNormalizer(AnalysisConfiguration config) {
        return new PredicateNormalizer(config.isFoldCase());
    }

    @Bean
    public RuleParser ruleParser(AnalysisConfiguration config, PredicateNormalizer normalizer) {
        return new DefaultRuleParser(config.getParsePolicy(), normalizer);
    }

    @Bean
    public RuleFileLoader ruleFileLoader(RuleParser ruleParser, AnalysisConfiguration config) {
        return new RuleFileLoader(ruleParser, config.getRuleFileExtension());
    }

    @Bean
    public ImplicationGraphBuilder implicationGraphBuilder() {
        return new ImplicationGraphBuilder();
    }

    @Bean
    public ChainAnalysisService chainAnalysisService(PredicateNormalizer normalizer, AnalysisConfiguration config) {
        return new BreadthFirstChainAnalysisService(normalizer, config.getThreadPoolSize());
    }
}
