package com.careu.reasoning.config;

import com.careu.reasoning.reasoning.DifferentialRanker;
import com.careu.reasoning.reasoning.ReasoningChainBuilder;
import com.careu.reasoning.reasoning.SafetyValidator;
import com.careu.reasoning.reasoning.ScoringWeights;
import com.careu.reasoning.reasoning.SymptomMatcher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReasoningConfig {

    @Bean
    public ScoringWeights scoringWeights(
            @Value("${careu.reasoning.red-flag-bonus:2}") int redFlagBonus,
            @Value("${careu.reasoning.confidence-scale:1.0}") double confidenceScale,
            @Value("${careu.reasoning.red-flag-boost:0.10}") double redFlagBoost,
            @Value("${careu.reasoning.max-red-flag-boost:0.30}") double maxRedFlagBoost,
            @Value("${careu.reasoning.default-limit:5}") int defaultLimit,
            @Value("${careu.reasoning.max-limit:25}") int maxLimit) {
        return new ScoringWeights(redFlagBonus, confidenceScale, redFlagBoost, maxRedFlagBoost, defaultLimit, maxLimit);
    }

    @Bean
    public SymptomMatcher symptomMatcher(ScoringWeights weights) {
        return new SymptomMatcher(weights);
    }

    @Bean
    public DifferentialRanker differentialRanker(ScoringWeights weights) {
        return new DifferentialRanker(weights);
    }

    @Bean
    public SafetyValidator safetyValidator() {
        return new SafetyValidator();
    }

    @Bean
    public ReasoningChainBuilder reasoningChainBuilder(SymptomMatcher matcher,
                                                       DifferentialRanker ranker,
                                                       SafetyValidator safetyValidator) {
        return new ReasoningChainBuilder(matcher, ranker, safetyValidator);
    }
}
