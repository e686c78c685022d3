package com.herzen.oracle.config;

import com.herzen.oracle.sandbox.ExpressionEvaluator;
import com.herzen.oracle.sandbox.RandomSource;
import com.herzen.oracle.sandbox.SandboxLimits;
import com.herzen.oracle.sandbox.SeededRandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OracleConfig {
    @Bean
    public SandboxLimits sandboxLimits(OracleProperties properties) {
        return properties.sandbox().limits();
    }

    @Bean
    public RandomSource randomSource(OracleProperties properties) {
        Long seed = properties.patterns().randomSeed();
        return seed == null ? new SeededRandomSource() : new SeededRandomSource(seed);
    }

    @Bean
    public ExpressionEvaluator expressionEvaluator(SandboxLimits limits, RandomSource randomSource) {
        return new ExpressionEvaluator(limits, randomSource);
    }
}
