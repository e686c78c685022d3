package com.herzen.oracle.config;

import com.herzen.oracle.sandbox.SandboxLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "oracle")
public record OracleProperties(
        @DefaultValue Sandbox sandbox,
        @DefaultValue Patterns patterns
) {

    public record Sandbox(@DefaultValue("300") int maxExpressionLength,
                          @DefaultValue("20") int maxStatements,
                          @DefaultValue("10000") int maxEvaluationSteps,
                          @DefaultValue("10000") int maxSequenceLength) {
        public SandboxLimits limits() {
            return new SandboxLimits(maxExpressionLength, maxStatements, maxEvaluationSteps, maxSequenceLength);
        }
    }

    public record Patterns(@DefaultValue("patterns") String directory,
                           @DefaultValue("50") int maxAttempts,
                           Long randomSeed) {}
}
