package com.reviewgate;

import com.reviewgate.action.ReviewActionPlanner;
import com.reviewgate.adapter.spring.ReviewGateProperties;
import com.reviewgate.policy.PolicyEngine;
import com.reviewgate.spring.EnableReviewGate;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Command-line entry point: evaluates the configured change and exits with its verdict.
 * <p>
 * Example:
 * <pre>
 * java -jar review-gate.jar --review-gate.change-path=change.json --review-gate.post-review=true
 * </pre>
 */
@SpringBootApplication
@EnableReviewGate
public class ReviewGateApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ReviewGateApplication.class, args)));
    }

    // Follows the auto-configuration switch; without it there is no engine to run
    @Bean
    @ConditionalOnProperty(prefix = "review-gate", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ReviewGateRunner reviewGateRunner(PolicyEngine policyEngine, ReviewActionPlanner actionPlanner,
                                             ReviewGateProperties properties) {
        return new ReviewGateRunner(policyEngine, actionPlanner, properties);
    }
}
