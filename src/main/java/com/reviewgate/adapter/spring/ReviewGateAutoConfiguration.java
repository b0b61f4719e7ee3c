package com.reviewgate.adapter.spring;

import com.reviewgate.action.ReviewActionPlanner;
import com.reviewgate.policy.DefaultPolicyEngine;
import com.reviewgate.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the review gate.
 * The policy itself is not a bean: it is loaded fresh for every evaluation.
 */
@Configuration
@ConditionalOnProperty(prefix = "review-gate", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ReviewGateProperties.class)
public class ReviewGateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ReviewGateAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PolicyEngine policyEngine() {
        return new DefaultPolicyEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReviewActionPlanner reviewActionPlanner(ReviewGateProperties properties) {
        log.info("Review gate configured: policy={}, post-review={}",
                properties.getConfigPath(), properties.isPostReview());
        return new ReviewActionPlanner(properties.isPostReview());
    }
}
