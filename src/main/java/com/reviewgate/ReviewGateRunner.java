package com.reviewgate;

import com.reviewgate.action.ReviewAction;
import com.reviewgate.action.ReviewActionPlanner;
import com.reviewgate.adapter.spring.ReviewGateProperties;
import com.reviewgate.change.ChangeSnapshot;
import com.reviewgate.change.ChangeSnapshotReader;
import com.reviewgate.change.TruncationCheck;
import com.reviewgate.config.PolicyLoader;
import com.reviewgate.config.ReviewPolicy;
import com.reviewgate.exception.ConfigurationException;
import com.reviewgate.exception.InputUnavailableException;
import com.reviewgate.policy.EvaluationResult;
import com.reviewgate.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates one change and records the action and exit code.
 * <p>
 * Exit codes: {@value #EXIT_APPROVED} approved, {@value #EXIT_REJECTED} missing
 * required approvals, {@value #EXIT_ERROR} invalid policy or unavailable input.
 */
public class ReviewGateRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReviewGateRunner.class);

    public static final int EXIT_APPROVED = 0;
    public static final int EXIT_REJECTED = 1;
    public static final int EXIT_ERROR = 2;

    private final PolicyEngine policyEngine;
    private final ReviewActionPlanner actionPlanner;
    private final ReviewGateProperties properties;

    private volatile int exitCode = EXIT_APPROVED;
    private volatile ReviewAction action;
    private volatile List<String> warnings = List.of();

    public ReviewGateRunner(PolicyEngine policyEngine, ReviewActionPlanner actionPlanner,
                            ReviewGateProperties properties) {
        this.policyEngine = policyEngine;
        this.actionPlanner = actionPlanner;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        try {
            ReviewPolicy policy = PolicyLoader.load(properties.getConfigPath());
            ChangeSnapshot snapshot = ChangeSnapshotReader.read(properties.getChangePath());
            warnings = TruncationCheck.check(snapshot, properties.getLimits().toChangeLimits());

            EvaluationResult result = policyEngine.evaluate(policy, snapshot.toChangeSet());
            action = actionPlanner.plan(result);
            log.info("{} -> {}: {}", result, action, action.getMessage());
            exitCode = action.isApproving() ? EXIT_APPROVED : EXIT_REJECTED;
        } catch (ConfigurationException e) {
            log.error("Invalid review policy: {}", e.getMessage());
            exitCode = EXIT_ERROR;
        } catch (InputUnavailableException e) {
            log.error("Cannot evaluate change: {}", e.getMessage());
            exitCode = EXIT_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Action planned by the last run; empty if it ended in an error.
     */
    public Optional<ReviewAction> getAction() {
        return Optional.ofNullable(action);
    }

    /**
     * Truncation warnings raised by the last run.
     */
    public List<String> getWarnings() {
        return warnings;
    }
}
