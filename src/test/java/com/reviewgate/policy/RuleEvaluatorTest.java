package com.reviewgate.policy;

import com.reviewgate.config.ReviewerRule;
import com.reviewgate.config.TeamConfig;
import com.reviewgate.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleEvaluator.
 */
class RuleEvaluatorTest {

    private final RuleEvaluator evaluator = new RuleEvaluator(new ApproverResolver());

    private final Map<String, TeamConfig> teams = Map.of("core-team", TeamConfig.of("carol", "dave"));

    // =====================================================================
    // Prefix Matching Tests
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Rules match by literal string prefix")
    @CsvSource({
            "docs/readme.md, docs/, true",
            "docs/readme.md, doc, true",
            "docs/readme.md, docu, false",
            "src/foo, src/f, true",
            "src/foo, src/foo/, false",
            "lib/src/a.java, src/, false"
    })
    void literalPrefixMatch(String file, String prefix, boolean matched) {
        RuleResult result = evaluator.evaluateRule(prefix, ReviewerRule.ofUsers(1, "alice"), teams,
                List.of(file), Set.of());

        assertEquals(matched, result.matched());
        assertEquals(!matched, result.passed());
    }

    @Test
    @DisplayName("Unmatched rule passes without consulting approvals")
    void unmatchedRulePasses() {
        RuleEvaluation evaluation = evaluator.evaluate(
                Map.of("src/", ReviewerRule.ofUsers(5, "alice")), teams, List.of("docs/a.md"), Set.of());

        assertTrue(evaluation.isApproved());
        RuleResult result = evaluation.results().get(0);
        assertFalse(result.matched());
        assertTrue(result.affectedFiles().isEmpty());
        assertNull(result.diagnostic());
    }

    @Test
    @DisplayName("Affected files lists only files under the prefix")
    void affectedFiles() {
        RuleResult result = evaluator.evaluateRule("src/", ReviewerRule.ofUsers(0), teams,
                List.of("src/a.ts", "docs/b.md", "src/c/d.ts"), Set.of());

        assertEquals(List.of("src/a.ts", "src/c/d.ts"), result.affectedFiles());
    }

    // =====================================================================
    // Approval Counting Tests
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Rule passes once enough relevant approvals exist")
    @CsvSource({
            "0, '', true",
            "1, '', false",
            "1, bob, true",
            "2, bob, false",
            "2, bob;carol, true",
            "2, bob;mallory, false",
            "1, mallory, false"
    })
    void approvalThreshold(int required, String approvals, boolean passed) {
        ReviewerRule rule = new ReviewerRule(null, List.of("alice", "bob"), List.of("core-team"), required);
        Set<String> approvalSet = approvals.isEmpty() ? Set.of() : Set.of(approvals.split(";"));

        RuleResult result = evaluator.evaluateRule("src/", rule, teams, List.of("src/a.ts"), approvalSet);

        assertTrue(result.matched());
        assertEquals(passed, result.passed());
    }

    @Test
    @DisplayName("Approvals outside the approver set are not counted")
    void irrelevantApprovalsIgnored() {
        RuleResult result = evaluator.evaluateRule("src/", ReviewerRule.ofTeams(1, "core-team"), teams,
                List.of("src/a.ts"), Set.of("alice", "dave", "mallory"));

        assertEquals(List.of("dave"), result.relevantApprovals());
        assertTrue(result.passed());
    }

    @Test
    @DisplayName("Zero required approvers always passes when matched")
    void zeroRequiredPasses() {
        RuleResult result = evaluator.evaluateRule("CHANGELOG.md", ReviewerRule.ofUsers(0), teams,
                List.of("CHANGELOG.md"), Set.of());

        assertTrue(result.matched());
        assertTrue(result.passed());
    }

    @Test
    @DisplayName("Overall result is the conjunction of matched rules")
    void conjunctionOfMatchedRules() {
        Map<String, ReviewerRule> reviewers = new LinkedHashMap<>();
        reviewers.put("src/", ReviewerRule.ofUsers(1, "alice"));
        reviewers.put("docs/", ReviewerRule.ofUsers(1, "erin"));
        reviewers.put("build/", ReviewerRule.ofUsers(1, "frank"));

        RuleEvaluation evaluation = evaluator.evaluate(reviewers, teams,
                List.of("src/a.ts", "docs/b.md"), Set.of("alice"));

        assertFalse(evaluation.isApproved());
        assertEquals(List.of("src/", "docs/", "build/"),
                evaluation.results().stream().map(RuleResult::prefix).toList());
        assertEquals(1, evaluation.failedRules().size());
        assertEquals("docs/", evaluation.failedRules().get(0).prefix());
    }

    @Test
    @DisplayName("No rules means approved")
    void emptyReviewersApproves() {
        RuleEvaluation evaluation = evaluator.evaluate(Map.of(), teams, List.of("src/a.ts"), Set.of());

        assertTrue(evaluation.isApproved());
        assertTrue(evaluation.diagnostics().isEmpty());
    }

    // =====================================================================
    // Diagnostic Tests
    // =====================================================================

    @Test
    @DisplayName("Failure diagnostic lists files, requirement and approvals found")
    void failureDiagnostic() {
        ReviewerRule rule = new ReviewerRule(null, List.of("alice", "bob"), List.of("core-team"), 2);

        RuleResult result = evaluator.evaluateRule("src/", rule, teams,
                List.of("src/a.ts", "src/b.ts"), Set.of("carol"));

        assertEquals("""
                Modified Files:
                 - src/a.ts
                 - src/b.ts
                Require 2 reviews from:
                  users:
                 - alice
                 - bob
                  teams:
                 - core-team
                But only found 1 approvals: [carol].""", result.diagnostic());
    }

    @Test
    @DisplayName("Empty users and teams are printed inline")
    void diagnosticEmptyLists() {
        String diagnostic = RuleEvaluator.describeFailure(ReviewerRule.ofUsers(1), List.of("a"), List.of());

        assertTrue(diagnostic.contains("  users: []\n"));
        assertTrue(diagnostic.contains("  teams: []\n"));
        assertTrue(diagnostic.endsWith("But only found 0 approvals: []."));
    }

    @Test
    @DisplayName("Matched rule with undefined team fails with the rule prefix")
    void undefinedTeamNamesRule() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> evaluator.evaluateRule("src/", ReviewerRule.ofTeams(1, "ghost"), teams,
                        List.of("src/a.ts"), Set.of()));

        assertTrue(e.getMessage().contains("src/"));
        assertTrue(e.getMessage().contains("ghost"));
    }
}
