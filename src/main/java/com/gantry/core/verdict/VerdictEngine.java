package com.gantry.core.verdict;

import com.gantry.core.model.GateResult;
import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.Submission;
import com.gantry.core.model.SubmissionStatus;
import com.gantry.core.model.Verdict;
import com.gantry.core.model.VerdictDecision;
import com.gantry.core.pins.PinsDecision;
import com.gantry.core.pins.PinsResolver;
import com.gantry.core.security.RoleCapabilities;
import com.gantry.core.security.RolePolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Judges a job: DONE, RETRY or ESCALATE.
 * <p>
 * Rules are checked in a fixed order and the first one that matches decides,
 * but every rule still runs so the verdict lists all reasons found:
 * <ol>
 *   <li>no task id: ESCALATE</li>
 *   <li>submission asks for input: ESCALATE</li>
 *   <li>the executor crashed, timed out or was lost: RETRY, even with a submission on record</li>
 *   <li>a required gate did not run: RETRY</li>
 *   <li>a gate ran and failed: RETRY, with a fix-up action</li>
 *   <li>a touched file is out of scope, or a tool is not allowed: ESCALATE</li>
 *   <li>otherwise DONE only for a clean DONE submission with passing or unneeded tests, else RETRY</li>
 * </ol>
 * Judging has no side effects. Actions are advisory.
 */
@Service
public class VerdictEngine {

    private static final Logger log = LoggerFactory.getLogger(VerdictEngine.class);

    private final PinsResolver pinsResolver;
    private final RolePolicyEngine rolePolicyEngine;
    private final Clock clock;

    public VerdictEngine(PinsResolver pinsResolver, RolePolicyEngine rolePolicyEngine, Clock clock) {
        this.pinsResolver = pinsResolver;
        this.rolePolicyEngine = rolePolicyEngine;
        this.clock = clock;
    }

    private static final class Judgement {
        private VerdictDecision decision;
        private final Set<String> reasons = new LinkedHashSet<>();
        private final Set<String> actions = new LinkedHashSet<>();

        void match(VerdictDecision candidate, String reason) {
            reasons.add(reason);
            if (decision == null) {
                decision = candidate;
            }
        }
    }

    public Verdict judge(JudgeRequest request) {
        var judgement = new Judgement();

        if (request.taskId() == null || request.taskId().isBlank()) {
            judgement.match(VerdictDecision.ESCALATE, ReasonCodes.MISSING_TASK_ID);
        }

        Submission submission = request.submission();
        if (submission == null) {
            String reason = request.failureReason() == null
                    ? ReasonCodes.EXECUTOR_CRASH : request.failureReason();
            judgement.match(VerdictDecision.RETRY, reason);
            return finish(request, judgement);
        }

        if (submission.status() == SubmissionStatus.NEED_INPUT) {
            judgement.match(VerdictDecision.ESCALATE, ReasonCodes.SUBMIT_NEED_INPUT);
            judgement.actions.add(ReasonCodes.ACTION_OPERATOR_REVIEW);
        }
        if (request.failureReason() != null) {
            judgement.match(VerdictDecision.RETRY, request.failureReason());
        }

        checkGatesExecuted(request, judgement);
        checkGateFailures(request, judgement);

        Optional<RoleCapabilities> caps = findRole(request.role());
        checkScopeAndTools(request, submission, caps, judgement);
        checkOutcome(submission, request.exitCode(), caps, judgement);

        return finish(request, judgement);
    }

    private void checkGatesExecuted(JudgeRequest request, Judgement judgement) {
        var required = new LinkedHashSet<>(request.requiredGates());
        for (GateResult result : request.gateResults()) {
            if (Boolean.TRUE.equals(result.required())) {
                required.add(result.gate());
            } else if (Boolean.FALSE.equals(result.required())) {
                required.remove(result.gate());
            }
        }
        for (String gate : required) {
            boolean ran = request.gateResults().stream().anyMatch(r -> r.gate().equals(gate) && r.ran());
            if (!ran) {
                judgement.match(VerdictDecision.RETRY, ReasonCodes.gateNotExecuted(gate));
            }
        }
    }

    private void checkGateFailures(JudgeRequest request, Judgement judgement) {
        for (GateResult result : request.gateResults()) {
            if (!result.ran() || result.ok()) {
                continue;
            }
            switch (result.category()) {
                case CI -> {
                    judgement.match(VerdictDecision.RETRY, ReasonCodes.CI_FAILED);
                    judgement.actions.add(ReasonCodes.ACTION_CI_FIXUP);
                }
                case POLICY -> {
                    judgement.match(VerdictDecision.RETRY, ReasonCodes.POLICY_GATE_FAILED);
                    judgement.actions.add(ReasonCodes.ACTION_POLICY_FIXUP);
                }
                case HYGIENE -> {
                    judgement.match(VerdictDecision.RETRY, ReasonCodes.HYGIENE_FAILED);
                    judgement.actions.add(ReasonCodes.ACTION_HYGIENE_FIXUP);
                }
            }
        }
    }

    private void checkScopeAndTools(JudgeRequest request, Submission submission,
                                    Optional<RoleCapabilities> caps, Judgement judgement) {
        if (request.scope() != null) {
            for (PinsDecision denied : pinsResolver.denied(submission.touchedFiles(), request.scope())) {
                log.info("Task {} touched {} outside its scope ({})", request.taskId(), denied.path(),
                        denied.reason());
                judgement.match(VerdictDecision.ESCALATE, ReasonCodes.SCOPE_CONFLICT);
                judgement.actions.add(ReasonCodes.ACTION_OPERATOR_REVIEW);
            }
        }
        if (caps.isEmpty()) {
            judgement.match(VerdictDecision.ESCALATE, ReasonCodes.ROLE_POLICY_VIOLATION);
            return;
        }
        for (String tool : submission.toolsUsed()) {
            if (!rolePolicyEngine.isToolAllowed(caps.get(), tool)) {
                log.info("Task {} used tool '{}' not allowed for role {}", request.taskId(), tool,
                        caps.get().role());
                judgement.match(VerdictDecision.ESCALATE, ReasonCodes.ROLE_POLICY_VIOLATION);
                judgement.actions.add(ReasonCodes.ACTION_OPERATOR_REVIEW);
            }
        }
    }

    private void checkOutcome(Submission submission, Integer processExitCode, Optional<RoleCapabilities> caps,
                              Judgement judgement) {
        boolean testsRequired = caps.map(RoleCapabilities::testsRequired).orElse(true);
        boolean exitClean = (submission.exitCode() == null || submission.exitCode() == 0)
                && (processExitCode == null || processExitCode == 0);
        boolean testsOk = submission.testsRan() ? submission.allTestsPassed() : !testsRequired;

        if (submission.status() == SubmissionStatus.DONE && exitClean && testsOk) {
            if (judgement.decision == null) {
                judgement.decision = VerdictDecision.DONE;
            }
            return;
        }
        if (submission.status() == SubmissionStatus.FAILED) {
            judgement.match(VerdictDecision.RETRY, ReasonCodes.SUBMIT_FAILED);
        }
        if (!exitClean) {
            judgement.match(VerdictDecision.RETRY, ReasonCodes.EXIT_CODE_NONZERO);
        }
        if (submission.testsRan() && !submission.allTestsPassed()) {
            judgement.match(VerdictDecision.RETRY, ReasonCodes.CI_FAILED);
            judgement.actions.add(ReasonCodes.ACTION_CI_FIXUP);
        } else if (!submission.testsRan() && testsRequired) {
            judgement.match(VerdictDecision.RETRY, ReasonCodes.TESTS_MISSING);
        }
    }

    private Optional<RoleCapabilities> findRole(String role) {
        if (role == null || !rolePolicyEngine.isKnownRole(role)) {
            return Optional.empty();
        }
        return Optional.of(rolePolicyEngine.capabilitiesFor(role));
    }

    private Verdict finish(JudgeRequest request, Judgement judgement) {
        VerdictDecision decision = judgement.decision == null ? VerdictDecision.RETRY : judgement.decision;
        var verdict = new Verdict(decision, new ArrayList<>(judgement.reasons),
                new ArrayList<>(judgement.actions), clock.instant());
        log.debug("Verdict for {}: {} {}", request.taskId(), verdict.decision(), verdict.reasons());
        return verdict;
    }
}
