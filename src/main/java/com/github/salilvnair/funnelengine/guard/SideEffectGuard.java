package com.github.salilvnair.funnelengine.guard;

import com.github.salilvnair.funnelengine.action.ActionResult;
import com.github.salilvnair.funnelengine.action.OneTimeAction;
import com.github.salilvnair.funnelengine.audit.AuditService;
import com.github.salilvnair.funnelengine.audit.FunnelAuditStage;
import com.github.salilvnair.funnelengine.config.FunnelEngineConfig;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.model.SideEffectRequest;
import com.github.salilvnair.funnelengine.entity.FeConversation;
import com.github.salilvnair.funnelengine.spi.ConversationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Claim-then-act runner for {@link OneTimeAction}s. The claim is the store's conditional
 * update on {@code oneTimeActionClaimed}; the action only runs for the caller that flipped it.
 * A failed action releases the claim, a successful one is never undone.
 * <p>
 * An action still running when the timeout hits is interrupted but keeps the claim until it
 * returns: a late success is recorded as fired, a late failure releases the claim then.
 */
@Slf4j
@Component
public class SideEffectGuard {

    public static final String ACTION_EXECUTOR_BEAN = "funnelEngineActionExecutor";

    private final ConversationStore conversationStore;
    private final Map<String, OneTimeAction> actions = new LinkedHashMap<>();
    private final ExecutorService actionExecutor;
    private final FunnelEngineConfig config;
    private final AuditService audit;
    private final Clock clock;

    public SideEffectGuard(ConversationStore conversationStore,
                           List<OneTimeAction> actions,
                           @Qualifier(ACTION_EXECUTOR_BEAN) ExecutorService actionExecutor,
                           FunnelEngineConfig config,
                           AuditService audit,
                           Clock clock) {
        this.conversationStore = conversationStore;
        actions.forEach(a -> this.actions.put(a.key(), a));
        this.actionExecutor = actionExecutor;
        this.config = config;
        this.audit = audit;
        this.clock = clock;
    }

    public GuardResult runOnce(SideEffectRequest request) {
        UUID conversationId = request.conversationId();
        OneTimeAction action = actions.get(request.actionKey());
        if (action == null) {
            throw new FunnelEngineException(FunnelEngineErrorCode.ACTION_NOT_REGISTERED,
                    "No one-time action registered for key " + request.actionKey());
        }

        if (!conversationStore.claimOneTimeAction(conversationId, now())) {
            log.warn("One-time action {} already claimed for convId={}, skipping", action.key(), conversationId);
            auditQuietly(FunnelAuditStage.ACTION_SKIPPED, request, null);
            return new GuardResult(conversationId, action.key(), GuardOutcome.CLAIM_LOST, null);
        }
        auditQuietly(FunnelAuditStage.ACTION_CLAIMED, request, null);

        Optional<FeConversation> conversation = conversationStore.load(conversationId);
        if (conversation.isEmpty()) {
            return release(request, "conversation disappeared after claim");
        }

        ActionAttempt attempt = new ActionAttempt(action, conversation.get(), request);
        Optional<ActionResult> settled = executeWithTimeout(attempt);
        if (settled.isEmpty()) {
            auditQuietly(FunnelAuditStage.ACTION_TIMED_OUT, request, "timed out after " + actionTimeout());
            return new GuardResult(conversationId, action.key(), GuardOutcome.IN_FLIGHT_AFTER_TIMEOUT,
                    "timed out after " + actionTimeout());
        }
        return settle(action, conversation.get(), request, settled.get());
    }

    private GuardResult settle(OneTimeAction action, FeConversation conversation, SideEffectRequest request, ActionResult result) {
        UUID conversationId = request.conversationId();
        if (!result.succeeded()) {
            return release(request, result.receipt().error());
        }

        log.info("One-time action {} fired for convId={}", action.key(), conversationId);
        try {
            action.record(conversation, result);
        }
        catch (RuntimeException e) {
            log.error("Bookkeeping after one-time action {} failed for convId={}; claim is kept",
                    action.key(), conversationId, e);
            auditQuietly(FunnelAuditStage.ACTION_BOOKKEEPING_FAILED, request, e.getMessage());
            return new GuardResult(conversationId, action.key(), GuardOutcome.FIRED_BOOKKEEPING_FAILED, e.getMessage());
        }
        auditQuietly(FunnelAuditStage.ACTION_FIRED, request, null);
        return new GuardResult(conversationId, action.key(), GuardOutcome.FIRED, null);
    }

    /**
     * Runs the attempt on the action executor. Empty means the action was still running at the
     * timeout and will settle itself when it returns.
     */
    private Optional<ActionResult> executeWithTimeout(ActionAttempt attempt) {
        Duration timeout = actionTimeout();
        SideEffectRequest request = attempt.request;
        Future<ActionResult> future = actionExecutor.submit(attempt);
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        catch (TimeoutException e) {
            if (attempt.state.compareAndSet(AttemptState.PENDING, AttemptState.ABANDONED)) {
                future.cancel(false);
                log.warn("One-time action {} never started within {} for convId={}",
                        request.actionKey(), timeout, request.conversationId());
                return Optional.of(ActionResult.failed("timed out after " + timeout + " before starting"));
            }
            if (attempt.state.compareAndSet(AttemptState.RUNNING, AttemptState.TIMED_OUT)) {
                future.cancel(true);
                log.warn("One-time action {} timed out after {} for convId={}; claim held until it returns",
                        request.actionKey(), timeout, request.conversationId());
                return Optional.empty();
            }
            return Optional.of(awaitFinished(future, request));
        }
        catch (ExecutionException e) {
            return Optional.of(failedFrom(e, request));
        }
        catch (InterruptedException e) {
            Optional<ActionResult> outcome;
            if (attempt.state.compareAndSet(AttemptState.PENDING, AttemptState.ABANDONED)) {
                future.cancel(false);
                outcome = Optional.of(ActionResult.failed("interrupted before starting"));
            }
            else if (attempt.state.compareAndSet(AttemptState.RUNNING, AttemptState.TIMED_OUT)) {
                future.cancel(true);
                outcome = Optional.empty();
            }
            else {
                outcome = Optional.of(awaitFinished(future, request));
            }
            Thread.currentThread().interrupt();
            return outcome;
        }
    }

    // The attempt already returned, so this only waits for the result to be published.
    private ActionResult awaitFinished(Future<ActionResult> future, SideEffectRequest request) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                }
                catch (InterruptedException e) {
                    interrupted = true;
                }
                catch (ExecutionException e) {
                    return failedFrom(e, request);
                }
            }
        }
        finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private ActionResult failedFrom(ExecutionException e, SideEffectRequest request) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        log.warn("One-time action {} threw for convId={}: {}",
                request.actionKey(), request.conversationId(), cause.getMessage(), cause);
        return ActionResult.failed(cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }

    private void settleLate(OneTimeAction action, FeConversation conversation, SideEffectRequest request, ActionResult result) {
        // clear the cancel interrupt so the store write is not refused
        Thread.interrupted();
        try {
            GuardResult late = settle(action, conversation, request, result);
            log.info("One-time action {} settled after timeout for convId={}: {}",
                    action.key(), request.conversationId(), late.outcome());
        }
        catch (RuntimeException e) {
            log.error("Settling one-time action {} after timeout failed for convId={}; claim is kept",
                    action.key(), request.conversationId(), e);
        }
    }

    private Duration actionTimeout() {
        return config.getGuard().getActionTimeout();
    }

    private GuardResult release(SideEffectRequest request, String error) {
        UUID conversationId = request.conversationId();
        boolean released = conversationStore.releaseOneTimeAction(conversationId, now());
        if (released) {
            log.warn("One-time action {} failed for convId={} ({}); claim released for retry",
                    request.actionKey(), conversationId, error);
        }
        else {
            log.error("One-time action {} failed for convId={} ({}) and the claim could not be released",
                    request.actionKey(), conversationId, error);
        }
        auditQuietly(FunnelAuditStage.ACTION_RELEASED, request, error);
        return new GuardResult(conversationId, request.actionKey(), GuardOutcome.RELEASED_AFTER_FAILURE, error);
    }

    private void auditQuietly(FunnelAuditStage stage, SideEffectRequest request, String error) {
        try {
            audit.audit(stage, request.conversationId(), payload(request, error));
        }
        catch (RuntimeException e) {
            log.warn("Audit {} failed for convId={}: {}", stage, request.conversationId(), e.getMessage());
        }
    }

    private Map<String, Object> payload(SideEffectRequest request, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("actionKey", request.actionKey());
        payload.put("blockId", request.blockId());
        payload.put("resourceName", request.resourceName());
        if (error != null) {
            payload.put("error", error);
        }
        return payload;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private enum AttemptState { PENDING, RUNNING, FINISHED, TIMED_OUT, ABANDONED }

    private final class ActionAttempt implements Callable<ActionResult> {

        private final AtomicReference<AttemptState> state = new AtomicReference<>(AttemptState.PENDING);
        private final OneTimeAction action;
        private final FeConversation conversation;
        private final SideEffectRequest request;

        private ActionAttempt(OneTimeAction action, FeConversation conversation, SideEffectRequest request) {
            this.action = action;
            this.conversation = conversation;
            this.request = request;
        }

        @Override
        public ActionResult call() {
            if (!state.compareAndSet(AttemptState.PENDING, AttemptState.RUNNING)) {
                return ActionResult.failed("abandoned before start");
            }
            ActionResult result;
            try {
                result = action.execute(conversation, request);
                if (result == null) {
                    result = ActionResult.failed("action returned no result");
                }
            }
            catch (RuntimeException e) {
                log.warn("One-time action {} threw for convId={}: {}",
                        action.key(), request.conversationId(), e.getMessage(), e);
                result = ActionResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            if (!state.compareAndSet(AttemptState.RUNNING, AttemptState.FINISHED)) {
                settleLate(action, conversation, request, result);
            }
            return result;
        }
    }
}
