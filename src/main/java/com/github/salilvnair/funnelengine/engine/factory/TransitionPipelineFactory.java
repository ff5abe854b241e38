package com.github.salilvnair.funnelengine.engine.factory;

import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineErrorCode;
import com.github.salilvnair.funnelengine.engine.exception.FunnelEngineException;
import com.github.salilvnair.funnelengine.engine.pipeline.StepResult;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionPipeline;
import com.github.salilvnair.funnelengine.engine.pipeline.TransitionStep;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunAfter;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.MustRunBefore;
import com.github.salilvnair.funnelengine.engine.pipeline.annotation.TerminalStep;
import com.github.salilvnair.funnelengine.engine.session.TransitionSession;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@RequiredArgsConstructor
@Component
public class TransitionPipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(TransitionPipelineFactory.class);

    private final List<TransitionStep> discoveredSteps;

    private TransitionPipeline pipeline;
    private List<Class<?>> orderedStepClasses = List.of();

    // ---------------------------------------------------------------------
    // Init
    // ---------------------------------------------------------------------
    @PostConstruct
    public void init() {
        List<TransitionStep> ordered = orderByDag(discoveredSteps);
        debugPrint(ordered);
        this.orderedStepClasses = ordered.stream().<Class<?>>map(Object::getClass).toList();
        this.pipeline = new TransitionPipeline(wrapWithTiming(ordered));
    }

    public TransitionPipeline create() {
        if (pipeline == null) {
            init();
        }
        return pipeline;
    }

    public List<Class<?>> orderedStepClasses() {
        return orderedStepClasses;
    }

    // ---------------------------------------------------------------------
    // DAG ordering using annotations
    // ---------------------------------------------------------------------
    private List<TransitionStep> orderByDag(List<TransitionStep> steps) {

        Map<Class<?>, TransitionStep> stepByClass = new HashMap<>();
        for (TransitionStep s : steps) {
            if (stepByClass.put(s.getClass(), s) != null) {
                throw new FunnelEngineException(
                        FunnelEngineErrorCode.DUPLICATE_TRANSITION_STEP,
                        "Duplicate TransitionStep bean for class: " + s.getClass().getName()
                );
            }
        }

        // exactly one terminal step
        List<Class<?>> terminalSteps = stepByClass.keySet().stream()
                .filter(c -> c.getAnnotation(TerminalStep.class) != null)
                .toList();

        if (terminalSteps.size() != 1) {
            throw new FunnelEngineException(
                    FunnelEngineErrorCode.PIPELINE_CONSTRAINT_VIOLATION,
                    "Exactly ONE @TerminalStep required, found: " +
                            terminalSteps.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(", "))
            );
        }

        Class<?> terminal = terminalSteps.get(0);

        Map<Class<?>, Set<Class<?>>> outgoing = new HashMap<>();
        Map<Class<?>, Set<Class<?>>> incoming = new HashMap<>();

        for (Class<?> c : stepByClass.keySet()) {
            outgoing.put(c, new LinkedHashSet<>());
            incoming.put(c, new LinkedHashSet<>());
        }

        for (Class<?> c : stepByClass.keySet()) {
            MustRunBefore before = c.getAnnotation(MustRunBefore.class);
            if (before != null) {
                for (Class<? extends TransitionStep> b : before.value()) {
                    requirePresent(stepByClass, c, b);
                    addEdge(outgoing, incoming, c, b);
                }
            }
        }

        // A must run after B => B -> A
        for (Class<?> c : stepByClass.keySet()) {
            MustRunAfter after = c.getAnnotation(MustRunAfter.class);
            if (after != null) {
                for (Class<? extends TransitionStep> a : after.value()) {
                    requirePresent(stepByClass, c, a);
                    addEdge(outgoing, incoming, a, c);
                }
            }
        }

        for (Class<?> c : stepByClass.keySet()) {
            if (!c.equals(terminal)) {
                addEdge(outgoing, incoming, c, terminal);
            }
        }

        List<Class<?>> sorted = topoSort(stepByClass.keySet(), outgoing, incoming);

        return sorted.stream().map(stepByClass::get).toList();
    }

    private void requirePresent(Map<Class<?>, TransitionStep> stepByClass,
                                Class<?> owner,
                                Class<?> dep) {
        if (!stepByClass.containsKey(dep)) {
            throw new FunnelEngineException(
                    FunnelEngineErrorCode.PIPELINE_CONSTRAINT_VIOLATION,
                    owner.getSimpleName() + " depends on missing step: " + dep.getName()
            );
        }
    }

    private void addEdge(Map<Class<?>, Set<Class<?>>> outgoing,
                         Map<Class<?>, Set<Class<?>>> incoming,
                         Class<?> from,
                         Class<?> to) {
        if (from.equals(to)) return;
        if (outgoing.get(from).add(to)) {
            incoming.get(to).add(from);
        }
    }

    private List<Class<?>> topoSort(Set<Class<?>> nodes,
                                    Map<Class<?>, Set<Class<?>>> outgoing,
                                    Map<Class<?>, Set<Class<?>>> incoming) {

        Map<Class<?>, Integer> indegree = new HashMap<>();
        for (Class<?> n : nodes) {
            indegree.put(n, incoming.get(n).size());
        }

        PriorityQueue<Class<?>> q =
                new PriorityQueue<>(Comparator.comparing(Class::getName));

        indegree.forEach((k, v) -> {
            if (v == 0) q.add(k);
        });

        List<Class<?>> result = new ArrayList<>();

        while (!q.isEmpty()) {
            Class<?> n = q.poll();
            result.add(n);

            for (Class<?> m : outgoing.get(n)) {
                indegree.put(m, indegree.get(m) - 1);
                if (indegree.get(m) == 0) q.add(m);
            }
        }

        if (result.size() != nodes.size()) {
            Set<Class<?>> remaining = new LinkedHashSet<>(nodes);
            result.forEach(remaining::remove);
            throw new FunnelEngineException(
                    FunnelEngineErrorCode.PIPELINE_CONSTRAINT_VIOLATION,
                    "TransitionStep DAG cycle or unsatisfied constraints: " +
                            remaining.stream()
                                    .map(Class::getSimpleName)
                                    .collect(Collectors.joining(" -> "))
            );
        }

        return result;
    }

    private void debugPrint(List<TransitionStep> ordered) {
        log.info(
                "FunnelEngine transition pipeline order: {}",
                ordered.stream()
                        .map(s -> s.getClass().getSimpleName())
                        .collect(Collectors.joining(" -> "))
        );
    }

    // ---------------------------------------------------------------------
    // Timing wrapper
    // ---------------------------------------------------------------------
    private List<TransitionStep> wrapWithTiming(List<TransitionStep> steps) {
        return steps.stream().<TransitionStep>map(TimingTransitionStep::new).toList();
    }

    private static final class TimingTransitionStep implements TransitionStep {

        private final TransitionStep delegate;

        private TimingTransitionStep(TransitionStep delegate) {
            this.delegate = delegate;
        }

        @Override
        public StepResult execute(TransitionSession session) {
            long start = System.nanoTime();
            String stepName = delegate.getClass().getSimpleName();
            try {
                StepResult r = delegate.execute(session);
                if (log.isDebugEnabled()) {
                    log.debug("Step {} convId={} outcome={} took {}us",
                            stepName,
                            session.getConversationId(),
                            r.getClass().getSimpleName(),
                            (System.nanoTime() - start) / 1_000);
                }
                return r;
            }
            catch (RuntimeException e) {
                log.warn("Step {} failed convId={} after {}us: {}",
                        stepName,
                        session.getConversationId(),
                        (System.nanoTime() - start) / 1_000,
                        e.getMessage());
                throw e;
            }
        }
    }
}
