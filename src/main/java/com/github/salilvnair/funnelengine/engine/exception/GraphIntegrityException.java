package com.github.salilvnair.funnelengine.engine.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a funnel graph is refused at load time. Carries every violation found,
 * not just the first one.
 */
@Getter
public class GraphIntegrityException extends FunnelEngineException {

    private final List<String> violations;

    public GraphIntegrityException(List<String> violations) {
        super(FunnelEngineErrorCode.GRAPH_INTEGRITY_VIOLATION,
                "Funnel graph integrity validation failed. Violations: " + String.join(" | ", violations));
        this.violations = List.copyOf(violations);
    }

    public GraphIntegrityException(String violation, Throwable cause) {
        super(FunnelEngineErrorCode.GRAPH_DOCUMENT_UNREADABLE, violation, cause);
        this.violations = List.of(violation);
    }
}
