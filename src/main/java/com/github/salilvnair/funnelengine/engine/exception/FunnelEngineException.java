package com.github.salilvnair.funnelengine.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class FunnelEngineException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public FunnelEngineException(FunnelEngineErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FunnelEngineException(FunnelEngineErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FunnelEngineException(FunnelEngineErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public FunnelEngineException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean is(FunnelEngineErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}
