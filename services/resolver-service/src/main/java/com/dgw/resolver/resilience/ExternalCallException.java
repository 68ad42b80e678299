package com.dgw.resolver.resilience;

public class ExternalCallException extends RuntimeException {
    private final String callName;
    private final Integer status;

    public ExternalCallException(String callName, String message, Integer status, Throwable cause) {
        super(callName + ": " + message, cause);
        this.callName = callName;
        this.status = status;
    }

    public ExternalCallException(String callName, String message) {
        this(callName, message, null, null);
    }

    public String getCallName() {
        return callName;
    }

    public Integer getStatus() {
        return status;
    }
}
