package com.dgw.resolver.service;

public class ResolutionFailedException extends RuntimeException {
    private final String slotKey;

    public ResolutionFailedException(String slotKey, Throwable cause) {
        super("resolution failed for " + slotKey + ": " + cause.getMessage(), cause);
        this.slotKey = slotKey;
    }

    public String getSlotKey() {
        return slotKey;
    }
}
