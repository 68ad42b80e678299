package com.dgw.resolver.service;

public class HandleNotFoundException extends RuntimeException {
    public HandleNotFoundException(String handleId, int offset) {
        super("no release at " + handleId + "/" + offset);
    }
}
