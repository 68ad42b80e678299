package com.dgw.resolver.ranking;

public class UnknownProfileException extends RuntimeException {
    private final String profileName;

    public UnknownProfileException(String profileName) {
        super("unknown profile: " + profileName);
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
