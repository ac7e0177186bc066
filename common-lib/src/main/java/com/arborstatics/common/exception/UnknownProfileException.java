package com.arborstatics.common.exception;

/**
 * Raised when a species or wind profile id is not in its catalogue.
 */
public class UnknownProfileException extends ArborStaticsException {
    private final String profileId;

    public UnknownProfileException(String catalogue, String profileId) {
        super(catalogue, "No profile with id '" + profileId + "'");
        this.profileId = profileId;
    }

    public String getProfileId() {
        return profileId;
    }
}
