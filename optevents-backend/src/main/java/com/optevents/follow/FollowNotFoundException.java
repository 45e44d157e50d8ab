package com.optevents.follow;

/**
 * Thrown when a follow id is unknown or already cleaned up.
 */
public class FollowNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param followId follow id
     */
    public FollowNotFoundException(String followId) {
        super("Follow not found: " + followId);
    }
}
