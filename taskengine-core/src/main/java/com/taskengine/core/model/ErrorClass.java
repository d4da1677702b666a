package com.taskengine.core.model;

/**
 * Classification of a task failure.
 */
public enum ErrorClass {
    /**
     * Network, timeout or downstream outage. Expected to resolve on its own;
     * eligible for retry and for dead-letter re-review.
     */
    TRANSIENT,

    /**
     * Malformed payload, missing configuration, policy rejection. Never retried.
     */
    PERMANENT
}
