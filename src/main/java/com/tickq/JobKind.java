package com.tickq;

/**
 * Distinguishes the two executable entity types.
 */
public enum JobKind {
    TIME,
    CRON
}
