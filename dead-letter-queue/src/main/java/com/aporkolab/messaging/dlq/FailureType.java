package com.aporkolab.messaging.dlq;

/**
 * Categorizes why a message handling attempt failed.
 */
public enum FailureType {

    /** Broker unreachable, timeout, throttling; expected to clear on its own */
    TRANSIENT,

    /** Bad payload or rejected by validation; retrying cannot help */
    PERMANENT,

    /** JVM-level failure such as running out of memory */
    CRITICAL,

    /** Anything not recognized; retried conservatively */
    UNKNOWN
}
