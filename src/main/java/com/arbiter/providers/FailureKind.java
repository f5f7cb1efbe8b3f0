package com.arbiter.providers;

public enum FailureKind {
    /** Required credential missing. */
    CONFIG,
    /** Deadline elapsed before the backend finished. */
    TIMEOUT,
    /** Stream could not be parsed into any known delta format. */
    PROTOCOL,
    /** Backend reported a failure. */
    BACKEND,
    /** Logical model id not in the catalog. */
    UNKNOWN_MODEL,
    INTERNAL
}
