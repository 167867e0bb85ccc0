package com.fleet.moderation.tracing;

/**
 * Attribute keys set on fleet spans.
 */
public final class SpanAttributes {

    public static final String TARGET_ID = "fleet.target_id";
    public static final String ACTION = "fleet.action";
    public static final String SCOPE_COUNT = "fleet.scope_count";
    public static final String CANDIDATE_COUNT = "fleet.candidate_count";
    public static final String SUCCEEDED = "fleet.succeeded";
    public static final String FAILED = "fleet.failed";
    public static final String FOUND = "fleet.found";

    private SpanAttributes() {
    }
}
