package org.hastats.migrations.pipeline.ir;

/** Diagnostic code for why an entity was not accepted. */
public enum RejectionReason {
    DOMAIN("domain"),
    TIMESTAMP_ONLY("timestamp_only"),
    STATUS_PATTERN("status_pattern"),
    NO_MATCHING_UNIT("no_matching_unit");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
