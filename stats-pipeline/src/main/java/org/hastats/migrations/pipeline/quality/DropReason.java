package org.hastats.migrations.pipeline.quality;

public enum DropReason {
    MISSING_VALUE("missing_value"),
    NON_FINITE("non_finite"),
    SENTINEL("sentinel"),
    OUT_OF_RANGE("out_of_range");

    private final String code;

    DropReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
