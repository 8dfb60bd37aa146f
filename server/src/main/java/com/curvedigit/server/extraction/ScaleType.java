package com.curvedigit.server.extraction;

public enum ScaleType {
    LINEAR,
    LOG;

    /**
     * Lenient parse used for request parameters and config values; null or blank means linear.
     */
    public static ScaleType parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            return LINEAR;
        }
        switch (value.trim().toLowerCase()) {
            case "linear":
                return LINEAR;
            case "log":
            case "logarithmic":
                return LOG;
            default:
                throw new IllegalArgumentException("Unknown scale type: " + value);
        }
    }
}
