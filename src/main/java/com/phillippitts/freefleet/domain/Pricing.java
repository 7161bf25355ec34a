package com.phillippitts.freefleet.domain;

import org.json.JSONObject;

/**
 * Prompt/completion/request cost markers exactly as a provider reports them.
 *
 * <p>Providers report "0", "0.0", a decimal string, or nothing at all, so the values are
 * kept as strings. A missing field is stored as {@code null} and reads as "0" through
 * the accessors used for display and persistence.
 */
public record Pricing(String prompt, String completion, String request) {

    public static final Pricing FREE = new Pricing("0", "0", "0");
    public static final Pricing UNREPORTED = new Pricing(null, null, null);

    public boolean isReported() {
        return prompt != null || completion != null || request != null;
    }

    public boolean isFreePrompt() {
        return isZero(prompt);
    }

    public boolean isFreeCompletion() {
        return isZero(completion);
    }

    /** Both prompt and completion explicitly priced at zero. */
    public boolean isFullyFree() {
        return isFreePrompt() && isFreeCompletion();
    }

    /** Replaces missing markers with "0". */
    public Pricing orZero() {
        return new Pricing(valueOrZero(prompt), valueOrZero(completion), valueOrZero(request));
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("prompt", valueOrZero(prompt))
                .put("completion", valueOrZero(completion))
                .put("request", valueOrZero(request));
    }

    public static Pricing fromJson(JSONObject obj) {
        if (obj == null) {
            return UNREPORTED;
        }
        return new Pricing(optString(obj, "prompt"), optString(obj, "completion"), optString(obj, "request"));
    }

    static boolean isZero(String value) {
        return "0".equals(value) || "0.0".equals(value);
    }

    private static String valueOrZero(String value) {
        return value == null ? "0" : value;
    }

    private static String optString(JSONObject obj, String key) {
        if (!obj.has(key) || obj.isNull(key)) {
            return null;
        }
        // Some catalogs send numbers instead of strings
        return String.valueOf(obj.get(key));
    }
}
