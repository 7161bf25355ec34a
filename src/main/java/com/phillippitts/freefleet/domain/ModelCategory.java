package com.phillippitts.freefleet.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Functional categories a free model can serve.
 *
 * <p>Each category carries the keyword rule used to place a model in it (matched
 * case-insensitively against the model id) and the curated "elite family" keywords used
 * for ranking. {@link #WRITING} has no keyword rule; it only receives models that matched
 * no other category.
 */
public enum ModelCategory {

    CODING("coding",
            List.of("coder", "code", "function"),
            List.of("qwen-2.5-coder", "qwen3-coder", "deepseek-coder", "deepseek-v3",
                    "llama-3.3-70b", "llama-3.3", "codestral", "starcoder")),

    REASONING("reasoning",
            List.of("r1", "reasoning", "cot", "qwq"),
            List.of("deepseek-r1", "deepseek-reasoner", "qwq", "qwq-32b",
                    "o1-open", "o3-mini", "reasoning", "r1")),

    SPEED("speed",
            List.of("flash", "distill", "nano", "lite"),
            List.of("mistral-small", "haiku", "flash", "gemma-2", "gemma-3",
                    "distill", "nano", "lite")),

    MULTIMODAL("multimodal",
            List.of("vl", "vision", "molmo"),
            List.of("vl", "vision", "molmo", "nemotron-vl", "pixtral", "qwen-vl")),

    WRITING("writing",
            List.of(),
            List.of("trinity", "qwen-next", "chimera", "writer"));

    private final String key;
    private final List<String> keywords;
    private final List<String> eliteFamilies;

    ModelCategory(String key, List<String> keywords, List<String> eliteFamilies) {
        this.key = key;
        this.keywords = keywords;
        this.eliteFamilies = eliteFamilies;
    }

    public String key() {
        return key;
    }

    public List<String> eliteFamilies() {
        return eliteFamilies;
    }

    /** True when the model id contains one of this category's keywords. */
    public boolean matches(String modelId) {
        String id = modelId.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(id::contains);
    }

    /** True when the model id belongs to one of this category's elite families. */
    public boolean isEliteFamily(String modelId) {
        String id = modelId.toLowerCase(Locale.ROOT);
        return eliteFamilies.stream().anyMatch(p -> id.contains(p.toLowerCase(Locale.ROOT)));
    }

    /**
     * First category whose keyword rule matches, checked in the order
     * coding, reasoning, speed, multimodal; writing otherwise.
     */
    public static ModelCategory primaryFor(String modelId) {
        for (ModelCategory category : values()) {
            if (category != WRITING && category.matches(modelId)) {
                return category;
            }
        }
        return WRITING;
    }

    /** Every category the model id matches; {@code [WRITING]} when none does. */
    public static List<ModelCategory> allFor(String modelId) {
        List<ModelCategory> matched = Arrays.stream(values())
                .filter(c -> c != WRITING && c.matches(modelId))
                .toList();
        return matched.isEmpty() ? List.of(WRITING) : matched;
    }

    public static ModelCategory fromKey(String key) {
        for (ModelCategory category : values()) {
            if (category.key.equalsIgnoreCase(key) || category.name().equalsIgnoreCase(key)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown model category: " + key);
    }
}
