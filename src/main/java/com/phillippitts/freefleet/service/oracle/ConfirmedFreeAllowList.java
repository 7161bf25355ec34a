package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.config.properties.OracleProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Curated set of fully-qualified model ids known to be free.
 *
 * <p>Seeded with a built-in list plus {@code fleet.oracle.additional-free-models}, and
 * extended at runtime by the community allow-list. Entries are matched exactly.
 */
@Component
public class ConfirmedFreeAllowList {

    static final List<String> BUILT_IN = List.of(
            // OpenRouter, verified through pricing
            "openrouter/qwen/qwen3-coder:free",
            "openrouter/deepseek/deepseek-v3.2",
            "openrouter/deepseek/deepseek-r1-0528:free",
            "openrouter/z-ai/glm-4.5-air:free",
            "openrouter/arcee-ai/trinity-large-preview:free",
            "openrouter/mistralai/mistral-small-3.1-24b-instruct:free",
            "openrouter/mistralai/mistral-tiny:free",
            "openrouter/nvidia/nemotron-3-nano-30b-a3b:free",
            "openrouter/nvidia/nemotron-3-nano-12b-v2-vl:free",
            "openrouter/nvidia/nemotron-3-nano-9b-v2:free",
            "openrouter/google/gemma-3n-e2b-it:free",
            "openrouter/google/gemma-3n-e4b-it:free",
            // DeepSeek
            "deepseek/deepseek-chat",
            "deepseek/deepseek-v3",
            "deepseek/deepseek-r1",
            // Groq
            "groq/llama-3.1-8b-instruct",
            "groq/llama-3.1-70b-versatile-instruct",
            "groq/mixtral-8x7b-instruct",
            // Hugging Face serverless
            "huggingface/Qwen/Qwen2.5-72B-Instruct-Turbo",
            // Google
            "google/gemini-1.5-flash",
            "google/gemini-1.5-flash-8b"
    );

    private final Set<String> models = ConcurrentHashMap.newKeySet();

    @Autowired
    public ConfirmedFreeAllowList(OracleProperties properties) {
        this(properties.getAdditionalFreeModels());
    }

    public ConfirmedFreeAllowList(Collection<String> additional) {
        models.addAll(BUILT_IN);
        if (additional != null) {
            models.addAll(additional);
        }
    }

    /** Empty list, for callers that manage every entry themselves. */
    public static ConfirmedFreeAllowList empty() {
        ConfirmedFreeAllowList list = new ConfirmedFreeAllowList(List.of());
        list.models.clear();
        return list;
    }

    public boolean contains(String modelId) {
        return modelId != null && models.contains(modelId);
    }

    public boolean add(String modelId) {
        return models.add(modelId);
    }

    public boolean remove(String modelId) {
        return models.remove(modelId);
    }

    /**
     * Adds every id not yet present.
     *
     * @return number of ids that were new
     */
    public int addAll(Collection<String> modelIds) {
        int added = 0;
        for (String id : modelIds) {
            if (id != null && !id.isBlank() && models.add(id)) {
                added++;
            }
        }
        return added;
    }

    public Set<String> snapshot() {
        return Collections.unmodifiableSet(new TreeSet<>(models));
    }

    public int size() {
        return models.size();
    }
}
