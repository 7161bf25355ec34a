package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.domain.ModelCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Benchmark ranking within one category.
 *
 * <p>Keys, in order: elite family of the category first; provider priority (lower first,
 * unranked last); parameter count parsed from {@code <n>b} in the id, larger first except
 * smaller first for {@link ModelCategory#SPEED}, skipped when either id has none; id.
 */
public final class ModelRanker {

    static final Map<String, Integer> PROVIDER_PRIORITY = Map.of(
            "openrouter", 1,
            "groq", 2,
            "cerebras", 3,
            "deepseek", 4,
            "google", 5,
            "huggingface", 6,
            "modelscope", 7
    );

    private static final Pattern PARAMS = Pattern.compile("(\\d+)b", Pattern.CASE_INSENSITIVE);

    private ModelRanker() {}

    /**
     * Ranked copy of {@code models}. Equal models keep their input order.
     */
    public static List<FreeModel> rank(List<FreeModel> models, ModelCategory category) {
        Comparator<FreeModel> order = comparator(category);
        // The parameter key is skipped for ids without a count, so the order is not
        // transitive and List.sort could reject it. Insertion sort is stable and accepts it.
        List<FreeModel> ranked = new ArrayList<>(models.size());
        for (FreeModel model : models) {
            int pos = ranked.size();
            while (pos > 0 && order.compare(ranked.get(pos - 1), model) > 0) {
                pos--;
            }
            ranked.add(pos, model);
        }
        return ranked;
    }

    static Comparator<FreeModel> comparator(ModelCategory category) {
        return (a, b) -> {
            boolean aElite = category.isEliteFamily(a.id());
            boolean bElite = category.isEliteFamily(b.id());
            if (aElite != bElite) {
                return aElite ? -1 : 1;
            }

            int byProvider = Integer.compare(providerPriority(a.provider()), providerPriority(b.provider()));
            if (byProvider != 0) {
                return byProvider;
            }

            OptionalInt aParams = parameterCount(a.id());
            OptionalInt bParams = parameterCount(b.id());
            if (aParams.isPresent() && bParams.isPresent() && aParams.getAsInt() != bParams.getAsInt()) {
                int smallerFirst = Integer.compare(aParams.getAsInt(), bParams.getAsInt());
                return category == ModelCategory.SPEED ? smallerFirst : -smallerFirst;
            }

            return a.id().compareTo(b.id());
        };
    }

    static int providerPriority(String providerId) {
        return PROVIDER_PRIORITY.getOrDefault(providerId, Integer.MAX_VALUE);
    }

    /** Billions of parameters named in the id, e.g. 70 for {@code llama-3.3-70b}. */
    static OptionalInt parameterCount(String modelId) {
        Matcher m = PARAMS.matcher(modelId);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
