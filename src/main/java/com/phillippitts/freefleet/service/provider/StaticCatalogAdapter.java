package com.phillippitts.freefleet.service.provider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Adapter backed by a curated list, for providers whose live catalog needs an
 * interactive login. Free when both prompt and completion are priced at zero.
 */
public class StaticCatalogAdapter extends AbstractProviderAdapter<CuratedModel> {

    private static final Logger LOG = LogManager.getLogger(StaticCatalogAdapter.class);

    private final List<CuratedModel> catalog;

    public StaticCatalogAdapter(String providerId, String providerName, List<CuratedModel> catalog) {
        super(providerId, providerName);
        this.catalog = List.copyOf(catalog);
    }

    @Override
    public List<CuratedModel> fetchModels() {
        LOG.debug("{}: serving {} curated models", providerName(), catalog.size());
        return catalog;
    }

    @Override
    public boolean isFreeModel(CuratedModel model) {
        return model.pricing().isFullyFree();
    }

    public static StaticCatalogAdapter google() {
        return new StaticCatalogAdapter("google", "Google", List.of(
                CuratedModel.free("gemini-1.5-flash", "Gemini 1.5 Flash",
                        "Fast, lightweight multimodal model (Free Tier)", 28_000),
                CuratedModel.free("gemini-1.5-flash-8b", "Gemini 1.5 Flash-8B",
                        "Even smaller and faster (Free Tier)", 1_000_000)));
    }

    public static StaticCatalogAdapter modelScope() {
        return new StaticCatalogAdapter("modelscope", "ModelScope", List.of(
                CuratedModel.free("meta-llama/Meta-Llama-3.1-70B-Instruct-Turbo", "Meta Llama 3.1 70B",
                        "Llama 3.1 with 128K context (Free Tier)", 128_000)));
    }

    public static StaticCatalogAdapter huggingFace() {
        return new StaticCatalogAdapter("huggingface", "Hugging Face", List.of(
                CuratedModel.free("Qwen/Qwen2.5-72B-Instruct", "Qwen 2.5 72B",
                        "Qwen 2.5 with 128K context (Serverless Free)", 128_000)));
    }
}
