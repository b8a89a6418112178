package com.openintake.forms.core.engine.config;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Models offered per vendor in the model picker.
 * <p>
 * A vendor with an empty model list takes a free text model. {@link #CUSTOM_MODEL} is
 * accepted for every vendor.
 */
@ToString
@EqualsAndHashCode
public final class VendorModelCatalog {

    public static final String CUSTOM_MODEL = "Custom";

    private final Map<String, List<String>> modelsByVendor;

    private VendorModelCatalog(Map<String, List<String>> modelsByVendor) {
        this.modelsByVendor = Collections.unmodifiableMap(modelsByVendor);
    }

    public static VendorModelCatalog of(Map<String, List<String>> modelsByVendor) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        modelsByVendor.forEach((vendor, models) -> copy.put(vendor, List.copyOf(models)));
        return new VendorModelCatalog(copy);
    }

    public static VendorModelCatalog defaultCatalog() {
        Map<String, List<String>> catalog = new LinkedHashMap<>();
        catalog.put("OpenAI", List.of("GPT-4", "GPT-4 Turbo", "GPT-3.5-turbo", "GPT-4o"));
        catalog.put("Anthropic", List.of("Claude-3-Opus", "Claude-3-Sonnet", "Claude-3-Haiku"));
        catalog.put("Google", List.of("Gemini-Pro", "Gemini-Ultra", "Gemini-1.5-Pro"));
        catalog.put("Microsoft", List.of("Azure OpenAI"));
        catalog.put("Meta", List.of("Llama-3", "Llama-2"));
        catalog.put("Amazon", List.of("Bedrock"));
        catalog.put("Cohere", List.of("Command"));
        catalog.put("Mistral AI", List.of("Mistral Large"));
        catalog.put("Customer Choice", List.of());
        catalog.put("Other", List.of());
        return new VendorModelCatalog(catalog);
    }

    public List<String> getVendors() {
        return List.copyOf(modelsByVendor.keySet());
    }

    public List<String> modelsFor(String vendor) {
        if (vendor == null) {
            return Collections.emptyList();
        }
        return modelsByVendor.getOrDefault(vendor, Collections.emptyList());
    }

    /**
     * Whether a previously chosen model may stay selected after switching to the vendor.
     */
    public boolean isModelValidFor(String vendor, String model) {
        if (model == null || model.isEmpty()) {
            return false;
        }
        return CUSTOM_MODEL.equals(model) || modelsFor(vendor).contains(model);
    }
}
