package com.stg2va.core.renderer;

import java.util.Map;

/**
 * Context provided to renderers during execution.
 *
 * @param outputPath target file; {@code null} lets the renderer derive one from the model name
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputPath,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        if (settings == null) {
            settings = Map.of();
        }
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
