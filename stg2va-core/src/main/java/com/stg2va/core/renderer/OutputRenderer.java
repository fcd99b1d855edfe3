package com.stg2va.core.renderer;

import com.stg2va.core.generator.GeneratedModel;

/**
 * Writes a generated model to its destination.
 *
 * <p>Renderers only run after every compilation stage succeeded, so a failed compilation never
 * leaves an artifact behind.
 *
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. {@code "filesystem"}.
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated model.
     *
     * <p>Implementations throw {@link IllegalStateException} if the destination cannot be written.
     *
     * @param model generated text
     * @param context rendering context with target and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedModel model, RenderContext context);
}
