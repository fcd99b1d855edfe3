package com.stg2va.core.renderer.impl;

import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.renderer.OutputRenderer;
import com.stg2va.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Renderer that prints the generated model to the console.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - Print a comment line naming the file before the content
 *       ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private final PrintWriter out;

    public ConsoleRenderer() {
        this(new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    public ConsoleRenderer(PrintWriter out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedModel model, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "false"));
        logger.debug("Rendering {} to console", model.fileName());

        if (showHeaders) {
            out.println("// File: " + model.fileName() + " (" + model.content().length() + " bytes)");
        }
        out.print(model.content());
        out.flush();
    }
}
