package com.stg2va.core.renderer.impl;

import com.stg2va.core.generator.GeneratedModel;
import com.stg2va.core.renderer.OutputRenderer;
import com.stg2va.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Renderer that writes the generated model to a file.
 *
 * <p>The content goes to a temporary file next to the target which is then moved over the
 * target, so readers never observe a half-written model. Existing files are overwritten.
 *
 * <p><b>Configuration:</b>
 * <ul>
 *   <li>{@code outputPath} - Target file (from RenderContext). Without it the model is written to
 *       {@link GeneratedModel#fileName()} in the directory given by the {@code output.directory}
 *       setting, default the working directory.</li>
 * </ul>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String OUTPUT_DIRECTORY_SETTING = "output.directory";

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedModel model, RenderContext context) {
        Path target = resolveTarget(model, context);
        logger.debug("Writing {} to: {}", model.fileName(), target);

        Path tmp = null;
        try {
            Path parentDir = target.toAbsolutePath().getParent();
            Files.createDirectories(parentDir);
            tmp = Files.createTempFile(parentDir, ".stg2va-", ".tmp");
            Files.writeString(tmp, model.content(), StandardCharsets.UTF_8);
            move(tmp, target);
            logger.info("Wrote file: {} ({} bytes)", target, model.content().length());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    /**
     * Returns the file a model is written to.
     *
     * @param model generated model
     * @param context rendering context
     * @return target path
     */
    public Path resolveTarget(GeneratedModel model, RenderContext context) {
        if (context.outputPath() != null) {
            return Paths.get(context.outputPath());
        }
        return Paths.get(context.getSettingOrDefault(OUTPUT_DIRECTORY_SETTING, ".")).resolve(model.fileName());
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
