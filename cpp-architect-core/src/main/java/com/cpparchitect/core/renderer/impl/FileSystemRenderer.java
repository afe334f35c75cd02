package com.cpparchitect.core.renderer.impl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cpparchitect.core.renderer.GeneratedFile;
import com.cpparchitect.core.renderer.GeneratedOutput;
import com.cpparchitect.core.renderer.OutputRenderer;
import com.cpparchitect.core.renderer.RenderContext;

/**
 * Writes generated diagrams below the output directory as UTF-8 files.
 *
 * <p>Creates the directory structure automatically. Paths must stay inside the output
 * directory.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.of(diagram)));
 * new FileSystemRenderer().render(output, RenderContext.of("./diagrams"));
 * // Creates: ./diagrams/call_graph.puml
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public int render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory().toAbsolutePath().normalize();
        log.info("Rendering {} files to filesystem at: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        int written = 0;
        for (GeneratedFile file : output.files()) {
            if (writeFile(outputDir, file, context.overwrite())) {
                written++;
            }
        }
        log.info("Wrote {} of {} files ({} fallback diagrams)", written, output.files().size(), output.fallbackCount());
        return written;
    }

    private boolean writeFile(Path outputDir, GeneratedFile file, boolean overwrite) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalArgumentException("File path escapes output directory: " + file.relativePath());
        }
        if (!overwrite && Files.exists(targetPath)) {
            log.debug("Keeping existing file: {}", targetPath);
            return false;
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
