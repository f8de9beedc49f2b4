package com.example.framegen_backend.service;

import com.example.framegen_backend.engine.Interfaces.RasterizerFactory;
import com.example.framegen_backend.template.FrameTemplate;
import com.example.framegen_backend.util.ImageReferenceNormalizer;
import com.example.framegen_backend.util.TemplateSizeResolver;
import org.springframework.lang.Nullable;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.concurrent.Executor;

/**
 * Creates generators for template keys. Each generator owns its own browser session, so callers
 * that render concurrently should hold one generator each.
 *
 * <p>Keys and output paths handed to this factory come from request payloads: templates must live
 * below the template roots and frames are only written below the output directory.
 */
public class FrameGeneratorFactory {
    private final TemplatePathResolver pathResolver;
    private final TemplateSizeResolver sizeResolver;
    private final RasterizerFactory rasterizerFactory;
    private final ImageReferenceNormalizer imageNormalizer;
    private final Path outputDir;
    private final Executor executor;

    public FrameGeneratorFactory(TemplatePathResolver pathResolver,
                                 TemplateSizeResolver sizeResolver,
                                 RasterizerFactory rasterizerFactory,
                                 ImageReferenceNormalizer imageNormalizer,
                                 Path outputDir,
                                 Executor executor) {
        this.pathResolver = pathResolver;
        this.sizeResolver = sizeResolver;
        this.rasterizerFactory = rasterizerFactory;
        this.imageNormalizer = imageNormalizer;
        this.outputDir = outputDir.toAbsolutePath().normalize();
        this.executor = executor;
    }

    public FrameTemplate loadTemplate(String templateKey) {
        return FrameTemplate.load(pathResolver.resolveWithinRoots(templateKey), sizeResolver);
    }

    /**
     * @param requested destination from a request; relative values are taken from the output directory
     * @return the normalized destination, or null when none was requested
     * @throws IllegalArgumentException when the destination is not below the output directory
     */
    public @Nullable Path confineOutputPath(@Nullable String requested) {
        if (requested == null || requested.isBlank()) {
            return null;
        }
        Path destination;
        try {
            destination = outputDir.resolve(requested).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid output path: " + requested, e);
        }
        if (!destination.startsWith(outputDir) || destination.equals(outputDir)) {
            throw new IllegalArgumentException("Output path must be below " + outputDir + ": " + requested);
        }
        return destination;
    }

    public HtmlFrameGenerator create(String templateKey) {
        return new HtmlFrameGenerator(loadTemplate(templateKey), rasterizerFactory, imageNormalizer, outputDir, executor);
    }

    public Path outputDir() {
        return outputDir;
    }

    public TemplatePathResolver pathResolver() {
        return pathResolver;
    }
}
