package com.example.framegen_backend.template;

import com.example.framegen_backend.dto.FrameSize;
import com.example.framegen_backend.exception.TemplateNotFoundException;
import com.example.framegen_backend.util.TemplateSizeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * HTML template loaded once from disk, with the frame size taken from its location.
 */
public final class FrameTemplate {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameTemplate.class);

    private final Path sourcePath;
    private final String body;
    private final FrameSize size;

    public FrameTemplate(Path sourcePath, String body, FrameSize size) {
        this.sourcePath = sourcePath;
        this.body = body;
        this.size = size;
    }

    public static FrameTemplate load(Path templatePath, TemplateSizeResolver sizeResolver) {
        if (templatePath == null || !Files.isRegularFile(templatePath)) {
            throw new TemplateNotFoundException("Template not found: " + templatePath);
        }
        String content;
        try {
            content = Files.readString(templatePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read template " + templatePath, e);
        }
        FrameSize size = sizeResolver.resolve(templatePath.toString());
        LOGGER.debug("Loaded HTML template: {} ({} chars, size: {})", templatePath, content.length(), size);
        return new FrameTemplate(templatePath, content, size);
    }

    /** Declared parameters in order of first occurrence, reserved names excluded. */
    public Map<String, ParamDeclaration> parameters() {
        return PlaceholderParser.parse(body);
    }

    public String render(Map<String, ?> context) {
        return PlaceholderSubstitutor.substitute(body, context);
    }

    public Path sourcePath() {
        return sourcePath;
    }

    public String body() {
        return body;
    }

    public FrameSize size() {
        return size;
    }

    public int width() {
        return size.width();
    }

    public int height() {
        return size.height();
    }
}
