package com.example.framegen_backend.service;

import com.example.framegen_backend.dto.FrameContext;
import com.example.framegen_backend.dto.RenderedFrame;
import com.example.framegen_backend.engine.Interfaces.FrameRasterizer;
import com.example.framegen_backend.engine.Interfaces.RasterizerFactory;
import com.example.framegen_backend.exception.FrameRenderException;
import com.example.framegen_backend.template.FrameTemplate;
import com.example.framegen_backend.template.ParamDeclaration;
import com.example.framegen_backend.util.ImageReferenceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Renders one HTML template into PNG frames.
 *
 * <p>The browser session is opened on the first render, sized to the template, and reused until
 * {@link #close()}. A generator handles one render at a time; callers serialize concurrent use or
 * create one generator per request.
 */
public class HtmlFrameGenerator implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(HtmlFrameGenerator.class);

    enum State { UNINITIALIZED, READY, DISPOSED }

    private final FrameTemplate template;
    private final RasterizerFactory rasterizerFactory;
    private final ImageReferenceNormalizer imageNormalizer;
    private final Path outputDir;
    private final Executor executor;

    private State state = State.UNINITIALIZED;
    private FrameRasterizer session;

    public HtmlFrameGenerator(FrameTemplate template,
                              RasterizerFactory rasterizerFactory,
                              ImageReferenceNormalizer imageNormalizer,
                              Path outputDir,
                              Executor executor) {
        this.template = template;
        this.rasterizerFactory = rasterizerFactory;
        this.imageNormalizer = imageNormalizer;
        this.outputDir = outputDir.toAbsolutePath().normalize();
        this.executor = executor;
    }

    public Map<String, ParamDeclaration> parseTemplateParameters() {
        return template.parameters();
    }

    /**
     * Builds the final markup for a context without rendering it.
     */
    public String renderMarkup(FrameContext context) {
        String image = imageNormalizer.normalize(context.image());
        return template.render(context.toVariables(image));
    }

    /**
     * Renders a frame.
     *
     * @param context    title, text, image and extension values
     * @param outputPath destination; when null a unique file is created in the output directory
     * @return the written frame with the template's size
     * @throws FrameRenderException when the browser fails, times out or cannot be started
     */
    public RenderedFrame generateFrame(FrameContext context, @Nullable Path outputPath) {
        if (state == State.DISPOSED) {
            throw new IllegalStateException("Generator for " + template.sourcePath() + " is closed");
        }
        String html = renderMarkup(context);
        Path destination = (outputPath != null ? outputPath : outputDir.resolve(newFrameFileName()))
                .toAbsolutePath().normalize();

        LOGGER.debug("Rendering HTML template to {} (size: {})", destination, template.size());
        try {
            Files.createDirectories(destination.getParent());
            FrameRasterizer rasterizer = acquireSession();
            Path produced = rasterizer.screenshot(html, destination.getFileName().toString())
                    .toAbsolutePath().normalize();
            if (!produced.equals(destination) && Files.exists(produced)) {
                Files.move(produced, destination, REPLACE_EXISTING);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FrameRenderException("HTML rendering interrupted", e);
        } catch (Exception e) {
            LOGGER.error("Failed to render HTML template {}: {}", template.sourcePath(), e.getMessage());
            throw new FrameRenderException("HTML rendering failed: " + e.getMessage(), e);
        }
        LOGGER.info("Frame generated: {}", destination);
        return new RenderedFrame(destination, template.width(), template.height());
    }

    public CompletableFuture<RenderedFrame> generateFrameAsync(FrameContext context, @Nullable Path outputPath) {
        return CompletableFuture.supplyAsync(() -> generateFrame(context, outputPath), executor);
    }

    private FrameRasterizer acquireSession() {
        if (state == State.UNINITIALIZED) {
            session = rasterizerFactory.open(template.size());
            state = State.READY;
        }
        return session;
    }

    @Override
    public void close() {
        if (state == State.DISPOSED) {
            return;
        }
        if (session != null) {
            session.close();
            session = null;
        }
        state = State.DISPOSED;
    }

    static String newFrameFileName() {
        return "frame_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16) + ".png";
    }

    State state() {
        return state;
    }

    public FrameTemplate template() {
        return template;
    }
}
