package com.example.framegen_backend.service;

import com.example.framegen_backend.dto.FrameSize;
import com.example.framegen_backend.dto.TemplateInfo;
import com.example.framegen_backend.exception.TemplateNotFoundException;
import com.example.framegen_backend.util.TemplateSizeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Maps template keys such as {@code 1080x1920/default.html} onto files below the template roots.
 * Roots are searched in order, so user templates in an earlier root shadow built-in ones.
 */
public class TemplatePathResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplatePathResolver.class);

    private final List<Path> roots;
    private final TemplateSizeResolver sizeResolver;

    public TemplatePathResolver(List<Path> roots, TemplateSizeResolver sizeResolver) {
        this.roots = roots.stream().map(r -> r.toAbsolutePath().normalize()).toList();
        this.sizeResolver = sizeResolver;
    }

    /**
     * @param templateKey key relative to a root, a bare file name, or an absolute path
     * @return absolute path of an existing template file
     * @throws TemplateNotFoundException when no root holds the template
     */
    public Path resolve(String templateKey) {
        if (templateKey == null || templateKey.isBlank()) {
            throw new TemplateNotFoundException("Template key is blank");
        }
        String key = templateKey.replace('\\', '/');
        Path direct;
        try {
            direct = Path.of(key);
        } catch (InvalidPathException e) {
            throw new TemplateNotFoundException("Invalid template key: " + templateKey, e);
        }
        if (direct.isAbsolute()) {
            if (Files.isRegularFile(direct)) {
                return direct.normalize();
            }
            throw new TemplateNotFoundException("Template not found: " + templateKey);
        }

        String relative = key.replaceAll("^/+", "");
        for (Path root : roots) {
            Path found = inRoot(root, relative);
            if (found != null) return found;
        }
        // keys already carrying a root prefix, e.g. templates/1080x1920/default.html
        Path fromCwd = Path.of(relative).toAbsolutePath().normalize();
        if (Files.isRegularFile(fromCwd) && roots.stream().anyMatch(fromCwd::startsWith)) {
            return fromCwd;
        }
        if (!relative.contains("/")) {
            FrameSize fallback = sizeResolver.fallback();
            String sized = fallback.width() + "x" + fallback.height() + "/" + relative;
            for (Path root : roots) {
                Path found = inRoot(root, sized);
                if (found != null) return found;
            }
        }
        throw new TemplateNotFoundException("Template not found: " + templateKey + " (searched " + roots + ")");
    }

    /**
     * Like {@link #resolve(String)}, but an absolute key must also lie below one of the roots.
     * Used for keys that arrive from outside the process.
     *
     * @throws TemplateNotFoundException when the key names a file outside every root
     */
    public Path resolveWithinRoots(String templateKey) {
        Path resolved = resolve(templateKey);
        if (roots.stream().noneMatch(resolved::startsWith)) {
            LOGGER.warn("Rejected template outside the template roots: {}", resolved);
            throw new TemplateNotFoundException("Template not found: " + templateKey);
        }
        return resolved;
    }

    /**
     * Lists every {@code .html} template below the roots. Keys present in several roots are reported once,
     * from the first root.
     */
    public List<TemplateInfo> listTemplates() {
        Map<String, TemplateInfo> byKey = new LinkedHashMap<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(root)) {
                files.filter(Files::isRegularFile)
                        .filter(f -> f.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".html"))
                        .sorted()
                        .forEach(f -> {
                            String key = root.relativize(f).toString().replace('\\', '/');
                            FrameSize size = sizeResolver.resolve(key);
                            byKey.putIfAbsent(key, new TemplateInfo(key, f.toString(), size.width(), size.height()));
                        });
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list templates in " + root, e);
            }
        }
        LOGGER.debug("Listed {} template(s) from {}", byKey.size(), roots);
        return new ArrayList<>(byKey.values());
    }

    private static Path inRoot(Path root, String relative) {
        Path candidate = root.resolve(relative).normalize();
        if (!candidate.startsWith(root)) {
            throw new TemplateNotFoundException("Invalid template key (path traversal?): " + relative);
        }
        return Files.isRegularFile(candidate) ? candidate : null;
    }

    public List<Path> roots() {
        return roots;
    }
}
