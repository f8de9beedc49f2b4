package com.example.framegen_backend.config;

import com.example.framegen_backend.dto.FrameSize;
import com.example.framegen_backend.engine.ChromeExecutableLocator;
import com.example.framegen_backend.engine.ChromeRasterizerFactory;
import com.example.framegen_backend.engine.FontconfigProbe;
import com.example.framegen_backend.engine.NoopBrowserExecutableLocator;
import com.example.framegen_backend.engine.Interfaces.BrowserExecutableLocator;
import com.example.framegen_backend.engine.Interfaces.RasterizerFactory;
import com.example.framegen_backend.service.FrameGeneratorFactory;
import com.example.framegen_backend.service.TemplatePathResolver;
import com.example.framegen_backend.util.ImageReferenceNormalizer;
import com.example.framegen_backend.util.TemplateSizeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Executor;

@Configuration
@EnableConfigurationProperties(FrameProperties.class)
public class FrameConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameConfig.class);

    @Bean
    public TemplateSizeResolver templateSizeResolver(FrameProperties properties) {
        return new TemplateSizeResolver(new FrameSize(properties.getDefaultWidth(), properties.getDefaultHeight()));
    }

    @Bean
    public ImageReferenceNormalizer imageReferenceNormalizer(FrameProperties properties) {
        return new ImageReferenceNormalizer(pathOrCwd(properties.getWorkingRoot()));
    }

    @Bean
    public TemplatePathResolver templatePathResolver(FrameProperties properties, TemplateSizeResolver sizeResolver) {
        var roots = properties.getTemplateRoots().stream().map(Path::of).toList();
        return new TemplatePathResolver(roots, sizeResolver);
    }

    @Bean
    public BrowserExecutableLocator browserExecutableLocator(FrameProperties properties) {
        FrameProperties.Renderer renderer = properties.getRenderer();
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        if (!renderer.isDiscoveryEnabled() || windows) {
            return new NoopBrowserExecutableLocator();
        }
        return new ChromeExecutableLocator(
                renderer.getCandidates().stream().map(Path::of).toList(),
                Duration.ofMillis(Math.max(1, renderer.getProbeTimeoutMillis()))
        );
    }

    @Bean
    public RasterizerFactory rasterizerFactory(FrameProperties properties, BrowserExecutableLocator locator) {
        FrameProperties.Renderer renderer = properties.getRenderer();
        return new ChromeRasterizerFactory(
                locator,
                renderer.getBinary(),
                renderer.getFallbackBinary(),
                pathOrCwd(renderer.getWorkDir()),
                Duration.ofSeconds(Math.max(1, renderer.getTimeoutSeconds())),
                new FontconfigProbe()
        );
    }

    @Bean
    public FrameGeneratorFactory frameGeneratorFactory(FrameProperties properties,
                                                       TemplatePathResolver pathResolver,
                                                       TemplateSizeResolver sizeResolver,
                                                       RasterizerFactory rasterizerFactory,
                                                       ImageReferenceNormalizer imageNormalizer,
                                                       @Qualifier("frameTaskExecutor") Executor executor) {
        Path outputDir = Path.of(properties.getOutputDir());
        LOGGER.info("Frame generation wired: templates={}, output={}, defaultSize={}x{}",
                pathResolver.roots(), outputDir.toAbsolutePath().normalize(),
                properties.getDefaultWidth(), properties.getDefaultHeight());
        return new FrameGeneratorFactory(pathResolver, sizeResolver, rasterizerFactory, imageNormalizer, outputDir, executor);
    }

    private static Path pathOrCwd(String dir) {
        return (dir == null || dir.isBlank()) ? Path.of("").toAbsolutePath() : Path.of(dir);
    }
}
