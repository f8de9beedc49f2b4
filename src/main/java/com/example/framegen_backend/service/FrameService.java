package com.example.framegen_backend.service;

import com.example.framegen_backend.dto.FrameContext;
import com.example.framegen_backend.dto.RenderedFrame;
import com.example.framegen_backend.dto.TemplateInfo;
import com.example.framegen_backend.dto.web.FrameRenderRequest;
import com.example.framegen_backend.dto.web.FrameRenderResponse;
import com.example.framegen_backend.dto.web.TemplateParamsResponse;
import com.example.framegen_backend.template.FrameTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Request-level entry point: one generator per render request, closed when the request ends.
 */
@Service
public class FrameService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameService.class);

    private final FrameGeneratorFactory generatorFactory;

    public FrameService(FrameGeneratorFactory generatorFactory) {
        this.generatorFactory = generatorFactory;
    }

    public FrameRenderResponse render(FrameRenderRequest req) {
        LOGGER.info("Frame render request: template={}", req.template());
        FrameContext context = new FrameContext(req.title(), req.text(), req.image(), req.ext());
        Path outputPath = generatorFactory.confineOutputPath(req.outputPath());
        try (HtmlFrameGenerator generator = generatorFactory.create(req.template())) {
            RenderedFrame frame = generator.generateFrame(context, outputPath);
            return FrameRenderResponse.ok(frame.path().toString(), frame.width(), frame.height());
        }
    }

    public TemplateParamsResponse templateParams(String templateKey) {
        FrameTemplate template = generatorFactory.loadTemplate(templateKey);
        List<TemplateParamsResponse.Param> params = template.parameters().values().stream()
                .map(TemplateParamsResponse.Param::from)
                .toList();
        return new TemplateParamsResponse(templateKey, template.width(), template.height(), params);
    }

    public List<TemplateInfo> listTemplates() {
        return generatorFactory.pathResolver().listTemplates();
    }
}
