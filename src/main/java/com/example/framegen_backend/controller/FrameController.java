package com.example.framegen_backend.controller;

import com.example.framegen_backend.dto.TemplateInfo;
import com.example.framegen_backend.dto.web.FrameRenderRequest;
import com.example.framegen_backend.dto.web.FrameRenderResponse;
import com.example.framegen_backend.dto.web.TemplateParamsResponse;
import com.example.framegen_backend.exception.FrameRenderException;
import com.example.framegen_backend.exception.TemplateNotFoundException;
import com.example.framegen_backend.service.FrameService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/v1/frame")
public class FrameController {
    private static final Logger LOGGER = LoggerFactory.getLogger(FrameController.class);

    private final FrameService frameService;

    public FrameController(FrameService frameService) {
        this.frameService = frameService;
    }

    @PostMapping("/render")
    public ResponseEntity<FrameRenderResponse> render(@Valid @RequestBody FrameRenderRequest req) {
        try {
            return ResponseEntity.ok(frameService.render(req));
        } catch (TemplateNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (FrameRenderException e) {
            LOGGER.error("Frame render error: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }

    @GetMapping("/templates")
    public List<TemplateInfo> templates() {
        return frameService.listTemplates();
    }

    @GetMapping("/templates/params")
    public TemplateParamsResponse params(@RequestParam String template) {
        try {
            return frameService.templateParams(template);
        } catch (TemplateNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        }
    }
}
