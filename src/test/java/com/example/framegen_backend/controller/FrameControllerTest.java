package com.example.framegen_backend.controller;

import com.example.framegen_backend.dto.TemplateInfo;
import com.example.framegen_backend.dto.web.FrameRenderResponse;
import com.example.framegen_backend.dto.web.TemplateParamsResponse;
import com.example.framegen_backend.exception.FrameRenderException;
import com.example.framegen_backend.exception.TemplateNotFoundException;
import com.example.framegen_backend.service.FrameService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = FrameController.class)
class FrameControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private FrameService frameService;

    @Test
    void renderReturnsFramePathAndSize() throws Exception {
        when(frameService.render(any())).thenReturn(FrameRenderResponse.ok("/srv/output/frame_ab.png", 1080, 1920));

        mockMvc.perform(post("/v1/frame/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"template":"1080x1920/default.html","title":"Welcome","text":"Hello","image":"resources/example.png",
                                 "ext":{"mood":"calm","show_author":true}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Success"))
                .andExpect(jsonPath("$.framePath").value("/srv/output/frame_ab.png"))
                .andExpect(jsonPath("$.width").value(1080))
                .andExpect(jsonPath("$.height").value(1920));

        verify(frameService).render(argThat(req -> "1080x1920/default.html".equals(req.template())
                && Boolean.TRUE.equals(req.ext().get("show_author"))));
    }

    @Test
    void renderRejectsMissingText() throws Exception {
        mockMvc.perform(post("/v1/frame/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template\":\"default.html\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(frameService);
    }

    @Test
    void outputPathOutsideOutputDirIsBadRequest() throws Exception {
        when(frameService.render(any()))
                .thenThrow(new IllegalArgumentException("Output path must be below /srv/output: /etc/cron.d/job"));

        mockMvc.perform(post("/v1/frame/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template\":\"default.html\",\"text\":\"x\",\"outputPath\":\"/etc/cron.d/job\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownTemplateIsNotFound() throws Exception {
        when(frameService.render(any())).thenThrow(new TemplateNotFoundException("Template not found: nope.html"));

        mockMvc.perform(post("/v1/frame/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template\":\"nope.html\",\"text\":\"x\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void renderFailureIsServerError() throws Exception {
        when(frameService.render(any()))
                .thenThrow(new FrameRenderException("HTML rendering failed: Chrome timed out", new IOException("timed out")));

        mockMvc.perform(post("/v1/frame/render")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"template\":\"default.html\",\"text\":\"x\"}"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void paramsExposeSchemaWithDefaultKey() throws Exception {
        when(frameService.templateParams("1080x1920/default.html")).thenReturn(new TemplateParamsResponse(
                "1080x1920/default.html", 1080, 1920, List.of(
                new TemplateParamsResponse.Param("background", "color", "#101820", "background"),
                new TemplateParamsResponse.Param("title_size", "number", 72, "title_size"),
                new TemplateParamsResponse.Param("show_author", "bool", true, "show_author"))));

        mockMvc.perform(get("/v1/frame/templates/params").param("template", "1080x1920/default.html"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.width").value(1080))
                .andExpect(jsonPath("$.params[0].name").value("background"))
                .andExpect(jsonPath("$.params[0].type").value("color"))
                .andExpect(jsonPath("$.params[0].default").value("#101820"))
                .andExpect(jsonPath("$.params[1].default").value(72))
                .andExpect(jsonPath("$.params[2].default").value(true))
                .andExpect(jsonPath("$.params[2].label").value("show_author"));
    }

    @Test
    void paramsForUnknownTemplateIsNotFound() throws Exception {
        when(frameService.templateParams("missing.html")).thenThrow(new TemplateNotFoundException("Template not found: missing.html"));

        mockMvc.perform(get("/v1/frame/templates/params").param("template", "missing.html"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listsTemplates() throws Exception {
        when(frameService.listTemplates()).thenReturn(List.of(
                new TemplateInfo("1080x1920/default.html", "/srv/templates/1080x1920/default.html", 1080, 1920)));

        mockMvc.perform(get("/v1/frame/templates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("1080x1920/default.html"))
                .andExpect(jsonPath("$[0].height").value(1920));
    }
}
