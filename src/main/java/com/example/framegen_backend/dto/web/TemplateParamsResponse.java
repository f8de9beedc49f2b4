package com.example.framegen_backend.dto.web;

import com.example.framegen_backend.template.ParamDeclaration;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TemplateParamsResponse(
        String template,
        int width,
        int height,
        List<Param> params
) {
    public record Param(String name, String type, @JsonProperty("default") Object defaultValue, String label) {
        public static Param from(ParamDeclaration d) {
            return new Param(d.name(), d.type().token(), d.defaultValue(), d.label());
        }
    }
}
