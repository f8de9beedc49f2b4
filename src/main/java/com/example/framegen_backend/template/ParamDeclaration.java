package com.example.framegen_backend.template;

/**
 * Schema entry for one distinct placeholder name. {@code defaultValue} is already coerced
 * to the declared type (String, Number, String color or Boolean).
 */
public record ParamDeclaration(String name, ParamType type, Object defaultValue, String label) {

    public static ParamDeclaration of(String name, ParamType type, Object defaultValue) {
        return new ParamDeclaration(name, type, defaultValue, name);
    }
}
