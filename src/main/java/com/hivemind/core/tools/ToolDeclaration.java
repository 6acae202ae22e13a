package com.hivemind.core.tools;

/**
 * Declaration of a tool as advertised to the model.
 *
 * @param name        unique tool name
 * @param description what the tool does, for the model
 * @param inputSchema JSON schema of the input object
 */
public record ToolDeclaration(String name, String description, String inputSchema) {

    public static final String EMPTY_OBJECT_SCHEMA = "{\"type\":\"object\",\"properties\":{}}";
}
