package com.hivemind.core.model;

import java.io.Serializable;

/**
 * One tool call issued during an execution loop run.
 *
 * @param callId     provider call id correlating request and result
 * @param toolName   requested tool
 * @param input      raw input payload (JSON)
 * @param output     output payload, or the rendered error when {@code error} is true
 * @param error      whether the call failed
 * @param errorKind  tool error kind name when failed (nullable)
 * @param elapsedMs  handler duration
 */
public record ToolInvocationRecord(
    String callId,
    String toolName,
    String input,
    String output,
    boolean error,
    String errorKind,
    long elapsedMs
) implements Serializable {}
