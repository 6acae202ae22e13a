package com.hivemind.core.llm;

import com.hivemind.core.tools.ToolDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ModelStreamClient} backed by a Spring AI {@link ChatModel}.
 * <p>
 * Internal tool execution is disabled: tool calls surface as
 * {@link StreamEvent.ToolCall} events and their results come back in the
 * next request. Spring AI providers keep no server-side conversation, so the
 * session identifier is minted on the first exchange and echoed afterwards.
 */
@Component
public class SpringAiModelStreamClient implements ModelStreamClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelStreamClient.class);

    private final ChatModel chatModel;

    public SpringAiModelStreamClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public ModelStream streamMessage(StreamRequest request) {
        Prompt prompt = toPrompt(request);
        String sessionId = request.sessionId() != null ? request.sessionId() : "sess-" + UUID.randomUUID();
        var stream = new QueueModelStream();
        var finishReason = new AtomicReference<String>();
        var sawToolCalls = new AtomicBoolean(false);

        log.debug("Opening stream: model={}, {} message(s), {} tool(s)",
                request.model(), request.messages().size(), request.tools().size());

        Disposable subscription;
        try {
            subscription = chatModel.stream(prompt).subscribe(
                    response -> onChunk(response, stream, finishReason, sawToolCalls),
                    error -> {
                        ModelErrorKind kind = classify(error);
                        log.warn("Model stream failed ({}): {}", kind, error.getMessage());
                        stream.push(new StreamEvent.Failure(kind, String.valueOf(error.getMessage())));
                        stream.complete();
                    },
                    () -> {
                        String reason = sawToolCalls.get() ? StreamEvent.TOOL_USE : normalize(finishReason.get());
                        stream.push(new StreamEvent.Stop(reason, sessionId));
                        stream.complete();
                    });
        } catch (RuntimeException e) {
            throw new ModelStreamException(classify(e), "Failed to open model stream: " + e.getMessage(), e);
        }
        stream.onClose(subscription::dispose);
        return stream;
    }

    private void onChunk(ChatResponse response, QueueModelStream stream,
                         AtomicReference<String> finishReason, AtomicBoolean sawToolCalls) {
        if (response == null) return;
        Generation generation = response.getResult();
        if (generation == null) return;
        AssistantMessage output = generation.getOutput();
        if (output != null) {
            String text = output.getText();
            if (text != null && !text.isEmpty()) {
                stream.push(new StreamEvent.TextDelta(text));
            }
            if (output.hasToolCalls()) {
                sawToolCalls.set(true);
                for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                    stream.push(new StreamEvent.ToolCall(call.id(), call.name(), call.arguments()));
                }
            }
        }
        if (generation.getMetadata() != null && generation.getMetadata().getFinishReason() != null) {
            finishReason.set(generation.getMetadata().getFinishReason());
        }
    }

    Prompt toPrompt(StreamRequest request) {
        var messages = new ArrayList<Message>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        for (ConversationTurn turn : request.messages()) {
            switch (turn.role()) {
                case USER -> messages.add(new UserMessage(turn.content()));
                case ASSISTANT -> messages.add(new AssistantMessage(turn.content(), Map.of(),
                        turn.toolCalls().stream()
                                .map(c -> new AssistantMessage.ToolCall(c.callId(), "function", c.name(), c.input()))
                                .toList()));
                case TOOL_RESULT -> messages.add(new ToolResponseMessage(List.of(
                        new ToolResponseMessage.ToolResponse(turn.toolCallId(), turn.toolName(), turn.content()))));
            }
        }
        var options = ToolCallingChatOptions.builder()
                .toolCallbacks(request.tools().stream().map(DeclaredTool::new).map(ToolCallback.class::cast).toList())
                .internalToolExecutionEnabled(false)
                .model(request.model())
                .build();
        return new Prompt(messages, options);
    }

    static String normalize(String finishReason) {
        if (finishReason == null) return StreamEvent.END_TURN;
        return switch (finishReason.toLowerCase(Locale.ROOT)) {
            case "stop", "end_turn", "complete" -> StreamEvent.END_TURN;
            case "tool_calls", "tool_use", "function_call" -> StreamEvent.TOOL_USE;
            default -> finishReason.toLowerCase(Locale.ROOT);
        };
    }

    /**
     * Maps a provider exception to an error kind by walking its cause chain.
     */
    static ModelErrorKind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (t instanceof NonTransientAiException) {
                return looksLikeAuth(message) ? ModelErrorKind.AUTH_FAILURE : ModelErrorKind.INVALID_REQUEST;
            }
            if (t instanceof TransientAiException) {
                return looksLikeRateLimit(message) ? ModelErrorKind.RATE_LIMITED : ModelErrorKind.OVERLOADED;
            }
            if (looksLikeRateLimit(message)) return ModelErrorKind.RATE_LIMITED;
            if (message.contains("overloaded") || message.contains("529") || message.contains("503")) {
                return ModelErrorKind.OVERLOADED;
            }
            if (looksLikeAuth(message)) return ModelErrorKind.AUTH_FAILURE;
            if (message.contains("400") || message.contains("invalid_request")) return ModelErrorKind.INVALID_REQUEST;
            if (t instanceof IOException || t instanceof TimeoutException) return ModelErrorKind.NETWORK_FAILURE;
        }
        return ModelErrorKind.NETWORK_FAILURE;
    }

    private static boolean looksLikeRateLimit(String message) {
        return message.contains("429") || message.contains("rate limit") || message.contains("rate_limit");
    }

    private static boolean looksLikeAuth(String message) {
        return message.contains("401") || message.contains("403")
                || message.contains("unauthorized") || message.contains("api key");
    }

    /**
     * Advertises a tool to the provider without letting Spring AI execute it.
     */
    private record DeclaredTool(ToolDeclaration declaration) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return ToolDefinition.builder()
                    .name(declaration.name())
                    .description(declaration.description())
                    .inputSchema(declaration.inputSchema())
                    .build();
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException("Tool " + declaration.name() + " is executed by the agent loop");
        }
    }
}
