package com.hivemind.core.llm;

/**
 * Seam to the model provider's streaming API.
 */
public interface ModelStreamClient {

    /**
     * Opens a streaming exchange.
     *
     * @throws ModelStreamException if the exchange cannot be opened at all;
     *                              failures after opening arrive as {@link StreamEvent.Failure}
     */
    ModelStream streamMessage(StreamRequest request);
}
