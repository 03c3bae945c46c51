package com.eainde.monitor.llm;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs latency and token usage of every chat completion.
 * Message contents are not logged, they carry customer event data.
 */
@Slf4j
public class ObservabilityListener implements ChatModelListener {

    static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending {} messages to model {}",
                requestContext.chatRequest().messages().size(),
                requestContext.chatRequest().parameters().modelName());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("Model responded in {}ms. Token usage - Input: {}, Output: {}, Total: {}",
                    duration,
                    usage.inputTokenCount(),
                    usage.outputTokenCount(),
                    usage.totalTokenCount());
        } else {
            log.info("Model responded in {}ms", duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("LLM interaction failed", errorContext.error());
    }
}
