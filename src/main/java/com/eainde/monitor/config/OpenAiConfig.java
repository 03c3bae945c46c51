package com.eainde.monitor.config;

import com.eainde.monitor.llm.ObservabilityListener;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Registers the OpenAI backed {@link ChatModel}. Without an API key no model
 * bean exists and the suggestion endpoint answers 404.
 */
@Log4j2
@Configuration
public class OpenAiConfig {

    @Bean
    public ObservabilityListener observabilityListener() {
        return new ObservabilityListener();
    }

    @Bean
    @ConditionalOnExpression("!'${monitor.ai.openai.api-key:}'.isBlank()")
    public ChatModel openAiChatModel(AiSuggestProperties properties, ObservabilityListener listener) {
        AiSuggestProperties.OpenAi openai = properties.getOpenai();
        log.info("Configuring OpenAI chat model {}", properties.getModelName());

        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(openai.getApiKey())
                .modelName(properties.getModelName())
                .temperature(properties.getTemperature())
                .timeout(openai.getTimeout())
                .logRequests(openai.isLogRequests())
                .logResponses(openai.isLogResponses())
                .listeners(List.of(listener));
        if (openai.getBaseUrl() != null && !openai.getBaseUrl().isBlank()) {
            builder.baseUrl(openai.getBaseUrl());
        }
        return builder.build();
    }
}
