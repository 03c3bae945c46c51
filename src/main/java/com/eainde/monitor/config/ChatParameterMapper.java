package com.eainde.monitor.config;

import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import org.springframework.stereotype.Component;

@Component
public class ChatParameterMapper {

    public ChatRequestParameters toRequestParameters(ChatPromptConfig config) {
        if (config == null) {
            return ChatRequestParameters.builder().build();
        }

        DefaultChatRequestParameters.Builder<?> builder = ChatRequestParameters.builder();

        if (config.getModelName() != null) {
            builder.modelName(config.getModelName());
        }
        if (config.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(config.getMaxOutputTokens());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        if (config.getTopP() != null) {
            builder.topP(config.getTopP());
        }

        return builder.build();
    }
}
