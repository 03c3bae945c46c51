package com.eainde.monitor.config;

import dev.langchain4j.model.chat.request.ChatRequestParameters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatParameterMapperTest {

    private final ChatParameterMapper mapper = new ChatParameterMapper();

    @Mock
    private ChatPromptConfig mockConfig;

    @Test
    void toRequestParameters_shouldReturnEmptyParameters_whenConfigIsNull() {
        // Act
        ChatRequestParameters result = mapper.toRequestParameters(null);

        // Assert
        assertThat(result).isNotNull();
        assertThat(result.modelName()).isNull();
        assertThat(result.temperature()).isNull();
    }

    @Test
    void toRequestParameters_shouldMapAllSetValues() {
        // Arrange
        when(mockConfig.getModelName()).thenReturn("gpt-4o-mini");
        when(mockConfig.getTemperature()).thenReturn(0.2);
        when(mockConfig.getTopP()).thenReturn(0.9);
        when(mockConfig.getMaxOutputTokens()).thenReturn(800);

        // Act
        ChatRequestParameters result = mapper.toRequestParameters(mockConfig);

        // Assert
        assertThat(result.modelName()).isEqualTo("gpt-4o-mini");
        assertThat(result.temperature()).isEqualTo(0.2);
        assertThat(result.topP()).isEqualTo(0.9);
        assertThat(result.maxOutputTokens()).isEqualTo(800);
    }

    @Test
    void toRequestParameters_shouldUseSuggestionDefaults() {
        // Act
        ChatRequestParameters result = mapper.toRequestParameters(new AiSuggestProperties());

        // Assert
        assertThat(result.modelName()).isEqualTo("gpt-3.5-turbo");
        assertThat(result.temperature()).isEqualTo(0.5);
        // unset values are left to the provider
        assertThat(result.topP()).isNull();
        assertThat(result.maxOutputTokens()).isNull();
    }
}
