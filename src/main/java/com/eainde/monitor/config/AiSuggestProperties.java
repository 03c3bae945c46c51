package com.eainde.monitor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for the AI suggested fix endpoint, bound from {@code monitor.ai.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "monitor.ai")
public class AiSuggestProperties implements ChatPromptConfig {

    private final OpenAi openai = new OpenAi();

    private String modelName = "gpt-3.5-turbo";
    private Double temperature = 0.5;
    private Double topP;
    private Integer maxOutputTokens;

    /** How long a suggestion is shared by all events of the same issue. */
    private Duration cacheTtl = Duration.ofSeconds(300);
    private long cacheMaximumSize = 10_000;

    private String promptLocation = "classpath:prompts/suggested-fix.md";

    /** Organization slug to AI policy name. */
    private Map<String, String> policies = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class OpenAi {
        private String apiKey;
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(60);
        private boolean logRequests;
        private boolean logResponses;
    }
}
