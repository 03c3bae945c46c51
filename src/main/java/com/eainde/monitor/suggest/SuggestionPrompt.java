package com.eainde.monitor.suggest;

import com.eainde.monitor.config.AiSuggestProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

/**
 * System prompt for the suggested fix. The template ends with a placeholder that is
 * swapped for a randomly picked closing gimmick on every call.
 */
@Component
public class SuggestionPrompt {

    static final String FUN_PROMPT_PLACEHOLDER = "___FUN_PROMPT___";

    static final List<String> FUN_PROMPT_CHOICES = List.of(
            "[haiku about the error]",
            "[hip hop rhyme about the error]",
            "[4 line rhyme about the error]",
            "[2 stanza rhyme about the error]",
            "[anti joke about the error]"
    );

    private final String template;
    private final Random random;

    @Autowired
    public SuggestionPrompt(ResourceLoader resourceLoader, AiSuggestProperties properties) {
        this(load(resourceLoader.getResource(properties.getPromptLocation())), new Random());
    }

    SuggestionPrompt(String template, Random random) {
        if (!template.contains(FUN_PROMPT_PLACEHOLDER)) {
            throw new IllegalArgumentException("Prompt template is missing " + FUN_PROMPT_PLACEHOLDER);
        }
        this.template = template;
        this.random = random;
    }

    public String build() {
        String funPrompt = FUN_PROMPT_CHOICES.get(random.nextInt(FUN_PROMPT_CHOICES.size()));
        return template.replace(FUN_PROMPT_PLACEHOLDER, funPrompt);
    }

    private static String load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read prompt template " + resource.getDescription(), e);
        }
    }
}
