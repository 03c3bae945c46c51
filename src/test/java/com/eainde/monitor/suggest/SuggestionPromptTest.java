package com.eainde.monitor.suggest;

import com.eainde.monitor.config.AiSuggestProperties;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SuggestionPromptTest {

    @Test
    void build_shouldReplacePlaceholderWithOneFunPrompt() {
        SuggestionPrompt prompt = new SuggestionPrompt("Explain.\n___FUN_PROMPT___\n", new Random(7));

        String text = prompt.build();

        assertThat(text).doesNotContain(SuggestionPrompt.FUN_PROMPT_PLACEHOLDER);
        assertThat(SuggestionPrompt.FUN_PROMPT_CHOICES)
                .anySatisfy(choice -> assertThat(text).isEqualTo("Explain.\n" + choice + "\n"));
    }

    @Test
    void build_shouldEventuallyUseEveryFunPrompt() {
        SuggestionPrompt prompt = new SuggestionPrompt("___FUN_PROMPT___", new Random(42));

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            seen.add(prompt.build());
        }

        assertThat(seen).containsExactlyInAnyOrderElementsOf(SuggestionPrompt.FUN_PROMPT_CHOICES);
    }

    @Test
    void constructor_shouldRejectTemplateWithoutPlaceholder() {
        assertThatThrownBy(() -> new SuggestionPrompt("no placeholder", new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldLoadBundledTemplate() {
        SuggestionPrompt prompt = new SuggestionPrompt(new DefaultResourceLoader(), new AiSuggestProperties());

        String text = prompt.build();

        assertThat(text).contains("#### Summary", "#### Proposed Solution", "#### What Else");
        assertThat(text).doesNotContain(SuggestionPrompt.FUN_PROMPT_PLACEHOLDER);
    }
}
