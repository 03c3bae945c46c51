package com.eainde.monitor.suggest;

import com.eainde.monitor.cache.SuggestionCache;
import com.eainde.monitor.config.AiSuggestProperties;
import com.eainde.monitor.config.ChatParameterMapper;
import com.eainde.monitor.error.ResourceDoesNotExistException;
import com.eainde.monitor.error.SuggestionUnavailableException;
import com.eainde.monitor.event.Event;
import com.eainde.monitor.event.EventStore;
import com.eainde.monitor.feature.FeatureFlags;
import com.eainde.monitor.project.Project;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Produces an AI written explanation and fix proposal for an error event.
 *
 * <p>Replies are cached under the event's primary hash so that every event of the
 * same issue shares one suggestion until the entry expires.</p>
 */
@Log4j2
@Service
@RequiredArgsConstructor
public class SuggestedFixService {

    static final String CACHE_KEY_PREFIX = "ai:";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final EventStore eventStore;
    private final FeatureFlags featureFlags;
    private final AiPolicyResolver policyResolver;
    private final SuggestionCache cache;
    private final EventDescriber eventDescriber;
    private final SuggestionPrompt prompt;
    private final ChatParameterMapper parameterMapper;
    private final AiSuggestProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @param actor   requesting user, {@code null} when anonymous
     * @param consent whether the user consented to sending the event to the model provider
     * @throws ResourceDoesNotExistException when the feature is unavailable or the event is unknown
     * @throws SuggestionUnavailableException when the model call fails
     */
    public SuggestionResult suggest(Project project, String eventId, String actor, boolean consent) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null
                || !featureFlags.has(FeatureFlags.OPEN_AI_SUGGESTION, project.organization(), actor)) {
            throw new ResourceDoesNotExistException("AI suggestions are not available for " + project.slug());
        }

        Event event = eventStore.getEventById(project.id(), eventId)
                .orElseThrow(() -> new ResourceDoesNotExistException("Event " + eventId + " not found"));

        AiPolicy policy = policyResolver.resolve(project.organization());
        if (policy == AiPolicy.SUBPROCESSOR
                || (policy == AiPolicy.INDIVIDUAL_CONSENT && !consent)) {
            log.info("AI suggestion for event {} blocked by policy {}", eventId, policy.value());
            return SuggestionResult.restricted(policy);
        }

        String cacheKey = CACHE_KEY_PREFIX + event.primaryHash();
        Optional<String> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Serving cached suggestion for {}", cacheKey);
            return SuggestionResult.of(cached.get());
        }

        String suggestion = askModel(chatModel, event);
        cache.put(cacheKey, suggestion);
        return SuggestionResult.of(suggestion);
    }

    private String askModel(ChatModel chatModel, Event event) {
        String eventInfo;
        try {
            eventInfo = objectMapper.writeValueAsString(eventDescriber.describe(event.data()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize description of event " + event.eventId(), e);
        }

        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(prompt.build()), UserMessage.from(eventInfo))
                .parameters(parameterMapper.toRequestParameters(properties))
                .build();

        log.info("Requesting AI suggestion for event {} of project {}", event.eventId(), event.projectId());
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new SuggestionUnavailableException("The AI provider could not be reached", e);
        }

        AiMessage message = response == null ? null : response.aiMessage();
        if (message == null || message.text() == null || message.text().isBlank()) {
            throw new SuggestionUnavailableException("The AI provider returned an empty answer");
        }
        return message.text();
    }
}
