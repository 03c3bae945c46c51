package com.eainde.monitor.suggest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces an event payload to the parts a language model can reason about:
 * stable tags, the exception chain with trimmed stack traces, and the message.
 */
@Component
@RequiredArgsConstructor
public class EventDescriber {

    static final int MAX_EXCEPTIONS = 30;

    // Unstable between events of the same issue, and rarely useful to the model.
    static final Set<String> BLOCKED_TAGS = Set.of(
            "user",
            "server_name",
            "release",
            "handled",
            "client_os",
            "client_os.name",
            "browser",
            "browser.name",
            "environment",
            "runtime",
            "device",
            "device.family",
            "gpu",
            "gpu.name",
            "gpu.vendor",
            "url",
            "trace",
            "otel"
    );

    private final ObjectMapper objectMapper;

    public ObjectNode describe(JsonNode event) {
        ObjectNode description = objectMapper.createObjectNode();

        ObjectNode tags = description.putObject("tags");
        for (Map.Entry<String, JsonNode> tag : sortedTags(event.path("tags"))) {
            if (!BLOCKED_TAGS.contains(tag.getKey())) {
                tags.set(tag.getKey(), tag.getValue());
            }
        }

        ArrayNode exceptions = description.putArray("exceptions");
        List<JsonNode> values = new ArrayList<>();
        event.path("exception").path("values").forEach(values::add);
        List<JsonNode> chain = new ArrayList<>(values.subList(0, Math.min(values.size(), MAX_EXCEPTIONS)));
        for (int idx = chain.size() - 1, number = 1; idx >= 0; idx--, number++) {
            exceptions.add(describeException(chain.get(idx), number));
        }

        JsonNode message = event.get("message");
        if (isTruthy(message)) {
            description.set("message", message);
        }

        return description;
    }

    private ObjectNode describeException(JsonNode exc, int number) {
        ObjectNode exception = objectMapper.createObjectNode();
        if (number > 1) {
            exception.put("raised_during_handling_of_previous_exception", true);
        }
        exception.put("number", number);
        exception.set("type", valueOrNull(exc.get("type")));
        exception.set("message", valueOrNull(exc.get("value")));

        JsonNode mechanism = exc.path("mechanism");
        JsonNode meta = mechanism.get("meta");
        if (isTruthy(meta)) {
            exception.set("meta", meta);
        }
        JsonNode handled = mechanism.get("handled");
        if (handled != null && handled.isBoolean() && !handled.booleanValue()) {
            exception.put("unhandled", true);
        }

        JsonNode frames = exc.path("stacktrace").path("frames");
        if (frames.isArray() && !frames.isEmpty()) {
            List<ObjectNode> stacktrace = new ArrayList<>();
            // most recent call first
            for (int i = frames.size() - 1; i >= 0; i--) {
                JsonNode frame = frames.get(i);
                ObjectNode stackFrame = objectMapper.createObjectNode();
                stackFrame.set("func", valueOrNull(frame.get("function")));
                stackFrame.set("module", valueOrNull(frame.get("module")));
                stackFrame.set("file", valueOrNull(frame.get("filename")));
                stackFrame.set("line", valueOrNull(frame.get("lineno")));
                if (isTruthy(frame.get("in_app"))) {
                    stackFrame.put("in_app", true);
                    String line = frame.path("context_line").asText("").strip();
                    if (!line.isEmpty()) {
                        stackFrame.put("code", line);
                    }
                }
                stacktrace.add(stackFrame);
            }
            ArrayNode trimmed = exception.putArray("stacktrace");
            FrameTrimmer.trimFrames(stacktrace).forEach(trimmed::add);
        }
        return exception;
    }

    /**
     * Tags arrive either as {@code [key, value]} pairs or as {@code {"key": .., "value": ..}} objects.
     * Tags without a textual key are skipped.
     */
    private static List<Map.Entry<String, JsonNode>> sortedTags(JsonNode tags) {
        List<Map.Entry<String, JsonNode>> pairs = new ArrayList<>();
        for (JsonNode tag : tags) {
            if (tag.isArray() && tag.size() == 2 && tag.get(0).isTextual()) {
                pairs.add(Map.entry(tag.get(0).textValue(), tag.get(1)));
            } else if (tag.isObject() && tag.path("key").isTextual()) {
                pairs.add(Map.entry(tag.get("key").asText(), valueOrNull(tag.get("value"))));
            }
        }
        pairs.sort(Comparator.<Map.Entry<String, JsonNode>, String>comparing(Map.Entry::getKey)
                .thenComparing(entry -> entry.getValue().asText("")));
        return pairs;
    }

    private static JsonNode valueOrNull(JsonNode node) {
        return node == null ? NullNode.getInstance() : node;
    }

    static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return !node.textValue().isEmpty();
        }
        if (node.isNumber()) {
            return node.doubleValue() != 0;
        }
        if (node.isContainerNode()) {
            return !node.isEmpty();
        }
        return true;
    }
}
