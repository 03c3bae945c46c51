package com.eainde.monitor.suggest;

/**
 * Either a suggestion or the policy that prevented generating one.
 */
public record SuggestionResult(String suggestion, AiPolicy restriction) {

    public static SuggestionResult of(String suggestion) {
        return new SuggestionResult(suggestion, null);
    }

    public static SuggestionResult restricted(AiPolicy restriction) {
        return new SuggestionResult(null, restriction);
    }

    public boolean isRestricted() {
        return restriction != null;
    }
}
