package com.eainde.monitor.feature;

import com.eainde.monitor.project.Organization;

public interface FeatureFlags {

    String OPEN_AI_SUGGESTION = "organizations:open-ai-suggestion";

    /**
     * @param actor requesting user, {@code null} for anonymous requests
     */
    boolean has(String feature, Organization organization, String actor);
}
