package com.eainde.monitor.suggest;

import com.eainde.monitor.config.AiSuggestProperties;
import com.eainde.monitor.project.Organization;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PropertyAiPolicyProvider implements AiPolicyProvider {

    private final AiSuggestProperties properties;

    @Override
    public String policyFor(Organization organization) {
        return properties.getPolicies().get(organization.slug());
    }
}
