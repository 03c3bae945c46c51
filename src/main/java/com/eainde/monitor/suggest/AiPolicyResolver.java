package com.eainde.monitor.suggest;

import com.eainde.monitor.project.Organization;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Collects the votes of all {@link AiPolicyProvider}s in bean order. The last
 * provider that answers wins; with no answer the organization is allowed.
 */
@Log4j2
@Component
public class AiPolicyResolver {

    private final List<AiPolicyProvider> providers;

    public AiPolicyResolver(List<AiPolicyProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public AiPolicy resolve(Organization organization) {
        String result = AiPolicy.ALLOWED.value();
        for (AiPolicyProvider provider : providers) {
            String vote = provider.policyFor(organization);
            if (vote != null) {
                result = vote;
            }
        }

        String policyName = result;
        return AiPolicy.fromValue(policyName).orElseGet(() -> {
            log.warn("Unknown AI policy state '{}' for organization {}", policyName, organization.slug());
            return AiPolicy.ALLOWED;
        });
    }
}
