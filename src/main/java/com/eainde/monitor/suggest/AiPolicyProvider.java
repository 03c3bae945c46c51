package com.eainde.monitor.suggest;

import com.eainde.monitor.project.Organization;

/**
 * Votes on the AI policy of an organization.
 */
@FunctionalInterface
public interface AiPolicyProvider {

    /**
     * @return a policy name such as {@code allowed}, or {@code null} to abstain
     */
    String policyFor(Organization organization);
}
