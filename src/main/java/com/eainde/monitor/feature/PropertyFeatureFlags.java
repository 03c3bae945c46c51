package com.eainde.monitor.feature;

import com.eainde.monitor.project.Organization;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class PropertyFeatureFlags implements FeatureFlags {

    static final String ALL_ORGANIZATIONS = "*";

    private final FeatureProperties properties;

    @Override
    public boolean has(String feature, Organization organization, String actor) {
        List<String> organizations = properties.getEnabled().get(feature);
        if (organizations == null || organization == null) {
            return false;
        }
        return organizations.contains(ALL_ORGANIZATIONS) || organizations.contains(organization.slug());
    }
}
