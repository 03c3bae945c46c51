package com.eainde.monitor.feature;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature name to the organization slugs it is enabled for; {@code *} enables it everywhere.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "monitor.features")
public class FeatureProperties {

    private Map<String, List<String>> enabled = new LinkedHashMap<>();
}
