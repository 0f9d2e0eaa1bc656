package com.folautech.alert.config;

import com.folautech.metric.registry.RangeRegistry;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where the reference range table is loaded from.
 */
@ConfigurationProperties(prefix = "alert.registry")
@Getter
@Setter
public class RegistryProperties {

    /** Spring resource location of the JSON reference range table. */
    private String location = "classpath:" + RangeRegistry.DEFAULT_RESOURCE;
}
