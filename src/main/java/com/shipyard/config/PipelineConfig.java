package com.shipyard.config;

import com.shipyard.core.tagging.TagDeriver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    /** Shared by publish and pull so both always agree on tag spelling. */
    @Bean
    public TagDeriver tagDeriver(ShipyardProperties properties) {
        var registry = properties.getRegistry();
        var tags = properties.getTags();
        return new TagDeriver(registry.getHost(), registry.getNamespace(), registry.getRepository(),
                tags.getMaxLength(), tags.getPlaceholder());
    }
}
