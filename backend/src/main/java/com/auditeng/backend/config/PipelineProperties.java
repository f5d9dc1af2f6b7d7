package com.auditeng.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the executor that runs analysis pipelines.
 */
@ConfigurationProperties(prefix = "auditeng.pipeline")
public record PipelineProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public PipelineProperties {
        corePoolSize = corePoolSize != null ? corePoolSize : 2;
        maxPoolSize = maxPoolSize != null ? maxPoolSize : 4;
        queueCapacity = queueCapacity != null ? queueCapacity : 100;
    }
}
