package com.gdin.affinity.config;

import com.gdin.affinity.index.pipeline.PipelineFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AffinityConfig {

    @Bean
    protected PipelineFactory<ClusterSettings> pipelineFactory() {
        return new PipelineFactory<>();
    }
}
