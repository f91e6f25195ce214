package com.scholary.voicenote.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the pipeline and storage properties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, StorageProperties.class})
public class PipelineConfig {}
