package com.assetdesk.backend.global.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AssetDeskProperties.class)
public class PropertiesConfig {
}
