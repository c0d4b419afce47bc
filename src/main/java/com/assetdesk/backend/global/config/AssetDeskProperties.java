package com.assetdesk.backend.global.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application level settings bound from the {@code assetdesk.*} namespace.
 *
 * @param actorHeader request header carrying the acting user id
 */
@ConfigurationProperties(prefix = "assetdesk")
public record AssetDeskProperties(String actorHeader) {

    public static final String DEFAULT_ACTOR_HEADER = "X-Actor-Id";

    public AssetDeskProperties {
        if (actorHeader == null || actorHeader.isBlank()) {
            actorHeader = DEFAULT_ACTOR_HEADER;
        }
    }
}
