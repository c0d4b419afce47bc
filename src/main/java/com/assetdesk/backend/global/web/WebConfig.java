package com.assetdesk.backend.global.web;

import java.util.List;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ActingUserArgumentResolver actingUserArgumentResolver;

    public WebConfig(ActingUserArgumentResolver actingUserArgumentResolver) {
        this.actingUserArgumentResolver = actingUserArgumentResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(actingUserArgumentResolver);
    }
}
