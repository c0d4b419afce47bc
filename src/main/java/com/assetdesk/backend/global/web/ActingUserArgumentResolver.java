package com.assetdesk.backend.global.web;

import com.assetdesk.backend.global.config.AssetDeskProperties;
import com.assetdesk.backend.global.error.ProblemException;

import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

@Component
public class ActingUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final AssetDeskProperties properties;

    public ActingUserArgumentResolver(AssetDeskProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean supportsParameter(@NonNull MethodParameter parameter) {
        return ActingUser.class.equals(parameter.getParameterType());
    }

    @Override
    public ActingUser resolveArgument(@NonNull MethodParameter parameter,
                                      ModelAndViewContainer mavContainer,
                                      @NonNull NativeWebRequest webRequest,
                                      WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(properties.actorHeader());
        if (!StringUtils.hasText(header)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "ACTOR_REQUIRED",
                    "Header %s is required".formatted(properties.actorHeader()));
        }
        try {
            return new ActingUser(Long.parseLong(header.trim()));
        } catch (NumberFormatException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "ACTOR_INVALID",
                    "Header %s must be a numeric user id".formatted(properties.actorHeader()));
        }
    }
}
