package com.assetdesk.backend.global.web;

/**
 * Opaque identifier of the user on whose behalf a request mutates inventory rows.
 * Resolved from the actor header by {@link ActingUserArgumentResolver}.
 */
public record ActingUser(long id) {
}
