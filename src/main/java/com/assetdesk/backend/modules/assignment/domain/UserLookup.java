package com.assetdesk.backend.modules.assignment.domain;

import java.util.Optional;

public interface UserLookup {

    /**
     * @return display name of an active user, empty when the id does not resolve
     */
    Optional<String> nameOf(long userId);
}
