package com.assetdesk.backend.modules.assignment.domain;

import java.util.Optional;

public interface AssetLookup {

    /**
     * @return composed description such as {@code "LAP-0042 - Design laptop (S/N X1)"}
     */
    Optional<String> describe(long assetId);
}
