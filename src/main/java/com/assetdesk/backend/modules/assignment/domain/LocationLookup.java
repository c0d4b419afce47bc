package com.assetdesk.backend.modules.assignment.domain;

import java.util.Optional;

public interface LocationLookup {

    Optional<String> nameOf(long locationId);
}
