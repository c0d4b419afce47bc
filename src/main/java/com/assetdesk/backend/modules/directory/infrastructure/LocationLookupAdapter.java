package com.assetdesk.backend.modules.directory.infrastructure;

import java.util.Optional;

import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.directory.domain.Location;
import com.assetdesk.backend.modules.directory.infrastructure.persistence.LocationRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class LocationLookupAdapter implements LocationLookup {

    private final LocationRepository locationRepository;

    public LocationLookupAdapter(LocationRepository locationRepository) {
        this.locationRepository = locationRepository;
    }

    @Override
    public Optional<String> nameOf(long locationId) {
        return locationRepository.findById(locationId).map(Location::getName);
    }
}
