package com.assetdesk.backend.modules.directory.infrastructure;

import java.util.Optional;

import com.assetdesk.backend.modules.assignment.domain.UserLookup;
import com.assetdesk.backend.modules.directory.domain.AppUser;
import com.assetdesk.backend.modules.directory.infrastructure.persistence.AppUserRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class UserLookupAdapter implements UserLookup {

    private final AppUserRepository appUserRepository;

    public UserLookupAdapter(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Override
    public Optional<String> nameOf(long userId) {
        return appUserRepository.findById(userId).map(AppUser::getName);
    }
}
