package com.assetdesk.backend.modules.asset.infrastructure;

import java.util.Optional;

import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.asset.infrastructure.persistence.AssetRepository;
import com.assetdesk.backend.modules.assignment.domain.AssetLookup;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Component
@Transactional(readOnly = true)
public class AssetLookupAdapter implements AssetLookup {

    private final AssetRepository assetRepository;

    public AssetLookupAdapter(AssetRepository assetRepository) {
        this.assetRepository = assetRepository;
    }

    @Override
    public Optional<String> describe(long assetId) {
        return assetRepository.findById(assetId).map(AssetLookupAdapter::describe);
    }

    static String describe(Asset asset) {
        StringBuilder sb = new StringBuilder(asset.getTag());
        if (StringUtils.hasText(asset.getName())) {
            sb.append(" - ").append(asset.getName());
        }
        if (StringUtils.hasText(asset.getSerial())) {
            sb.append(" (S/N ").append(asset.getSerial()).append(')');
        }
        return sb.toString();
    }
}
