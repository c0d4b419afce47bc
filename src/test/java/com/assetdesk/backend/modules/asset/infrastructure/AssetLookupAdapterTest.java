package com.assetdesk.backend.modules.asset.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;

import com.assetdesk.backend.modules.asset.domain.Asset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AssetLookupAdapterTest {

    @Test
    @DisplayName("The asset label joins tag, name and serial")
    void describe_fullLabel() {
        Asset asset = new Asset();
        asset.setTag("lap-002");
        asset.setName("ThinkPad X1");
        asset.setSerial("PF3K9");

        assertThat(AssetLookupAdapter.describe(asset)).isEqualTo("LAP-002 - ThinkPad X1 (S/N PF3K9)");
    }

    @Test
    @DisplayName("Missing name and serial are left out of the label")
    void describe_tagOnly() {
        Asset asset = new Asset();
        asset.setTag("DOCK-01");

        assertThat(AssetLookupAdapter.describe(asset)).isEqualTo("DOCK-01");
    }
}
