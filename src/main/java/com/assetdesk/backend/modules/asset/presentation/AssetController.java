package com.assetdesk.backend.modules.asset.presentation;

import com.assetdesk.backend.global.error.BusinessErrors;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.web.ActingUser;
import com.assetdesk.backend.modules.asset.application.AssetService;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetCopyRequest;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetRequest;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/assets")
public class AssetController {

    private final AssetService assetService;

    public AssetController(AssetService assetService) {
        this.assetService = assetService;
    }

    @Operation(summary = "Register an asset")
    @PostMapping
    public ResponseEntity<AssetResponse> create(@Valid @RequestBody AssetRequest request, @Parameter(hidden = true) ActingUser actor) {
        AssetResponse created = BusinessErrors.unwrap(assetService.create(request, actor.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Copy an asset", description = "Registers a new asset with the source's descriptive fields under a new tag.")
    @PostMapping("/{assetId}/copy")
    public ResponseEntity<AssetResponse> copy(
            @PathVariable long assetId,
            @Valid @RequestBody AssetCopyRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        AssetResponse created = BusinessErrors.unwrap(assetService.copy(assetId, request, actor.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Asset detail", description = "Includes the resolved assignee and the license seats attached to the asset.")
    @GetMapping("/{assetId}")
    public ResponseEntity<AssetResponse> get(@PathVariable long assetId) {
        return assetService.getAsset(assetId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> BusinessErrors.toProblem(new EntityNotFoundError("Asset", assetId)));
    }

    @PutMapping("/{assetId}")
    public ResponseEntity<AssetResponse> update(
            @PathVariable long assetId,
            @Valid @RequestBody AssetRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        return ResponseEntity.ok(BusinessErrors.unwrap(assetService.update(assetId, request, actor.id())));
    }

    @DeleteMapping("/{assetId}")
    public ResponseEntity<Void> delete(@PathVariable long assetId, @Parameter(hidden = true) ActingUser actor) {
        BusinessErrors.unwrap(assetService.delete(assetId, actor.id()));
        return ResponseEntity.noContent().build();
    }
}
