package com.assetdesk.backend.modules.assignment.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;

import com.assetdesk.backend.modules.assignment.domain.AssetLookup;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.assignment.domain.UserLookup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TargetResolverTest {

    @Mock
    private UserLookup userLookup;

    @Mock
    private LocationLookup locationLookup;

    @Mock
    private AssetLookup assetLookup;

    private TargetResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TargetResolver(userLookup, locationLookup, assetLookup);
    }

    @Test
    @DisplayName("Each target kind is described by its own directory")
    void describe_dispatchesByKind() {
        when(userLookup.nameOf(7L)).thenReturn(Optional.of("Mina Park"));
        when(locationLookup.nameOf(3L)).thenReturn(Optional.of("Seoul HQ"));
        when(assetLookup.describe(2L)).thenReturn(Optional.of("LAP-002 - ThinkPad X1 (S/N PF3K9)"));

        assertThat(resolver.describe(AssignmentTarget.user(7L))).contains("Mina Park");
        assertThat(resolver.describe(AssignmentTarget.location(3L))).contains("Seoul HQ");
        assertThat(resolver.describe(AssignmentTarget.asset(2L))).contains("LAP-002 - ThinkPad X1 (S/N PF3K9)");
    }

    @Test
    @DisplayName("A dangling reference resolves to nothing instead of failing")
    void describe_danglingReference() {
        when(userLookup.nameOf(404L)).thenReturn(Optional.empty());

        assertThat(resolver.describe(AssignmentTarget.user(404L))).isEmpty();
        assertThat(resolver.exists(AssignmentTarget.user(404L))).isFalse();
    }

    @Test
    @DisplayName("Unassigned and missing targets have no label and hit no directory")
    void describe_unassigned() {
        assertThat(resolver.describe(AssignmentTarget.unassigned())).isEmpty();
        assertThat(resolver.describe(null)).isEmpty();
        verifyNoInteractions(userLookup, locationLookup, assetLookup);
    }

    @Test
    @DisplayName("Describing the same target twice gives the same label")
    void describe_isRepeatable() {
        when(locationLookup.nameOf(3L)).thenReturn(Optional.of("Seoul HQ"));

        assertThat(resolver.describe(AssignmentTarget.location(3L)))
                .isEqualTo(resolver.describe(AssignmentTarget.location(3L)));
    }
}
