package com.assetdesk.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    private Locale previousLocale;

    @BeforeEach
    void useTurkishLocale() {
        previousLocale = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previousLocale);
    }

    @Test
    @DisplayName("Not-found codes are upper-cased with root locale rules")
    void entityNotFoundCode() {
        assertThat(new EntityNotFoundError("LicenseSeat", 4L).code()).isEqualTo("LICENSESEAT_NOT_FOUND");
    }

    @Test
    @DisplayName("The problem type slug is lower-cased with root locale rules")
    void problemTypeSlug() {
        ProblemResponse response = ProblemResponse.of(HttpStatus.NOT_FOUND, "LICENSE_NOT_FOUND", null, "/api/licenses/4");

        assertThat(response.type()).isEqualTo("https://assetdesk.app/errors/license_not_found");
        assertThat(response.detail()).isEqualTo("Not Found");
        assertThat(response.code()).isEqualTo("LICENSE_NOT_FOUND");
    }
}
