package com.assetdesk.backend.global.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.assetdesk.backend.global.error.BusinessErrors;
import com.assetdesk.backend.global.error.NoAvailableSeatError;
import com.assetdesk.backend.global.error.ProblemException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ResultTest {

    @Test
    @DisplayName("map transforms only successful values")
    void map_skipsErrors() {
        Result<Integer, String> ok = Result.ok(2);
        Result<Integer, String> err = Result.err("broken");

        assertThat(ok.map(value -> value * 10).get()).isEqualTo(20);
        assertThat(err.map(value -> value * 10).getError()).isEqualTo("broken");
    }

    @Test
    @DisplayName("Business errors surface as problems with the category status")
    void unwrap_throwsProblem() {
        Result<Void, NoAvailableSeatError> result = Result.err(new NoAvailableSeatError(10L));

        assertThatThrownBy(() -> BusinessErrors.unwrap(result))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("NO_AVAILABLE_SEAT");
                });
    }
}
