package com.streamfirst.splitter.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResultTest {

    @Test
    void failureCarriesMessageAndCodeThroughMap() {
        Result<String> failed = Result.failure("destination rejected", "DESTINATION_REJECTED");

        Result<Integer> mapped = failed.map(String::length);

        assertThat(mapped.isFailure()).isTrue();
        assertThat(mapped.getErrorMessage()).contains("destination rejected");
        assertThat(mapped.getErrorCode()).contains("DESTINATION_REJECTED");
        assertThat(mapped.getData()).isEmpty();
        assertThat(mapped.toString()).isEqualTo("Result.failure(destination rejected, code=DESTINATION_REJECTED)");
    }

    @Test
    void successExposesDataAndNoError() {
        Result<Integer> ok = Result.success("abc").map(String::length);

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.getData()).contains(3);
        assertThat(ok.getErrorMessage()).isEmpty();
    }

    @Test
    void failureWithoutCodeHasEmptyCode() {
        assertThat(Result.failure("boom").getErrorCode()).isEmpty();
    }
}
