package com.chesscoach.web.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void successCarriesData() {
        ApiResponse<String> response = ApiResponse.success("ok");
        assertThat(response.code()).isEqualTo(200);
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.errorCode()).isNull();
        assertThat(response.data()).isEqualTo("ok");
    }

    @Test
    void errorOmitsNullFieldsInJson() throws Exception {
        ApiResponse<Object> response = ApiResponse.error(504, "ENGINE_TIMEOUT", "引擎超时");
        assertThat(response.isSuccess()).isFalse();

        String json = new ObjectMapper().writeValueAsString(response);
        assertThat(json).contains("\"errorCode\":\"ENGINE_TIMEOUT\"").doesNotContain("\"data\"");
    }

    @Test
    void badRequestUses400() {
        assertThat(ApiResponse.badRequest("INVALID_FEN", "FEN 为空").code()).isEqualTo(400);
    }
}
