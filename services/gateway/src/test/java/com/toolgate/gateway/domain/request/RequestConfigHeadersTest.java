package com.toolgate.gateway.domain.request;

import static org.assertj.core.api.Assertions.assertThat;

import com.toolgate.gateway.domain.pipeline.StubInboundRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("RequestConfigHeaders")
class RequestConfigHeadersTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "'',      false",
            "false,   false",
            "' OFF ', false",
            "0,       false",
            "no,      false",
            "N,       false",
            "f,       false",
            "true,    true",
            "1,       true",
            "yes,     true",
            "anything, true"
    })
    @DisplayName("parses booleans relaxedly")
    void relaxedBooleans(String value, boolean expected) {
        assertThat(RequestConfigHeaders.relaxedParseBool(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("absent header is false")
    void absentIsFalse() {
        assertThat(RequestConfigHeaders.relaxedParseBool(null)).isFalse();
    }

    @Test
    @DisplayName("reads every directive header")
    void readsAllHeaders() {
        var request = StubInboundRequest.post("/")
                .header(RequestConfigHeaders.READONLY, "true")
                .header(RequestConfigHeaders.TOOLSETS, " repos, issues ,,")
                .header(RequestConfigHeaders.TOOLS, "get_me")
                .header(RequestConfigHeaders.LOCKDOWN, "1")
                .header(RequestConfigHeaders.FEATURES, "a,b");

        RequestConfig config = RequestConfigHeaders.read(request);

        assertThat(config.readOnly()).isTrue();
        assertThat(config.toolsets()).containsExactly("repos", "issues");
        assertThat(config.tools()).containsExactly("get_me");
        assertThat(config.lockdown()).isTrue();
        assertThat(config.insiders()).isFalse();
        assertThat(config.features()).containsExactly("a", "b");
    }
}
