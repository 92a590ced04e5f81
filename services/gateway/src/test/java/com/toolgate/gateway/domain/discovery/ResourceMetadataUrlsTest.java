package com.toolgate.gateway.domain.discovery;

import static org.assertj.core.api.Assertions.assertThat;

import com.toolgate.gateway.domain.pipeline.StubInboundRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ResourceMetadataUrls")
class ResourceMetadataUrlsTest {

    @Nested
    @DisplayName("resource path resolution")
    class Resolution {

        private final ResourceMetadataUrls urls = new ResourceMetadataUrls("", "mcp/");

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "/,                  /mcp",
                "'',                 /mcp",
                "/mcp,               /mcp",
                "/mcp/readonly,      /mcp/readonly",
                "/readonly,          /mcp/readonly",
                "/x/repos/readonly,  /mcp/x/repos/readonly"
        })
        @DisplayName("restores a stripped base path")
        void restoresStrippedBase(String path, String expected) {
            assertThat(urls.resolveResourcePath(path)).isEqualTo(expected);
        }

        @Test
        @DisplayName("leaves paths alone without a configured base")
        void noBase() {
            var plain = new ResourceMetadataUrls(null, "/");

            assertThat(plain.resourcePath()).isEmpty();
            assertThat(plain.resolveResourcePath("/readonly")).isEqualTo("/readonly");
            assertThat(plain.resolveResourcePath("")).isEqualTo("/");
        }
    }

    @Nested
    @DisplayName("URL construction")
    class Construction {

        @Test
        @DisplayName("uses forwarded host and scheme")
        void forwardedHeaders() {
            var urls = new ResourceMetadataUrls("", "/mcp");
            var request = StubInboundRequest.post("/readonly")
                    .header("Host", "internal:8082")
                    .header(ResourceMetadataUrls.FORWARDED_HOST, "tools.example.com")
                    .header(ResourceMetadataUrls.FORWARDED_PROTO, "HTTPS");

            assertThat(urls.metadataUrl(request, urls.resolveResourcePath(request.path())))
                    .isEqualTo("https://tools.example.com/.well-known/oauth-protected-resource/mcp/readonly");
            assertThat(urls.resourceUrl(request, "/mcp"))
                    .isEqualTo("https://tools.example.com/mcp");
        }

        @Test
        @DisplayName("falls back to the Host header and TLS flag")
        void hostHeaderFallback() {
            var urls = new ResourceMetadataUrls("", "");
            var request = StubInboundRequest.post("/").header("Host", "gateway.local").secure(true);

            assertThat(urls.metadataUrl(request, "/"))
                    .isEqualTo("https://gateway.local/.well-known/oauth-protected-resource");
        }

        @Test
        @DisplayName("uses localhost over plain HTTP when nothing is known")
        void localhostFallback() {
            var urls = new ResourceMetadataUrls("", "");

            assertThat(urls.resourceUrl(StubInboundRequest.post("/"), "")).isEqualTo("http://localhost/");
        }

        @Test
        @DisplayName("a configured base URL overrides request headers")
        void baseUrlWins() {
            var urls = new ResourceMetadataUrls("https://public.example.com/", "/mcp");
            var request = StubInboundRequest.post("/").header(ResourceMetadataUrls.FORWARDED_HOST, "other");

            assertThat(urls.metadataUrl(request, "/mcp"))
                    .isEqualTo("https://public.example.com/.well-known/oauth-protected-resource/mcp");
        }
    }

    @Nested
    @DisplayName("discovery routes")
    class DiscoveryRoutes {

        private final ResourceMetadataUrls urls = new ResourceMetadataUrls("", "/tools");

        @ParameterizedTest
        @ValueSource(strings = {"", "/", "/readonly", "/x/repos", "/tools", "/tools/insiders",
                "/mcp", "/mcp/x/repos/readonly"})
        @DisplayName("serves the prefix, the configured base and the fallback base")
        void served(String suffix) {
            assertThat(urls.isDiscoveryRoute(suffix)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"/unknown", "/tools/unknown", "/mcp/x", "/mcpfoo"})
        @DisplayName("rejects other suffixes")
        void rejected(String suffix) {
            assertThat(urls.isDiscoveryRoute(suffix)).isFalse();
        }
    }
}
