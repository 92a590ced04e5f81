package com.toolgate.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolgate.lockdown.GitHubRepoAccessClient;
import com.toolgate.lockdown.RepoAccessQuery;
import com.toolgate.lockdown.RepoAccessQueryException;
import java.net.http.HttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PipelineConfig")
class PipelineConfigTest {

    private final HttpClient httpClient = mock(HttpClient.class);
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static UpstreamProperties upstream(String lockdownToken) {
        return new UpstreamProperties(null, null, null, null, null, lockdownToken);
    }

    @Nested
    @DisplayName("repository access lookups")
    class RepoAccessLookups {

        @Test
        @DisplayName("query upstream with the configured lockdown token")
        void configuredToken() {
            RepoAccessQuery query = PipelineConfig.repoAccessQuery(httpClient, objectMapper, upstream("ghs_service"));

            assertThat(query).isInstanceOf(GitHubRepoAccessClient.class);
        }

        @Test
        @DisplayName("fail without contacting upstream when no lockdown token is set")
        void blankTokenDisablesLookups() {
            RepoAccessQuery query = PipelineConfig.repoAccessQuery(httpClient, objectMapper, upstream(" "));

            assertThatThrownBy(() -> query.query("alice", "octo", "hello"))
                    .isInstanceOfSatisfying(RepoAccessQueryException.class,
                            e -> assertThat(e.repository()).isEqualTo("octo/hello"))
                    .hasMessageContaining("lockdown lookups are disabled");
            verifyNoInteractions(httpClient);
        }

        @Test
        @DisplayName("treat a missing lockdown token like a blank one")
        void missingTokenDisablesLookups() {
            RepoAccessQuery query = PipelineConfig.repoAccessQuery(httpClient, objectMapper, upstream(null));

            assertThatThrownBy(() -> query.query("alice", "octo", "hello"))
                    .isInstanceOf(RepoAccessQueryException.class);
        }
    }
}
