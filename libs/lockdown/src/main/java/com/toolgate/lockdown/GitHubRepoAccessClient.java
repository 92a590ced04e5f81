package com.toolgate.lockdown;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * {@link RepoAccessQuery} backed by the GraphQL API.
 * <p>
 * One query returns the viewer login, the repository visibility and the first collaborator edge
 * matching the actor. Push access means a WRITE, MAINTAIN or ADMIN permission on an edge whose
 * login equals the actor, ignoring case.
 */
public class GitHubRepoAccessClient implements RepoAccessQuery {

    private static final Logger log = LoggerFactory.getLogger(GitHubRepoAccessClient.class);

    static final String QUERY = """
            query($owner: String!, $name: String!, $username: String!) {
              viewer { login }
              repository(owner: $owner, name: $name) {
                isPrivate
                collaborators(query: $username, first: 1) {
                  edges { permission node { login } }
                }
              }
            }""";

    private static final Set<String> PUSH_PERMISSIONS = Set.of("WRITE", "MAINTAIN", "ADMIN");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI graphqlUrl;
    private final String token;
    private final Duration timeout;

    /**
     * @param token credential the queries run as; its login is what {@code viewer.login} reports
     */
    public GitHubRepoAccessClient(HttpClient httpClient, ObjectMapper objectMapper, URI graphqlUrl,
                                  String token, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.graphqlUrl = Objects.requireNonNull(graphqlUrl, "graphqlUrl must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public RepoAccessInfo query(String actor, String owner, String repo) {
        String repository = owner + "/" + repo;
        HttpRequest request = HttpRequest.newBuilder(graphqlUrl)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(actor, owner, repo), StandardCharsets.UTF_8))
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RepoAccessQueryException(repository, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepoAccessQueryException(repository, "interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RepoAccessQueryException(repository, "unexpected status code: " + response.statusCode());
        }
        return parse(repository, actor, response.body());
    }

    private String requestBody(String actor, String owner, String repo) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", QUERY);
        ObjectNode variables = body.putObject("variables");
        variables.put("owner", owner);
        variables.put("name", repo);
        variables.put("username", actor);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RepoAccessQueryException(owner + "/" + repo, "cannot encode query", e);
        }
    }

    private RepoAccessInfo parse(String repository, String actor, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RepoAccessQueryException(repository, "invalid response body", e);
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new RepoAccessQueryException(repository, errors.get(0).path("message").asText("graphql error"));
        }

        JsonNode data = root.path("data");
        JsonNode repositoryNode = data.path("repository");
        if (repositoryNode.isMissingNode() || repositoryNode.isNull()) {
            throw new RepoAccessQueryException(repository, "repository not found");
        }

        boolean hasPush = false;
        for (JsonNode edge : repositoryNode.path("collaborators").path("edges")) {
            if (actor.equalsIgnoreCase(edge.path("node").path("login").asText())) {
                hasPush = PUSH_PERMISSIONS.contains(edge.path("permission").asText());
                break;
            }
        }

        RepoAccessInfo info = new RepoAccessInfo(
                repositoryNode.path("isPrivate").asBoolean(false),
                hasPush,
                data.path("viewer").path("login").asText(null));
        log.debug("Queried access facts for {}: private={}, push={}", repository, info.isPrivate(), info.hasPushAccess());
        return info;
    }
}
