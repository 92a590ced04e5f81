package com.toolgate.security.scope;

import com.toolgate.observability.SecretMasker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link ScopeFetcher} that sends an authenticated HEAD to the REST API root and reads
 * {@value ScopeHeaders#OAUTH_SCOPES} from the response.
 * <p>
 * A HEAD keeps the probe to headers only. Each call is bounded by the configured timeout,
 * since it runs on the request path.
 */
public class HttpScopeFetcher implements ScopeFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpScopeFetcher.class);

    static final String ACCEPT = "application/vnd.github+json";
    static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
    static final String API_VERSION = "2022-11-28";

    private final HttpClient httpClient;
    private final URI apiUrl;
    private final Duration timeout;

    /**
     * @param httpClient shared JDK client
     * @param apiUrl     REST API root, e.g. {@code https://api.github.com/}
     * @param timeout    per-request timeout
     */
    public HttpScopeFetcher(HttpClient httpClient, URI apiUrl, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.apiUrl = Objects.requireNonNull(apiUrl, "apiUrl must not be null");
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
    }

    @Override
    public List<String> fetchScopes(String token) {
        HttpRequest request = HttpRequest.newBuilder(apiUrl)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .timeout(timeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", ACCEPT)
                .header(API_VERSION_HEADER, API_VERSION)
                .build();

        HttpResponse<Void> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new ScopeFetchException(ScopeFetchException.Reason.NETWORK_ERROR,
                    "failed to fetch scopes: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScopeFetchException(ScopeFetchException.Reason.NETWORK_ERROR,
                    "interrupted while fetching scopes", e);
        }

        int status = response.statusCode();
        if (status == 401) {
            throw new ScopeFetchException(ScopeFetchException.Reason.INVALID_CREDENTIAL, status,
                    "invalid or expired token");
        }
        if (status < 200 || status >= 300) {
            throw new ScopeFetchException(ScopeFetchException.Reason.UNEXPECTED_UPSTREAM_STATUS, status,
                    "unexpected status code: " + status);
        }

        List<String> scopes = ScopeHeaders.parseCommaSeparated(
                response.headers().firstValue(ScopeHeaders.OAUTH_SCOPES).orElse(null));
        log.debug("Fetched {} scopes for {}", scopes.size(), SecretMasker.mask(token));
        return scopes;
    }
}
