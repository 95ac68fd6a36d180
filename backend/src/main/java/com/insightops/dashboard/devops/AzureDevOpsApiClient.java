package com.insightops.dashboard.devops;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightops.dashboard.tenant.DevOpsCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Reactive Azure DevOps REST client shared by all tenants.
 *
 * <p>Credentials are supplied per call, so one client serves every tenant: each
 * request carries Basic authentication built from the tenant's personal access token
 * and targets the tenant's own base URL. The {@code organization} and {@code project}
 * path parameters are filled from the credentials unless the caller overrides them.</p>
 *
 * <p>Transient errors (5xx and 429) are retried up to 3 times with exponential backoff;
 * 401/403 are logged and propagated immediately. Failures are logged at warn level:
 * the polling task that made the call records them on its job.</p>
 */
@Slf4j
@Component
public class AzureDevOpsApiClient {

    private static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);

    private final WebClient webClient;
    private final Duration retryBackoff;

    @Autowired
    public AzureDevOpsApiClient(WebClient.Builder webClientBuilder) {
        this(webClientBuilder, DEFAULT_RETRY_BACKOFF);
    }

    AzureDevOpsApiClient(WebClient.Builder webClientBuilder, Duration retryBackoff) {
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.retryBackoff = retryBackoff;
    }

    /**
     * Executes a GET request against the given endpoint for one tenant.
     *
     * @param credentials the tenant's Azure DevOps connection settings
     * @param endpoint    the endpoint definition from devops-endpoints.yaml
     * @param pathParams  extra path parameters (may be empty)
     * @return a Mono emitting the parsed response body
     */
    public Mono<JsonNode> get(DevOpsCredentials credentials, EndpointDefinition endpoint,
                              Map<String, String> pathParams) {
        return execute(HttpMethod.GET, credentials, endpoint, pathParams, null);
    }

    /**
     * Executes a POST request with a JSON body (e.g. a WIQL query).
     */
    public Mono<JsonNode> post(DevOpsCredentials credentials, EndpointDefinition endpoint,
                               Map<String, String> pathParams, Object body) {
        return execute(HttpMethod.POST, credentials, endpoint, pathParams, body);
    }

    private Mono<JsonNode> execute(HttpMethod httpMethod, DevOpsCredentials credentials,
                                   EndpointDefinition endpoint, Map<String, String> pathParams, Object body) {
        String url = endpoint.buildUrl(credentials.resolvedBaseUrl(), resolvePathParams(credentials, pathParams));
        String organization = credentials.getOrganization();
        log.debug("{} {} [endpoint={}, organization={}]", httpMethod, url, endpoint.getName(), organization);

        WebClient.RequestBodySpec requestSpec = webClient.method(httpMethod)
                .uri(url)
                .header(HttpHeaders.AUTHORIZATION, basicAuth(credentials.getPat()));

        WebClient.RequestHeadersSpec<?> headersSpec = body != null ? requestSpec.bodyValue(body) : requestSpec;

        return headersSpec
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorResume(WebClientResponseException.Unauthorized.class, ex -> {
                    log.warn("Personal access token of organization {} is invalid or expired for endpoint {} (HTTP 401)",
                            organization, endpoint.getName());
                    return Mono.error(ex);
                })
                .onErrorResume(WebClientResponseException.Forbidden.class, ex -> {
                    log.warn("Personal access token of organization {} lacks required scopes for endpoint {} (HTTP 403)",
                            organization, endpoint.getName());
                    return Mono.error(ex);
                })
                .retryWhen(retrySpec(endpoint.getName()))
                .doOnError(e -> log.warn("Error calling endpoint {} for organization {}: {}",
                        endpoint.getName(), organization, e.getMessage()));
    }

    private static Map<String, String> resolvePathParams(DevOpsCredentials credentials,
                                                         Map<String, String> pathParams) {
        Map<String, String> resolved = new HashMap<>();
        resolved.put("organization", credentials.getOrganization());
        resolved.put("project", credentials.getProject());
        if (pathParams != null) {
            resolved.putAll(pathParams);
        }
        return resolved;
    }

    private static String basicAuth(String pat) {
        String token = Base64.getEncoder().encodeToString((":" + pat).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    /**
     * Builds a retry specification with exponential backoff:
     * max 3 retries, starting at the configured backoff and doubling each time.
     * Only retries on server errors (5xx) and rate limiting (429).
     */
    private Retry retrySpec(String endpointName) {
        return Retry.backoff(3, retryBackoff)
                .maxBackoff(retryBackoff.multipliedBy(8))
                .filter(this::isRetryable)
                .doBeforeRetry(signal ->
                        log.warn("Retrying endpoint {} (attempt {}): {}",
                                endpointName,
                                signal.totalRetries() + 1,
                                signal.failure().getMessage()));
    }

    private boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            return status >= 500 || status == 429;
        }
        return false;
    }
}
