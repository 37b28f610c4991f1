package net.myaioutfit.service.auth;

import java.time.Duration;
import net.myaioutfit.config.AuthProperties;
import net.myaioutfit.exception.CallerAuthenticationException;
import net.myaioutfit.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;

/**
 * Resolves callers through the auth service's user-info endpoint, reading the {@code id} field.
 */
@Service
public class RemoteCallerIdentityResolver implements CallerIdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(RemoteCallerIdentityResolver.class);
    private static final String API_NAME = "AUTH";

    private final WebClient webClient;
    private final AuthProperties properties;

    public RemoteCallerIdentityResolver(WebClient.Builder webClientBuilder, AuthProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public String resolveCallerId(String bearerToken) {
        if (!StringUtils.hasText(bearerToken)) {
            throw CallerAuthenticationException.unauthenticated("Missing authorization header");
        }
        if (!StringUtils.hasText(properties.getUserInfoUrl())) {
            log.error("auth.user-info-url is not configured; rejecting every caller");
            throw CallerAuthenticationException.unauthenticated("Authentication is not configured");
        }

        long started = System.nanoTime();
        JsonNode user;
        try {
            user = webClient.get()
                .uri(properties.getUserInfoUrl())
                .headers(headers -> {
                    headers.setBearerAuth(bearerToken);
                    if (StringUtils.hasText(properties.getApiKey())) {
                        headers.set("apikey", properties.getApiKey());
                    }
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.getTimeout())
                .onErrorResume(WebClientResponseException.class, ex -> {
                    ExternalApiLogger.logApiCallFailure(log, API_NAME, "user-info", properties.getUserInfoUrl(),
                        "HTTP " + ex.getStatusCode().value());
                    return Mono.empty();
                })
                .block();
        } catch (RuntimeException ex) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "user-info", properties.getUserInfoUrl(), ex.getMessage());
            throw CallerAuthenticationException.unauthenticated("Unable to verify caller", ex);
        }

        JsonNode id = user != null ? user.get("id") : null;
        if (id == null || !id.isString() || id.asString().isBlank()) {
            throw CallerAuthenticationException.unauthenticated("Unauthorized");
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "user-info", properties.getUserInfoUrl(),
            Duration.ofNanos(System.nanoTime() - started).toMillis());
        return id.asString();
    }
}
