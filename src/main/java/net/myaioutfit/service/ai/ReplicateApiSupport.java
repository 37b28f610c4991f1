package net.myaioutfit.service.ai;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import net.myaioutfit.config.ReplicateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Thin blocking wrapper over the Replicate REST API shared by the generation and removal clients.
 */
@Component
class ReplicateApiSupport {

    private static final Logger log = LoggerFactory.getLogger(ReplicateApiSupport.class);
    private static final String PREFER_WAIT = "wait";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ReplicateProperties properties;

    ReplicateApiSupport(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, ReplicateProperties properties) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    boolean hasApiToken() {
        return StringUtils.hasText(properties.getApiToken());
    }

    ReplicateResponse post(String path, Map<String, Object> body, Duration timeout, boolean preferWait) {
        return execute(webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    applyAuth(headers);
                    if (preferWait) {
                        headers.set("Prefer", PREFER_WAIT);
                    }
                })
                .bodyValue(body)
                .exchangeToMono(this::toResponse),
            "POST " + path, timeout);
    }

    /**
     * GET against a relative path or an absolute URL such as a prediction's {@code urls.get}.
     */
    ReplicateResponse get(String pathOrUrl, Duration timeout) {
        return execute(webClient.get()
                .uri(pathOrUrl)
                .headers(this::applyAuth)
                .exchangeToMono(this::toResponse),
            "GET " + pathOrUrl, timeout);
    }

    private ReplicateResponse execute(Mono<ReplicateResponse> call, String label, Duration timeout) {
        try {
            ReplicateResponse response = call.timeout(timeout).block();
            if (response == null) {
                throw new ReplicateCallException(label + " returned no response", null);
            }
            return response;
        } catch (ReplicateCallException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            Throwable root = Exceptions.unwrap(ex);
            String reason = root instanceof TimeoutException
                ? "timed out after " + timeout.toSeconds() + "s"
                : root.getMessage();
            throw new ReplicateCallException(label + " failed: " + reason, ex);
        }
    }

    private Mono<ReplicateResponse> toResponse(ClientResponse response) {
        int status = response.statusCode().value();
        HttpHeaders headers = response.headers().asHttpHeaders();
        return response.bodyToMono(String.class)
            .map(body -> new ReplicateResponse(status, headers, parse(body)))
            .defaultIfEmpty(new ReplicateResponse(status, headers, null));
    }

    @Nullable
    private JsonNode parse(String body) {
        if (!StringUtils.hasText(body)) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JacksonException ex) {
            log.debug("Ignoring non-JSON Replicate response body: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private void applyAuth(HttpHeaders headers) {
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + properties.getApiToken());
    }
}
