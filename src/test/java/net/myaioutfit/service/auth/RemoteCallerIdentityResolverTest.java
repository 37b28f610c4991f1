package net.myaioutfit.service.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import net.myaioutfit.config.AuthProperties;
import net.myaioutfit.exception.CallerAuthenticationException;
import net.myaioutfit.exception.PipelineErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class RemoteCallerIdentityResolverTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private AuthProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        properties.setUserInfoUrl("https://auth.example.com/auth/v1/user");
        properties.setApiKey("anon-key");
        properties.setTimeout(Duration.ofSeconds(2));
    }

    private RemoteCallerIdentityResolver resolver(HttpStatus status, String body) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
        };
        return new RemoteCallerIdentityResolver(WebClient.builder().exchangeFunction(exchange), properties);
    }

    @Test
    void should_ReturnUserId_When_TokenIsValid() {
        String callerId = resolver(HttpStatus.OK, "{\"id\":\"7d0c7b9e-user\",\"email\":\"a@example.com\"}")
            .resolveCallerId("valid-token");

        assertThat(callerId).isEqualTo("7d0c7b9e-user");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer valid-token");
        assertThat(requests.get(0).headers().getFirst("apikey")).isEqualTo("anon-key");
    }

    @Test
    void should_RejectWith401_When_AuthServiceRejectsToken() {
        RemoteCallerIdentityResolver resolver = resolver(HttpStatus.UNAUTHORIZED, "{\"msg\":\"invalid JWT\"}");

        assertThatThrownBy(() -> resolver.resolveCallerId("expired"))
            .isInstanceOfSatisfying(CallerAuthenticationException.class, ex -> {
                assertThat(ex.getErrorCode()).isEqualTo(PipelineErrorCode.AUTH_FAILED);
                assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.UNAUTHORIZED);
                assertThat(ex.getMessage()).isEqualTo("Unauthorized");
            });
    }

    @Test
    void should_RejectWith401_When_ResponseHasNoId() {
        RemoteCallerIdentityResolver resolver = resolver(HttpStatus.OK, "{\"email\":\"a@example.com\"}");

        assertThatThrownBy(() -> resolver.resolveCallerId("token"))
            .isInstanceOf(CallerAuthenticationException.class)
            .hasMessage("Unauthorized");
    }

    @Test
    void should_RejectWithoutCalling_When_TokenBlank() {
        RemoteCallerIdentityResolver resolver = resolver(HttpStatus.OK, "{\"id\":\"u1\"}");

        assertThatThrownBy(() -> resolver.resolveCallerId(" "))
            .isInstanceOf(CallerAuthenticationException.class)
            .hasMessage("Missing authorization header");
        assertThat(requests).isEmpty();
    }
}
