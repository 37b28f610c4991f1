/**
 * Configuration for WebClient
 * - Shared builder for Replicate, identity and image-download traffic
 * - Handler timeouts sit above the longest per-call timeout (the 60s blocking prediction)
 */
package net.myaioutfit.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "wardrobe-image-pipeline/0.1";
    private static final int HANDLER_TIMEOUT_SECONDS = 75;

    /**
     * Creates a pre-configured WebClient Builder bean.
     *
     * <p>Callers apply their own, tighter {@code Mono.timeout} per request.</p>
     *
     * @return a WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder() {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(HANDLER_TIMEOUT_SECONDS, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(HANDLER_TIMEOUT_SECONDS, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(HANDLER_TIMEOUT_SECONDS));

        // Generated and processed images stay under the 10MB storage ceiling
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
