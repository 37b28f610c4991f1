package net.myaioutfit.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the remote identity endpoint that resolves bearer tokens to caller ids.
 */
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private String userInfoUrl;
    private String apiKey;
    private Duration timeout = Duration.ofSeconds(10);

    public String getUserInfoUrl() {
        return userInfoUrl;
    }

    public void setUserInfoUrl(String userInfoUrl) {
        this.userInfoUrl = userInfoUrl;
    }

    /**
     * Optional project key sent as the {@code apikey} header.
     */
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
