package net.myaioutfit.service.auth;

/**
 * Resolves a bearer token to the caller's user id.
 */
public interface CallerIdentityResolver {

    /**
     * @param bearerToken token without the {@code Bearer } prefix
     * @return caller user id
     * @throws net.myaioutfit.exception.CallerAuthenticationException when the token is missing or invalid
     */
    String resolveCallerId(String bearerToken);
}
