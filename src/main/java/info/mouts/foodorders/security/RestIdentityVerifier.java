package info.mouts.foodorders.security;

import java.util.Map;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link IdentityVerifier} posting the credential to the identity service's
 * token-info endpoint and reading the principal id from its {@code uid}
 * field.
 */
@Component
@Slf4j
public class RestIdentityVerifier implements IdentityVerifier {
    private static final ParameterizedTypeReference<Map<String, Object>> TOKEN_INFO = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final String verifyUrl;

    /**
     * Constructs an instance of {@code RestIdentityVerifier}.
     *
     * @param restClientBuilder The builder the HTTP client is created from.
     * @param verifyUrl         The token-info endpoint of the identity service.
     */
    public RestIdentityVerifier(RestClient.Builder restClientBuilder,
            @Value("${app.identity.verify-url}") String verifyUrl) {
        this.restClient = restClientBuilder.build();
        this.verifyUrl = verifyUrl;
    }

    @Override
    public Optional<String> verify(String token) {
        try {
            Map<String, Object> tokenInfo = restClient.post()
                    .uri(verifyUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("idToken", token))
                    .retrieve()
                    .body(TOKEN_INFO);

            Object uid = tokenInfo == null ? null : tokenInfo.get("uid");
            if (uid == null || uid.toString().isBlank()) {
                log.warn("Identity service answered without a uid");
                return Optional.empty();
            }
            return Optional.of(uid.toString());
        } catch (RestClientException e) {
            log.warn("Credential verification failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
