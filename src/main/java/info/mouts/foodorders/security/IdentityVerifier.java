package info.mouts.foodorders.security;

import java.util.Optional;

/**
 * Verifies end-user bearer credentials against the identity service.
 */
public interface IdentityVerifier {
    /**
     * @param token the bearer credential presented by the client
     * @return the principal id the credential belongs to, or empty if the
     *         credential is invalid or could not be checked
     */
    Optional<String> verify(String token);
}
