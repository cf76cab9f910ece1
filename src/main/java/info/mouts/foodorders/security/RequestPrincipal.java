package info.mouts.foodorders.security;

import lombok.Value;

/**
 * Authenticated caller of a request, stored as a request attribute by the
 * {@link AuthenticationInterceptor}.
 */
@Value
public class RequestPrincipal {
    public static final String ATTRIBUTE = "info.mouts.foodorders.principal";

    String id;
    boolean admin;

    public static RequestPrincipal user(String id) {
        return new RequestPrincipal(id, false);
    }

    public static RequestPrincipal admin(String id) {
        return new RequestPrincipal(id, true);
    }
}
