package info.mouts.foodorders.security;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import info.mouts.foodorders.exception.AuthenticationRequiredException;
import info.mouts.foodorders.exception.ForbiddenException;
import info.mouts.foodorders.repository.AdminAccountRepository;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the bearer credential of every protected {@code /api} request into
 * a {@link RequestPrincipal}.
 * <p>
 * Under {@code /api/admin} the credential is an administrator id and must name
 * an existing account (403 otherwise). Anywhere else it is an end-user
 * credential checked by the {@link IdentityVerifier} (401 otherwise). A
 * missing credential is always 401.
 * </p>
 */
@Component
@Slf4j
public class AuthenticationInterceptor implements HandlerInterceptor {
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ADMIN_PATH = "/api/admin/";

    private final AdminAccountRepository adminAccountRepository;
    private final IdentityVerifier identityVerifier;

    /**
     * Constructs an instance of {@code AuthenticationInterceptor}.
     *
     * @param adminAccountRepository The repository administrator ids are checked against.
     * @param identityVerifier       The verifier for end-user credentials.
     */
    public AuthenticationInterceptor(AdminAccountRepository adminAccountRepository,
            IdentityVerifier identityVerifier) {
        this.adminAccountRepository = adminAccountRepository;
        this.identityVerifier = identityVerifier;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (HttpMethod.OPTIONS.matches(request.getMethod()) || isPublic(request.getMethod(), path)) {
            return true;
        }

        String token = extractToken(request);
        if (token == null) {
            log.warn("Missing credential on {} {}", request.getMethod(), path);
            throw new AuthenticationRequiredException("Unauthorized");
        }

        RequestPrincipal principal = path.startsWith(ADMIN_PATH) ? authenticateAdmin(token)
                : authenticateUser(token);
        request.setAttribute(RequestPrincipal.ATTRIBUTE, principal);
        return true;
    }

    private RequestPrincipal authenticateAdmin(String token) {
        if (!adminAccountRepository.existsById(token)) {
            log.warn("Rejected unknown administrator credential");
            throw new ForbiddenException("Forbidden - Admin access required");
        }
        return RequestPrincipal.admin(token);
    }

    private RequestPrincipal authenticateUser(String token) {
        return identityVerifier.verify(token)
                .map(RequestPrincipal::user)
                .orElseThrow(() -> new AuthenticationRequiredException("Invalid token"));
    }

    static boolean isPublic(String method, String path) {
        return switch (path) {
            case "/api/health", "/api/admin/login" -> true;
            case "/api/products", "/api/categories" -> HttpMethod.GET.matches(method);
            case "/api/users" -> HttpMethod.POST.matches(method);
            default -> false;
        };
    }

    private static String extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null) {
            return null;
        }
        String token = header.startsWith(BEARER_PREFIX) ? header.substring(BEARER_PREFIX.length()) : header;
        token = token.trim();
        return token.isEmpty() ? null : token;
    }
}
