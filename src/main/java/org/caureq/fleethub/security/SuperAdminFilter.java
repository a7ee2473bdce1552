package org.caureq.fleethub.security;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.permission.PermissionResolver;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;

/** Guards /api/admin/*: the caller must be a live superadmin. Runs after {@link BearerTokenFilter}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SuperAdminFilter implements Filter {
    private final PermissionResolver resolver;

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {
        var r = (HttpServletRequest) req;
        var w = (HttpServletResponse) res;

        var user = (AuthenticatedUser) r.getAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE);
        if (user == null) {
            BearerTokenFilter.write(w, HttpStatus.UNAUTHORIZED, "AUTHENTICATION_FAILED", "Missing bearer token");
            return;
        }
        if (!resolver.isSuperAdmin(user.userId())) {
            log.warn("user {} denied admin route {}", user.username(), r.getRequestURI());
            BearerTokenFilter.write(w, HttpStatus.FORBIDDEN, "PERMISSION_DENIED", "Superadmin required");
            return;
        }

        chain.doFilter(req, res);
    }
}
