package org.caureq.fleethub.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.AuthenticationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Requires {@code Authorization: Bearer <jwt>} on every /api route except login and health,
 * and exposes the caller as the {@link AuthenticatedUser#REQUEST_ATTRIBUTE} attribute.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerTokenFilter extends OncePerRequestFilter {
    private static final List<String> OPEN_PATHS = List.of("/api/auth/login", "/api/health");

    private final TokenService tokens;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        String path = req.getRequestURI();
        return !path.startsWith("/api/") || OPEN_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String header = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            reject(res, "Missing bearer token");
            return;
        }
        try {
            var user = tokens.verifyAccess(header.substring(7).trim());
            req.setAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, user);
        } catch (AuthenticationException e) {
            log.debug("rejected token on {}: {}", req.getRequestURI(), e.getMessage());
            reject(res, "Invalid or expired token");
            return;
        }

        chain.doFilter(req, res);
    }

    static void write(HttpServletResponse res, HttpStatus status, String code, String message) throws IOException {
        res.setStatus(status.value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.getWriter().write("{\"code\":\"" + code + "\",\"message\":\"" + message + "\"}");
    }

    private static void reject(HttpServletResponse res, String message) throws IOException {
        write(res, HttpStatus.UNAUTHORIZED, "AUTHENTICATION_FAILED", message);
    }
}
