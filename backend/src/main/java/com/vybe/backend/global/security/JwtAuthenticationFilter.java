package com.vybe.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.vybe.backend.modules.auth.application.AuthService;
import com.vybe.backend.modules.auth.domain.AuthException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bearer access tokens. A token whose session was revoked is rejected even when its
 * signature and expiry are still fine.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    /** Public routes; requests to them never carry credentials that matter. */
    static final List<String> PUBLIC_PATH_PREFIXES = List.of(
            "/auth/phone/",
            "/auth/google",
            "/auth/apple",
            "/auth/refresh",
            "/health",
            "/readyz",
            "/actuator",
            "/v3/api-docs",
            "/swagger-ui"
    );

    private final AuthService authService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(AuthService authService, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.authService = authService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                JwtAuthenticationPrincipal principal = authService.authenticate(token);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, List.of());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (AuthException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.reject(request, response, ex.getKind().status(), ex.getCode(),
                        ex.getDetailMessage());
                return;
            } catch (DataAccessException ex) {
                SecurityContextHolder.clearContext();
                log.error("[AUTH][STORE] session lookup failed path={}", request.getRequestURI(), ex);
                authenticationEntryPoint.reject(request, response, HttpStatus.SERVICE_UNAVAILABLE,
                        "AUTH_UNAVAILABLE", "Authentication is temporarily unavailable");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return PUBLIC_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }
}
