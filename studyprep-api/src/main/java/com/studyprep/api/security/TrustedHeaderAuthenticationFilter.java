package com.studyprep.api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Authenticates requests from the identity forwarded by the upstream gateway.
 * The gateway owns login and sessions; this service only trusts {@code X-User-Id}
 * (and optionally {@code X-User-Role}) on requests that reach it.
 *
 * Requests without a valid user id stay anonymous.
 */
@Slf4j
public class TrustedHeaderAuthenticationFilter extends OncePerRequestFilter {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            try {
                UUID id = UUID.fromString(userId.trim());
                String role = request.getHeader(USER_ROLE_HEADER);
                String authority = "ROLE_" + (role == null || role.isBlank()
                    ? "STUDENT"
                    : role.trim().toUpperCase(Locale.ROOT));

                Authentication authentication = new UsernamePasswordAuthenticationToken(
                    id.toString(), // Principal name is the user id
                    null,
                    List.of(new SimpleGrantedAuthority(authority))
                );
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("[AUTH] Authenticated from gateway headers | userId={} | authority={}", id, authority);
            } catch (IllegalArgumentException e) {
                log.warn("[AUTH] Ignoring malformed {} header | path={}", USER_ID_HEADER, request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
