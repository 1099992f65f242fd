package com.pdftranslator.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates operator calls carrying the shared admin token. With no token configured every
 * admin request stays anonymous and is rejected by the security chain.
 */
@Component
@Slf4j
public class AdminTokenAuthenticationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Admin-Token";
    static final String PRINCIPAL = "admin";

    private final byte[] expectedToken;

    public AdminTokenAuthenticationFilter(@Value("${translator.admin.api-token:}") String apiToken) {
        String token = apiToken == null ? "" : apiToken.trim();
        this.expectedToken = token.getBytes(StandardCharsets.UTF_8);
        if (token.isEmpty()) {
            log.warn("[Security] translator.admin.api-token is not set; admin endpoints are disabled");
        }
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String presented = request.getHeader(HEADER);

        if (presented != null && !presented.isBlank() && SecurityContextHolder.getContext().getAuthentication() == null) {
            if (matches(presented.trim())) {
                UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                        PRINCIPAL,
                        null,
                        List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))
                );
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authToken);
            } else {
                log.warn("[Security] Rejected admin token for {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    boolean matches(String presented) {
        if (expectedToken.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(expectedToken, presented.getBytes(StandardCharsets.UTF_8));
    }
}
