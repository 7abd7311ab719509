package com.skillbridge.mfa.config;

import com.skillbridge.mfa.domain.mfa.VerifiedIdentity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the bearer access token into a {@link VerifiedIdentity} principal.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);
    private final JwtService jwt;

    public JwtAuthFilter(JwtService jwt) {
        this.jwt = jwt;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        return "OPTIONS".equalsIgnoreCase(req.getMethod());
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            // Let Spring Security decide whether the endpoint needs authentication
            chain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(7).trim();
        Optional<String> subject = jwt.getSubject(token);
        if (subject.isEmpty()) {
            log.warn("JwtAuthFilter: Invalid or expired token for: {} {}", request.getMethod(), request.getRequestURI());
            chain.doFilter(request, response);
            return;
        }

        VerifiedIdentity principal = new VerifiedIdentity(subject.get(), jwt.getEmail(token).orElse(null), null);
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        request.setAttribute(RequestLoggingFilter.USER_ID_ATTRIBUTE, principal.userId());
        log.debug("JwtAuthFilter: Authenticated user {} for {} {}",
                principal.userId(), request.getMethod(), request.getRequestURI());

        chain.doFilter(request, response);
    }
}
