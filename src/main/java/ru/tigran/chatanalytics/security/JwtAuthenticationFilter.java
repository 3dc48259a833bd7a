package ru.tigran.chatanalytics.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Puts the subject of a verified bearer token into the SecurityContext.
 * Requests without a valid token pass through unauthenticated; the security chain rejects them
 * on protected paths. In dev mode every request is authenticated as {@value #DEV_USER}.
 */
@Slf4j
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String DEV_USER = "dev_user";

    private final JwtTokenProvider jwtTokenProvider;
    private final boolean devMode;

    public JwtAuthenticationFilter(
            JwtTokenProvider jwtTokenProvider,
            @Value("${app.security.dev-mode:false}") boolean devMode
    ) {
        this.jwtTokenProvider = jwtTokenProvider;
        this.devMode = devMode;
        if (devMode) {
            log.warn("Security dev mode is ON: bearer tokens are not checked");
        }
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        if (devMode) {
            authenticate(DEV_USER);
        } else {
            String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader("Authorization"));
            if (token != null) {
                jwtTokenProvider.verifiedSubject(token).ifPresent(this::authenticate);
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(String subject) {
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(subject, null, List.of());
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated user: {}", subject);
    }
}
