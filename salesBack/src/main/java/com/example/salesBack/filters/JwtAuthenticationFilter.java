package com.example.salesBack.filters;

import com.example.salesBack.dto.ApiResponse;
import com.example.salesBack.exception.ApiException;
import com.example.salesBack.model.AuthenticatedUser;
import com.example.salesBack.service.AuthorizationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

/**
 * Authenticates every protected request from its bearer token. On failure the
 * error envelope is written here with the gate's status (401, 403 or 423) and
 * the chain stops.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final AuthorizationService authorizationService;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(AuthorizationService authorizationService, ObjectMapper objectMapper) {
        this.authorizationService = authorizationService;
        this.objectMapper = objectMapper;
    }

    private static final String[] WHITE_LIST_URLS = {
        "/auth/register",
        "/auth/login",
        "/health",
        "/error"
    };

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return "OPTIONS".equalsIgnoreCase(request.getMethod())
                || Arrays.stream(WHITE_LIST_URLS).anyMatch(url -> path.equals(url) || path.startsWith(url + "/"));
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        AuthenticatedUser identity;
        try {
            identity = authorizationService.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (ApiException e) {
            log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            writeError(response, e);
            return;
        }

        UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                identity, null, Collections.emptyList());
        authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authToken);

        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, ApiException e) throws IOException {
        SecurityContextHolder.clearContext();
        response.setStatus(e.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), ApiResponse.error(e.getMessage()));
    }
}
