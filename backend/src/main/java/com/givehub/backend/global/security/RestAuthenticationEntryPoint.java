package com.givehub.backend.global.security;

import java.io.IOException;

import com.givehub.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers missing, malformed, expired or orphaned bearer tokens with a 401 problem body whose
 * code is {@value #UNAUTHORIZED_CODE}. Also called directly by {@link JwtAuthenticationFilter}.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String UNAUTHORIZED_CODE = "unauthorized";

    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        log.debug("Rejected unauthenticated request method={} uri={} reason={}",
                request.getMethod(), request.getRequestURI(), authException.getMessage());
        ProblemResponse problem = ProblemResponse.of(
                HttpStatus.UNAUTHORIZED, UNAUTHORIZED_CODE, authException.getMessage(), request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(problem));
    }
}
