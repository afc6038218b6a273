package com.givehub.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.givehub.backend.modules.auth.application.JwtTokenService;
import com.givehub.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.givehub.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer token and re-reads the account so role and revocation changes apply to
 * the very next request.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<String> PUBLIC_AUTH_PATHS = Set.of(
            "/auth/register",
            "/auth/login",
            "/auth/request-otp",
            "/auth/verify-otp"
    );

    private final JwtTokenService jwtTokenService;
    private final UserAccountRepository userAccountRepository;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            UserAccountRepository userAccountRepository,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.jwtTokenService = jwtTokenService;
        this.userAccountRepository = userAccountRepository;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            try {
                ParsedToken parsed = jwtTokenService.parseAccessToken(token);
                Optional<UserAccount> account = userAccountRepository.findById(parsed.userId());
                if (account.isEmpty()) {
                    SecurityContextHolder.clearContext();
                    authenticationEntryPoint.commence(request, response, new BadCredentialsException("User not found"));
                    return;
                }
                authenticate(request, token, account.get());
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response, new BadCredentialsException("Invalid or expired token", ex));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String token, UserAccount user) {
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                user.getId(),
                user.getEmail(),
                user.getRole(),
                user.isOrganizerApproved(),
                user.isOrganizerRevoked()
        );
        List<SimpleGrantedAuthority> authorities = List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name()));

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return PUBLIC_AUTH_PATHS.contains(path) || path.startsWith("/health") || path.startsWith("/actuator");
    }
}
