package uk.gegc.assessment.features.auth.infra.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import uk.gegc.assessment.shared.util.ClientIpResolver;

import java.io.IOException;

@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenService jwtTokenService;
    private final ClientIpResolver clientIpResolver;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, ClientIpResolver clientIpResolver) {
        this.jwtTokenService = jwtTokenService;
        this.clientIpResolver = clientIpResolver;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);
            if (jwtTokenService.validateToken(token)) {
                Authentication authentication = jwtTokenService.getAuthentication(token);
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated user {}", authentication.getName());
            } else {
                log.warn("Invalid JWT token received from IP: {}, URI: {}",
                        clientIpResolver.resolve(request),
                        request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
