package com.umihealth.pos_backend.security;

import com.umihealth.pos_backend.exception.UnauthorizedException;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = "pos.auth.error";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            try {
                TenantContext context = tokenProvider.parseToken(token);

                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        context, null, List.of(new SimpleGrantedAuthority("ROLE_" + context.getRole().name())));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ExpiredJwtException e) {
                log.warn("Expired token on {}", request.getRequestURI());
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, "Token has expired");
            } catch (JwtException | IllegalArgumentException e) {
                log.warn("Invalid token on {}: {}", request.getRequestURI(), e.getMessage());
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, "Invalid token");
            } catch (UnauthorizedException e) {
                log.warn("Rejected token on {}: {}", request.getRequestURI(), e.getMessage());
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, e.getMessage());
            }
        }

        filterChain.doFilter(request, response);
    }
}
