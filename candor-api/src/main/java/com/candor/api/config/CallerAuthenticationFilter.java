package com.candor.api.config;

import com.candor.api.config.GlobalExceptionHandler.ErrorResponse;
import com.candor.core.domain.Principal;
import com.candor.core.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;

/**
 * Resolves the {@code X-Candor-Principal} header into the request's {@code Authentication}.
 *
 * The identity layer in front of the API vouches for the header; this filter only checks
 * that it is a well-formed address. Requests without the header continue anonymously and
 * the authorization rules decide whether that is enough.
 */
public class CallerAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CallerAuthenticationFilter.class);

    static final String ROLE_CALLER = "ROLE_CALLER";

    private final ObjectMapper objectMapper;

    public CallerAuthenticationFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String header = request.getHeader(SecurityConfig.PRINCIPAL_HEADER);
        if (header != null && SecurityContextHolder.getContext().getAuthentication() == null) {
            Principal caller;
            try {
                caller = Principal.of(header.trim());
            } catch (ValidationException e) {
                log.debug("Rejected caller header on {}: {}", request.getRequestURI(), e.getMessage());
                writeError(objectMapper, response, HttpStatus.BAD_REQUEST, e.code(), e.getMessage());
                return;
            }
            PreAuthenticatedAuthenticationToken authentication = new PreAuthenticatedAuthenticationToken(
                    caller, header, AuthorityUtils.createAuthorityList(ROLE_CALLER));
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.trace("Caller {} on {} {}", caller, request.getMethod(), request.getRequestURI());
        }
        filterChain.doFilter(request, response);
    }

    static void writeError(ObjectMapper objectMapper, HttpServletResponse response,
                           HttpStatus status, String code, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ErrorResponse(code, message, Instant.now()));
    }
}
