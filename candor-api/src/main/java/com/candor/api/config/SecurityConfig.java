package com.candor.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Security configuration for the Candor API.
 *
 * Callers are identified by {@link CallerAuthenticationFilter}. Reads, refund claims and
 * the oracle callback are open; every other endpoint needs a caller. Role checks against
 * the roster stay in the case services.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    public static final String PRINCIPAL_HEADER = "X-Candor-Principal";

    static final String UNAUTHENTICATED_CODE = "CASE_401";

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, ObjectMapper objectMapper) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(new CallerAuthenticationFilter(objectMapper), AnonymousAuthenticationFilter.class)
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(callerRequired(objectMapper)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/error").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/decryption/callback").permitAll()
                .requestMatchers("/api/v1/reports/*/refund/**").permitAll()
                .requestMatchers(HttpMethod.GET,
                        "/api/v1/reports/*",
                        "/api/v1/reports/*/decryption",
                        "/api/v1/access/**",
                        "/api/v1/events/**").permitAll()
                .anyRequest().authenticated()
            );

        return http.build();
    }

    private static AuthenticationEntryPoint callerRequired(ObjectMapper objectMapper) {
        return (request, response, e) -> CallerAuthenticationFilter.writeError(objectMapper, response,
                HttpStatus.UNAUTHORIZED, UNAUTHENTICATED_CODE, "Caller identity required: " + PRINCIPAL_HEADER);
    }
}
