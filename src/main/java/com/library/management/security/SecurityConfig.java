package com.library.management.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
public class SecurityConfig {

    private static final String ADMIN = "ADMIN";

    @Bean
    SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/error", "/health", "/swagger-ui/**", "/swagger-ui.html", "/v3/api-docs/**").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/users/register").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/books", "/api/v1/books/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/authors", "/api/v1/authors/**").permitAll()

                // catalog maintenance
                .requestMatchers("/api/v1/books", "/api/v1/books/**").hasRole(ADMIN)
                .requestMatchers("/api/v1/authors", "/api/v1/authors/**").hasRole(ADMIN)

                .requestMatchers(HttpMethod.GET, "/api/v1/users").hasRole(ADMIN)
                .requestMatchers(HttpMethod.POST, "/api/v1/users/*/role").hasRole(ADMIN)
                .requestMatchers(HttpMethod.DELETE, "/api/v1/users/*").hasRole(ADMIN)

                .requestMatchers(HttpMethod.GET, "/api/v1/transactions", "/api/v1/transactions/book/**").hasRole(ADMIN)
                .requestMatchers(HttpMethod.PATCH, "/api/v1/transactions/*").hasRole(ADMIN)
                .requestMatchers(HttpMethod.DELETE, "/api/v1/transactions/*").hasRole(ADMIN)
                .anyRequest().authenticated()
            )
            .httpBasic(Customizer.withDefaults());

        return http.build();
    }

    @Bean
    PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
