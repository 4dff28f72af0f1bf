package org.marinchat.security;

import jakarta.servlet.DispatcherType;
import org.marinchat.config.ChatProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

/**
 * Aucun compte : la chaîne sert de liste blanche des routes publiques et pose
 * les en-têtes de durcissement. Toute autre méthode ou chemin répond 404.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, ChatProperties props) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                // CORS géré par CorsHeadersFilter, avant cette chaîne
                .cors(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .headers(h -> h
                        .contentTypeOptions(Customizer.withDefaults())
                        .frameOptions(f -> f.deny())
                        .referrerPolicy(r -> r.policy(ReferrerPolicyHeaderWriter.ReferrerPolicy.NO_REFERRER))
                )
                // refus anonyme = route inconnue
                .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.NOT_FOUND)))
                .authorizeHttpRequests(auth -> auth
                        .dispatcherTypeMatchers(DispatcherType.ERROR).permitAll()

                        // Préflight
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()

                        // Upgrade WebSocket : le pseudo suffit
                        .requestMatchers(HttpMethod.GET, props.getWs().getPath()).permitAll()

                        .requestMatchers(HttpMethod.GET, "/health").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/chat", "/api/transcribe").permitAll()

                        .anyRequest().denyAll()
                );
        return http.build();
    }
}
