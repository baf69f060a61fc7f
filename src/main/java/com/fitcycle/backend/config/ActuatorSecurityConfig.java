package com.fitcycle.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

/** 正式環境的 actuator 走 basic auth，不吃 Telegram initData */
@Configuration
@Profile({"prod", "dev"})
public class ActuatorSecurityConfig {

    @Bean
    @Order(0)
    public SecurityFilterChain actuatorChain(HttpSecurity http) throws Exception {
        http.securityMatcher("/actuator/**")
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers("/actuator/health/**", "/actuator/health").permitAll()
                        .anyRequest().hasRole("ACTUATOR"))
                .httpBasic(Customizer.withDefaults())
                .csrf(AbstractHttpConfigurer::disable);
        return http.build();
    }

    @Bean
    public UserDetailsService actuatorUsers(
            @Value("${app.actuator.user:actuator}") String user,
            @Value("${app.actuator.pass:change-me}") String pass
    ) {
        return new InMemoryUserDetailsManager(
                User.withUsername(user)
                        .password("{noop}" + pass)
                        .roles("ACTUATOR")
                        .build()
        );
    }
}
