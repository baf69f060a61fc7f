package com.fitcycle.backend.config.swagger;

import com.fitcycle.backend.auth.security.TelegramInitDataFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;

/**
 * dev / local 才開 swagger；正式環境 springdoc 直接關掉（application.yml）
 * 「Authorize」填的是 Telegram WebApp 的原始 initData 字串
 */
@Configuration
@Profile({"dev", "local"})
public class SwaggerDevSecurityConfig {

    private static final String INIT_DATA_SCHEME = "tgInitData";

    @Bean
    @Order(1)
    public SecurityFilterChain swaggerChain(HttpSecurity http) throws Exception {
        http.securityMatcher("/swagger-ui.html", "/swagger-ui/**", "/v3/api-docs/**")
                .authorizeHttpRequests(reg -> reg.anyRequest().permitAll())
                .csrf(AbstractHttpConfigurer::disable);
        return http.build();
    }

    @Bean
    public OpenAPI fitcycleOpenApi() {
        return new OpenAPI()
                .info(new Info().title("FitCycle API").version("v1"))
                .components(new Components().addSecuritySchemes(INIT_DATA_SCHEME,
                        new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(TelegramInitDataFilter.HEADER)))
                .addSecurityItem(new SecurityRequirement().addList(INIT_DATA_SCHEME));
    }
}
