package com.fitcycle.backend.plan.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(PlanProperties.class)
public class PlanConfig {

    @Bean("sheetRestClient")
    public RestClient sheetRestClient(PlanProperties props) {
        PlanProperties.Sheet sheet = props.getSheet();

        // Google 匯出會先 302 到 googleusercontent，要跟著轉
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(sheet.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(sheet.getReadTimeout());

        return RestClient.builder()
                .baseUrl(sheet.getBaseUrl())
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.ACCEPT, "text/csv")
                .build();
    }
}
