package com.jmapmail.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Outgoing HTTP client (SNS signing certificates and subscription confirmation)
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient snsRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(5000);
        requestFactory.setReadTimeout(10000);
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
