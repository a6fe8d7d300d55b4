package com.certchaperone.backend.modules.identity.infrastructure;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "app.identity.provider", havingValue = "remote")
public class IdentityClientConfig {

    public static final String IDENTITY_REST_CLIENT = "identityRestClient";

    @Bean(name = IDENTITY_REST_CLIENT)
    public RestClient identityRestClient(
            RestClient.Builder builder,
            @Value("${app.identity.remote.base-url}") String baseUrl,
            @Value("${app.identity.remote.service-key}") String serviceKey,
            @Value("${app.identity.remote.connect-timeout:PT2S}") Duration connectTimeout,
            @Value("${app.identity.remote.read-timeout:PT3S}") Duration readTimeout
    ) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader("apikey", serviceKey)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + serviceKey)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
