package com.example.accessmanager.infrastructure.bitwarden;

import com.example.accessmanager.infrastructure.http.HttpProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class BitwardenClientConfig {

    @Bean
    @Qualifier("bitwardenIdentityRestTemplate")
    public RestTemplate bitwardenIdentityRestTemplate(
            RestTemplateBuilder builder, BitwardenProperties bitwarden, HttpProperties http) {
        return builder.rootUri(bitwarden.identityUrl())
                .setConnectTimeout(http.connectTimeout())
                .setReadTimeout(http.readTimeout())
                .build();
    }

    /** API client that authenticates every request with the cached bearer token. */
    @Bean
    @Qualifier("bitwardenApiRestTemplate")
    public RestTemplate bitwardenApiRestTemplate(
            RestTemplateBuilder builder,
            BitwardenProperties bitwarden,
            HttpProperties http,
            BitwardenTokenProvider tokenProvider) {
        return builder.rootUri(bitwarden.apiUrl())
                .setConnectTimeout(http.connectTimeout())
                .setReadTimeout(http.readTimeout())
                .additionalInterceptors(
                        (request, body, execution) -> {
                            request.getHeaders().setBearerAuth(tokenProvider.accessToken());
                            return execution.execute(request, body);
                        })
                .build();
    }
}
