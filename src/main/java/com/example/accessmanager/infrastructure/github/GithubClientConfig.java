package com.example.accessmanager.infrastructure.github;

import com.example.accessmanager.infrastructure.http.HttpProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

@Configuration
public class GithubClientConfig {
    static final String MEDIA_TYPE = "application/vnd.github.v3+json";
    static final String USER_AGENT = "Access Manager";

    @Bean
    @Qualifier("githubRestTemplate")
    public RestTemplate githubRestTemplate(
            RestTemplateBuilder builder, GithubProperties github, HttpProperties http) {
        return builder.rootUri(github.baseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "token " + github.token())
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .setConnectTimeout(http.connectTimeout())
                .setReadTimeout(http.readTimeout())
                // Set at execution time, the default Accept header is replaced by the converters' types.
                .additionalInterceptors(
                        (request, body, execution) -> {
                            request.getHeaders().set(HttpHeaders.ACCEPT, MEDIA_TYPE);
                            return execution.execute(request, body);
                        })
                .build();
    }
}
