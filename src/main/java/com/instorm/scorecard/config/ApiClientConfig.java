package com.instorm.scorecard.config;

import com.instorm.scorecard.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class ApiClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);

    @Bean
    @Qualifier("scorecardRestTemplate")
    public RestTemplate scorecardRestTemplate(RestTemplateBuilder builder,
                                              SessionState sessionState,
                                              @Value("${scorecard.api.base-url:https://api.instorm.io}") String baseUrl,
                                              @Value("${scorecard.api.connect-timeout:5s}") Duration connectTimeout,
                                              @Value("${scorecard.api.read-timeout:15s}") Duration readTimeout) {
        logger.info("Initializing scorecardRestTemplate for {}", baseUrl);
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors(new BearerTokenInterceptor(sessionState))
                .build();
    }
}
