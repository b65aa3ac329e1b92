package com.codematch.core.config;

import com.codematch.core.http.JsonHttpClient;
import com.codematch.matching.HttpVerificationService;
import com.codematch.matching.VerificationService;
import com.codematch.validation.HttpValidationService;
import com.codematch.validation.ValidationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RemoteServicesConfig {

    @Bean
    @ConditionalOnMissingBean(ValidationService.class)
    public ValidationService httpValidationService(CodematchProperties properties, ObjectMapper objectMapper) {
        var remote = properties.getValidation();
        return new HttpValidationService(new JsonHttpClient(
                remote.getUrl(), Duration.ofSeconds(remote.getTimeoutSeconds()), objectMapper));
    }

    @Bean
    @ConditionalOnMissingBean(VerificationService.class)
    public VerificationService httpVerificationService(CodematchProperties properties, ObjectMapper objectMapper) {
        var remote = properties.getMatching();
        return new HttpVerificationService(new JsonHttpClient(
                remote.getUrl(), Duration.ofSeconds(remote.getTimeoutSeconds()), objectMapper));
    }
}
