package fr.imt.scanzilla.scanzilla.configuration;

import feign.FeignException;
import feign.RetryableException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfiguration {

    /**
     * Retries GitHub calls on server errors, rate limiting and I/O failures. Client errors fail at once.
     */
    @Bean
    public RetryTemplate githubRetryTemplate() {
        return RetryTemplate.builder()
            .maxAttempts(3)
            .exponentialBackoff(1000, 2, 10000)
            .retryOn(FeignException.FeignServerException.class)
            .retryOn(FeignException.TooManyRequests.class)
            .retryOn(RetryableException.class)
            .build();
    }
}
