package com.clinicdocs.search.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.time.Duration;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.storage.type", havingValue = "s3")
public class StorageConfig {

    @Bean
    public S3Client s3Client(
        @Value("${app.storage.s3.region}") String region,
        @Value("${app.storage.s3.endpoint:}") String endpoint,
        @Value("${app.storage.s3.retry-count:3}") int retryCount,
        @Value("${app.storage.s3.api-call-timeout-seconds:60}") long apiCallTimeoutSeconds) {

        ClientOverrideConfiguration overrides = ClientOverrideConfiguration.builder()
            .retryPolicy(RetryPolicy.forRetryMode(RetryMode.STANDARD).toBuilder().numRetries(retryCount).build())
            .apiCallTimeout(Duration.ofSeconds(apiCallTimeoutSeconds))
            .build();

        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .overrideConfiguration(overrides);

        if (StringUtils.hasText(endpoint)) {
            log.info("Using custom S3 endpoint {}", endpoint);
            builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
        }
        return builder.build();
    }
}
