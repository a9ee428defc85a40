package com.workhub.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;

import java.net.URI;

/**
 * SQS client for the agent queues. Credentials come from the default provider
 * chain; {@code aws.sqs.endpoint} points at a local emulator in development.
 */
@Configuration
@ConditionalOnProperty(name = "hub.agent.enabled", havingValue = "true")
@Slf4j
public class AwsConfig {

    @Value("${aws.region:us-west-2}")
    private String region;

    @Value("${aws.sqs.endpoint:}")
    private String endpoint;

    @Bean(destroyMethod = "close")
    public SqsClient sqsClient() {
        SqsClientBuilder builder = SqsClient.builder().region(Region.of(region));
        if (!endpoint.isEmpty()) {
            log.info("Using SQS endpoint override {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        }
        return builder.build();
    }
}
