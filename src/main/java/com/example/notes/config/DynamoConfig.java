package com.example.notes.config;

import java.net.URI;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Configuration
public class DynamoConfig {
    @Bean
    public DynamoDbClient dynamo(
            @Value("${server.aws.region}") String region,
            @Value("${server.aws.endpoint:}") String endpoint,
            @Value("${server.aws.use-localstack:false}") boolean useLocalstack) {
        var builder = DynamoDbClient.builder().region(Region.of(region));
        if (useLocalstack) {
            builder.endpointOverride(URI.create(endpoint))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("test", "test")));
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoEnhanced(DynamoDbClient dynamo) {
        return DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
    }
}
