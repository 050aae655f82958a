package com.keyregistry.groups.config;

import com.keyregistry.groups.repository.impl.PolymorphicGroupRepositoryImpl;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for DynamoDB connectivity and GroupRegistryTable status.
 */
@Component
@ConditionalOnProperty(name = "registry.storage.type", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDbHealthIndicator implements HealthIndicator {
    
    private final DynamoDbClient dynamoDbClient;
    
    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }
    
    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(PolymorphicGroupRepositoryImpl.TABLE_NAME).build()
            );
            
            TableStatus status = response.table().tableStatus();
            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("registryTable", "ACTIVE")
                    .withDetail("registryTableGsiCount", response.table().globalSecondaryIndexes().size())
                    .build();
            }
            return Health.down()
                .withDetail("registryTable", status.toString())
                .withDetail("reason", PolymorphicGroupRepositoryImpl.TABLE_NAME + " not active")
                .build();
            
        } catch (DynamoDbException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
