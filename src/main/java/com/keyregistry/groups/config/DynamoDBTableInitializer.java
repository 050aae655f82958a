package com.keyregistry.groups.config;

import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.repository.impl.PolymorphicGroupRepositoryImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.*;

/**
 * Creates the GroupRegistryTable with its indexes on startup when it does not exist yet.
 * Every record type shares the base key and index attributes, so the Group schema
 * describes the whole table.
 */
@Component
@ConditionalOnExpression("${dynamodb.table.init.enabled:true} and '${registry.storage.type:dynamodb}' == 'dynamodb'")
public class DynamoDBTableInitializer implements ApplicationRunner {
    
    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);
    
    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(PolymorphicGroupRepositoryImpl.TABLE_NAME);
    }
    
    void createTableIfNotExists(String tableName) {
        DynamoDbTable<Group> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(Group.class));
        try {
            // Try to describe the table (this will throw an exception if it doesn't exist)
            table.describeTable();
            logger.info("Table {} already exists", tableName);
            
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI(PolymorphicGroupRepositoryImpl.USER_GROUP_INDEX),
                    createGSI(PolymorphicGroupRepositoryImpl.PUBLIC_GROUP_INDEX))
                .build());
            logger.info("Table {} created successfully with GSIs", tableName);
        } catch (DynamoDbException e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }
    
    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
