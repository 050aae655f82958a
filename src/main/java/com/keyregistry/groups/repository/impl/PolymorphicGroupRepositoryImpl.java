package com.keyregistry.groups.repository.impl;

import com.keyregistry.groups.exception.AlreadyExistsException;
import com.keyregistry.groups.exception.RepositoryException;
import com.keyregistry.groups.exception.TransactionFailedException;
import com.keyregistry.groups.exception.VersionConflictException;
import com.keyregistry.groups.model.BaseItem;
import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.InviteLink;
import com.keyregistry.groups.repository.GroupRepository;
import com.keyregistry.groups.repository.RecordMutation;
import com.keyregistry.groups.repository.RegistryTransaction;
import com.keyregistry.groups.util.QueryPerformanceTracker;
import com.keyregistry.groups.util.RecordAddress;
import com.keyregistry.groups.util.RegistryKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DynamoDB implementation of GroupRepository over the single GroupRegistryTable.
 * Items are deserialized polymorphically by their itemType discriminator, and every
 * {@link RegistryTransaction} is executed as a single TransactWriteItems call.
 */
@Repository
@ConditionalOnProperty(name = "registry.storage.type", havingValue = "dynamodb", matchIfMissing = true)
public class PolymorphicGroupRepositoryImpl implements GroupRepository {

    private static final Logger logger = LoggerFactory.getLogger(PolymorphicGroupRepositoryImpl.class);
    public static final String TABLE_NAME = "GroupRegistryTable";
    public static final String USER_GROUP_INDEX = "UserGroupIndex";
    public static final String PUBLIC_GROUP_INDEX = "PublicGroupIndex";

    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

    private final DynamoDbClient dynamoDbClient;
    private final RegistryItemMapper itemMapper;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public PolymorphicGroupRepositoryImpl(DynamoDbClient dynamoDbClient, RegistryItemMapper itemMapper,
                                          QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.itemMapper = itemMapper;
        this.queryTracker = queryTracker;
    }

    @Override
    public Optional<Group> findGroup(String groupId) {
        return getItem(RegistryKeyFactory.groupAddress(groupId), Group.class);
    }

    @Override
    public Optional<GroupMembership> findMembership(String groupId, String memberId) {
        return getItem(RegistryKeyFactory.membershipAddress(groupId, memberId), GroupMembership.class);
    }

    @Override
    public Optional<InviteLink> findInviteLink(String groupId, String inviteCode) {
        return getItem(RegistryKeyFactory.inviteLinkAddress(groupId, inviteCode), InviteLink.class);
    }

    @Override
    public Optional<CodeLookup> findCodeLookup(String publicCode) {
        return getItem(RegistryKeyFactory.codeLookupAddress(publicCode), CodeLookup.class);
    }

    private <T extends BaseItem> Optional<T> getItem(RecordAddress address, Class<T> type) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(itemMapper.keyOf(address))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(itemMapper.fromAttributeMap(response.item(), type));

            } catch (DynamoDbException e) {
                logger.error("Failed to read {} at {}", type.getSimpleName(), address, e);
                throw new RepositoryException("Failed to retrieve " + type.getSimpleName(), e);
            }
        });
    }

    @Override
    public List<GroupMembership> findMembersByGroupId(String groupId) {
        return queryGroupCollection(groupId, RegistryKeyFactory.getMemberQueryPrefix(), GroupMembership.class);
    }

    @Override
    public List<InviteLink> findInviteLinksByGroupId(String groupId) {
        return queryGroupCollection(groupId, RegistryKeyFactory.getInviteQueryPrefix(), InviteLink.class);
    }

    private <T extends BaseItem> List<T> queryGroupCollection(String groupId, String skPrefix, Class<T> type) {
        String pk = RegistryKeyFactory.getGroupPk(groupId);
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :sk_prefix)")
                    .expressionAttributeValues(Map.of(
                        ":pk", AttributeValue.builder().s(pk).build(),
                        ":sk_prefix", AttributeValue.builder().s(skPrefix).build()
                    ))
                    .build();

                return queryAll(request, type);

            } catch (DynamoDbException e) {
                logger.error("Failed to query {} records for group {}", type.getSimpleName(), groupId, e);
                throw new RepositoryException("Failed to retrieve " + type.getSimpleName() + " records", e);
            }
        });
    }

    @Override
    public List<GroupMembership> findGroupsByMemberId(String memberId) {
        String gsi1pk = RegistryKeyFactory.getMemberGsi1Pk(memberId);
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(USER_GROUP_INDEX)
                    .keyConditionExpression("gsi1pk = :gsi1pk")
                    .expressionAttributeValues(Map.of(
                        ":gsi1pk", AttributeValue.builder().s(gsi1pk).build()
                    ))
                    .build();

                return queryAll(request, GroupMembership.class);

            } catch (DynamoDbException e) {
                logger.error("Failed to find groups for member {}", memberId, e);
                throw new RepositoryException("Failed to retrieve member groups", e);
            }
        });
    }

    @Override
    public List<Group> findPublicGroups() {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(PUBLIC_GROUP_INDEX)
                    .keyConditionExpression("gsi2pk = :gsi2pk")
                    .expressionAttributeValues(Map.of(
                        ":gsi2pk", AttributeValue.builder().s(RegistryKeyFactory.getPublicGroupGsi2Pk()).build()
                    ))
                    .build();

                return queryAll(request, Group.class);

            } catch (DynamoDbException e) {
                logger.error("Failed to query public groups", e);
                throw new RepositoryException("Failed to retrieve public groups", e);
            }
        });
    }

    private <T extends BaseItem> List<T> queryAll(QueryRequest request, Class<T> type) {
        List<T> results = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest page = startKey == null ? request : request.toBuilder().exclusiveStartKey(startKey).build();
            QueryResponse response = dynamoDbClient.query(page);
            for (Map<String, AttributeValue> item : response.items()) {
                results.add(itemMapper.fromAttributeMap(item, type));
            }
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey() : null;
        } while (startKey != null);
        return results;
    }

    @Override
    public void commit(RegistryTransaction transaction) {
        if (transaction.isEmpty()) {
            return;
        }
        queryTracker.trackQuery("TransactWriteItems", TABLE_NAME, () -> {
            List<RecordMutation> mutations = transaction.getMutations();
            try {
                List<TransactWriteItem> transactItems = new ArrayList<>();
                for (RecordMutation mutation : mutations) {
                    transactItems.add(toTransactItem(mutation));
                }

                TransactWriteItemsRequest transactRequest = TransactWriteItemsRequest.builder()
                    .transactItems(transactItems)
                    .build();

                dynamoDbClient.transactWriteItems(transactRequest);
                transaction.markCommitted();

                logger.debug("Committed {} with {} mutations", transaction.getOperation(), mutations.size());

            } catch (TransactionCanceledException e) {
                logger.warn("Transaction {} cancelled: {}", transaction.getOperation(), e.cancellationReasons());
                throw translateCancellation(transaction, e);
            } catch (DynamoDbException e) {
                logger.error("DynamoDB error while committing {}", transaction.getOperation(), e);
                throw new TransactionFailedException("Failed to commit " + transaction.getOperation(), e);
            }
            return null;
        });
    }

    private TransactWriteItem toTransactItem(RecordMutation mutation) {
        BaseItem item = mutation.getItem();
        switch (mutation.getType()) {
            case CREATE:
                return TransactWriteItem.builder()
                    .put(Put.builder()
                        .tableName(TABLE_NAME)
                        .item(itemMapper.toAttributeMap(item, mutation.getNextVersion()))
                        .conditionExpression("attribute_not_exists(pk)")
                        .build())
                    .build();
            case UPDATE:
                return TransactWriteItem.builder()
                    .put(Put.builder()
                        .tableName(TABLE_NAME)
                        .item(itemMapper.toAttributeMap(item, mutation.getNextVersion()))
                        .conditionExpression(versionCondition(mutation))
                        .expressionAttributeValues(versionValues(mutation))
                        .build())
                    .build();
            case DELETE:
                return TransactWriteItem.builder()
                    .delete(Delete.builder()
                        .tableName(TABLE_NAME)
                        .key(itemMapper.keyOf(item))
                        .conditionExpression(versionCondition(mutation))
                        .expressionAttributeValues(versionValues(mutation))
                        .build())
                    .build();
            default:
                throw new IllegalArgumentException("Unsupported mutation type: " + mutation.getType());
        }
    }

    // Version 0 stands for a record written before versioning, which carries no version attribute
    private static String versionCondition(RecordMutation mutation) {
        return mutation.getExpectedVersion() == 0L
            ? "attribute_exists(pk) AND (attribute_not_exists(version) OR version = :expected_version)"
            : "attribute_exists(pk) AND version = :expected_version";
    }

    private static Map<String, AttributeValue> versionValues(RecordMutation mutation) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":expected_version",
            AttributeValue.builder().n(String.valueOf(mutation.getExpectedVersion())).build());
        return values;
    }

    /**
     * Map the first failed condition to the registry error it stands for.
     */
    private RuntimeException translateCancellation(RegistryTransaction transaction, TransactionCanceledException e) {
        List<RecordMutation> mutations = transaction.getMutations();
        List<CancellationReason> reasons = e.hasCancellationReasons() ? e.cancellationReasons() : List.of();
        for (int i = 0; i < reasons.size() && i < mutations.size(); i++) {
            if (!CONDITIONAL_CHECK_FAILED.equals(reasons.get(i).code())) {
                continue;
            }
            RecordMutation failed = mutations.get(i);
            BaseItem item = failed.getItem();
            String address = item.getPk() + "/" + item.getSk();
            if (failed.getType() == RecordMutation.Type.CREATE) {
                return new AlreadyExistsException(address, e);
            }
            return new VersionConflictException(
                item.getItemType() + " at " + address + " changed since it was read", e);
        }
        return new TransactionFailedException("Transaction " + transaction.getOperation() + " was cancelled", e);
    }
}
