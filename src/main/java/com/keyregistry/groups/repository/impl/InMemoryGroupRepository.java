package com.keyregistry.groups.repository.impl;

import com.keyregistry.groups.exception.AlreadyExistsException;
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
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of GroupRepository.
 *
 * <p>Data is NOT persisted across restarts. Items are held in the same attribute-map shape
 * the DynamoDB store writes, through the shared {@link RegistryItemMapper}, so address
 * verification and version checks behave identically.
 *
 * <p>Thread-safety: a commit checks every condition and then applies every mutation while
 * holding the write lock, so concurrent commits are serialized and all-or-nothing.
 */
@Repository
@ConditionalOnProperty(name = "registry.storage.type", havingValue = "memory")
public class InMemoryGroupRepository implements GroupRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGroupRepository.class);
    private static final String STORE_NAME = "memory";
    private static final char KEY_SEPARATOR = '\u0000';

    // pk + separator + sk, ordered so that a partition's sort keys are contiguous
    private final TreeMap<String, Map<String, AttributeValue>> storage = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final RegistryItemMapper itemMapper;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public InMemoryGroupRepository(RegistryItemMapper itemMapper, QueryPerformanceTracker queryTracker) {
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
        return queryTracker.trackQuery("GetItem", STORE_NAME, () -> read(() -> {
            Map<String, AttributeValue> stored = storage.get(storageKey(address.getPk(), address.getSk()));
            return stored == null ? Optional.<T>empty() : Optional.of(itemMapper.fromAttributeMap(stored, type));
        }));
    }

    @Override
    public List<GroupMembership> findMembersByGroupId(String groupId) {
        return partitionQuery(RegistryKeyFactory.getGroupPk(groupId), RegistryKeyFactory.getMemberQueryPrefix(),
            GroupMembership.class);
    }

    @Override
    public List<InviteLink> findInviteLinksByGroupId(String groupId) {
        return partitionQuery(RegistryKeyFactory.getGroupPk(groupId), RegistryKeyFactory.getInviteQueryPrefix(),
            InviteLink.class);
    }

    private <T extends BaseItem> List<T> partitionQuery(String pk, String skPrefix, Class<T> type) {
        String from = storageKey(pk, skPrefix);
        return queryTracker.trackQuery("Query", STORE_NAME, () -> read(() ->
            storage.tailMap(from, true).entrySet().stream()
                .takeWhile(entry -> entry.getKey().startsWith(from))
                .map(entry -> itemMapper.fromAttributeMap(entry.getValue(), type))
                .collect(Collectors.toList())));
    }

    @Override
    public List<GroupMembership> findGroupsByMemberId(String memberId) {
        String gsi1pk = RegistryKeyFactory.getMemberGsi1Pk(memberId);
        return indexQuery(item -> gsi1pk.equals(stringAttribute(item, "gsi1pk")), "gsi1sk", GroupMembership.class);
    }

    @Override
    public List<Group> findPublicGroups() {
        String gsi2pk = RegistryKeyFactory.getPublicGroupGsi2Pk();
        return indexQuery(item -> gsi2pk.equals(stringAttribute(item, "gsi2pk")), "gsi2sk", Group.class);
    }

    private <T extends BaseItem> List<T> indexQuery(Predicate<Map<String, AttributeValue>> partition,
                                                    String sortAttribute, Class<T> type) {
        return queryTracker.trackQuery("Query", STORE_NAME, () -> read(() ->
            storage.values().stream()
                .filter(partition)
                .sorted(Comparator.comparing(item -> String.valueOf(stringAttribute(item, sortAttribute))))
                .map(item -> itemMapper.fromAttributeMap(item, type))
                .collect(Collectors.toList())));
    }

    @Override
    public void commit(RegistryTransaction transaction) {
        if (transaction.isEmpty()) {
            return;
        }
        queryTracker.trackQuery("TransactWriteItems", STORE_NAME, () -> {
            lock.writeLock().lock();
            try {
                for (RecordMutation mutation : transaction.getMutations()) {
                    checkCondition(mutation);
                }
                for (RecordMutation mutation : transaction.getMutations()) {
                    apply(mutation);
                }
                transaction.markCommitted();
                logger.debug("Committed {} with {} mutations", transaction.getOperation(), transaction.size());
            } finally {
                lock.writeLock().unlock();
            }
            return null;
        });
    }

    private void checkCondition(RecordMutation mutation) {
        BaseItem item = mutation.getItem();
        Map<String, AttributeValue> stored = storage.get(storageKey(item.getPk(), item.getSk()));
        String address = item.getPk() + "/" + item.getSk();

        if (mutation.getType() == RecordMutation.Type.CREATE) {
            if (stored != null) {
                throw new AlreadyExistsException(address);
            }
            return;
        }

        if (stored == null || storedVersion(stored) != mutation.getExpectedVersion()) {
            throw new VersionConflictException(item.getItemType() + " at " + address + " changed since it was read");
        }
    }

    private void apply(RecordMutation mutation) {
        BaseItem item = mutation.getItem();
        String key = storageKey(item.getPk(), item.getSk());
        if (mutation.getType() == RecordMutation.Type.DELETE) {
            storage.remove(key);
        } else {
            storage.put(key, itemMapper.toAttributeMap(item, mutation.getNextVersion()));
        }
    }

    private static long storedVersion(Map<String, AttributeValue> stored) {
        AttributeValue version = stored.get("version");
        return version == null || version.n() == null ? 0L : Long.parseLong(version.n());
    }

    private static String stringAttribute(Map<String, AttributeValue> item, String name) {
        AttributeValue value = item.get(name);
        return value == null ? null : value.s();
    }

    private static String storageKey(String pk, String sk) {
        return pk + KEY_SEPARATOR + sk;
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Store a raw item bypassing every condition. Only for seeding fixtures and corruption tests.
     */
    void putRaw(Map<String, AttributeValue> item) {
        lock.writeLock().lock();
        try {
            storage.put(storageKey(stringAttribute(item, "pk"), stringAttribute(item, "sk")), item);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
