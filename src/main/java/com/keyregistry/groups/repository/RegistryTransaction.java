package com.keyregistry.groups.repository;

import com.keyregistry.groups.model.BaseItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unit of work: every write one registry operation makes, committed all-or-nothing by
 * {@link GroupRepository#commit(RegistryTransaction)}.
 *
 * <p>Each item is staged at the address derived from its own logical key. Updates and deletes
 * remember the version the item was loaded with so that a concurrent writer is detected at commit.
 */
public final class RegistryTransaction {

    // TransactWriteItems limit
    public static final int MAX_MUTATIONS = 100;

    private final String operation;
    private final List<RecordMutation> mutations = new ArrayList<>();

    private RegistryTransaction(String operation) {
        this.operation = operation;
    }

    public static RegistryTransaction begin(String operation) {
        return new RegistryTransaction(operation);
    }

    public RegistryTransaction create(BaseItem item) {
        return stage(RecordMutation.Type.CREATE, item, null);
    }

    public RegistryTransaction update(BaseItem item) {
        return stage(RecordMutation.Type.UPDATE, item, versionOf(item));
    }

    public RegistryTransaction delete(BaseItem item) {
        return stage(RecordMutation.Type.DELETE, item, versionOf(item));
    }

    private RegistryTransaction stage(RecordMutation.Type type, BaseItem item, Long expectedVersion) {
        if (item == null) {
            throw new IllegalArgumentException("Cannot stage a null item");
        }
        if (mutations.size() >= MAX_MUTATIONS) {
            throw new IllegalStateException("Transaction " + operation + " exceeds " + MAX_MUTATIONS + " mutations");
        }
        mutations.add(new RecordMutation(type, item, expectedVersion));
        return this;
    }

    private static Long versionOf(BaseItem item) {
        return item.getVersion() != null ? item.getVersion() : 0L;
    }

    /**
     * Record every committed mutation's new version on its item.
     * Called by repositories after a successful commit.
     */
    public void markCommitted() {
        for (RecordMutation mutation : mutations) {
            if (mutation.getType() != RecordMutation.Type.DELETE) {
                mutation.getItem().setVersion(mutation.getNextVersion());
            }
        }
    }

    public String getOperation() {
        return operation;
    }

    public List<RecordMutation> getMutations() {
        return Collections.unmodifiableList(mutations);
    }

    public boolean isEmpty() {
        return mutations.isEmpty();
    }

    public int size() {
        return mutations.size();
    }

    @Override
    public String toString() {
        return operation + mutations;
    }
}
