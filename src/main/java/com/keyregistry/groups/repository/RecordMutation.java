package com.keyregistry.groups.repository;

import com.keyregistry.groups.model.BaseItem;

/**
 * One staged write inside a {@link RegistryTransaction}.
 */
public final class RecordMutation {

    public enum Type {
        /** Write to an empty address; fails if anything lives there. */
        CREATE,
        /** Overwrite a record whose stored version still equals the loaded one. */
        UPDATE,
        /** Remove a record whose stored version still equals the loaded one. */
        DELETE
    }

    private final Type type;
    private final BaseItem item;
    private final Long expectedVersion;

    RecordMutation(Type type, BaseItem item, Long expectedVersion) {
        this.type = type;
        this.item = item;
        this.expectedVersion = expectedVersion;
    }

    public Type getType() {
        return type;
    }

    public BaseItem getItem() {
        return item;
    }

    /**
     * Version the record had when it was loaded; null for creates.
     */
    public Long getExpectedVersion() {
        return expectedVersion;
    }

    /**
     * Version written by this mutation. Records loaded without a version are treated as version 0.
     */
    public long getNextVersion() {
        return expectedVersion == null ? 1L : expectedVersion + 1;
    }

    @Override
    public String toString() {
        return type + " " + item.getItemType() + " " + item.getPk() + "/" + item.getSk();
    }
}
