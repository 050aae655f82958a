package com.keyregistry.groups.model;

import com.keyregistry.groups.util.RecordAddress;
import com.keyregistry.groups.util.RegistryKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.Instant;

/**
 * Maps a human-readable public code to its group.
 *
 * Key Pattern: PK = CODE#{normalizedCode}, SK = METADATA
 */
@DynamoDbBean
public class CodeLookup extends BaseItem {

    private String publicCode;
    private String groupId;

    // Default constructor for DynamoDB
    public CodeLookup() {
        super();
        setItemType("CODE_LOOKUP");
    }

    public CodeLookup(String publicCode, String groupId, Instant createdAt) {
        this();
        this.publicCode = RegistryKeyFactory.normalizePublicCode(publicCode);
        this.groupId = RegistryKeyFactory.normalizeGroupId(groupId);
        setCreatedAt(createdAt);
        setUpdatedAt(createdAt);

        applyAddress(deriveAddress());
    }

    @Override
    public RecordAddress deriveAddress() {
        return RegistryKeyFactory.codeLookupAddress(publicCode);
    }

    public String getPublicCode() {
        return publicCode;
    }

    public void setPublicCode(String publicCode) {
        this.publicCode = publicCode;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }
}
