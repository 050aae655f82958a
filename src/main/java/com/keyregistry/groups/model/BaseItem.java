package com.keyregistry.groups.model;

import com.keyregistry.groups.util.InstantAsEpochSecondsAttributeConverter;
import com.keyregistry.groups.util.RecordAddress;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

import java.time.Instant;

/**
 * Base class for all items stored in the GroupRegistryTable.
 * Provides common attributes for the single-table design pattern.
 */
@DynamoDbBean
public abstract class BaseItem {
    
    private String pk;          // Partition Key
    private String sk;          // Sort Key
    private String gsi1pk;      // GSI1 Partition Key (UserGroupIndex)
    private String gsi1sk;      // GSI1 Sort Key
    private String gsi2pk;      // GSI2 Partition Key (PublicGroupIndex)
    private String gsi2sk;      // GSI2 Sort Key
    private String itemType;    // Type discriminator for polymorphic deserialization
    private String addressProof;
    private Long version;       // Optimistic concurrency, null until first write
    private Instant createdAt;
    private Instant updatedAt;
    
    public BaseItem() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    /**
     * Address this record must live at, recomputed from its logical key fields.
     * Compared against the stored keys and proof whenever the record is read.
     */
    public abstract RecordAddress deriveAddress();
    
    protected void applyAddress(RecordAddress address) {
        this.pk = address.getPk();
        this.sk = address.getSk();
        this.addressProof = address.getProof();
    }
    
    @DynamoDbPartitionKey
    public String getPk() {
        return pk;
    }
    
    public void setPk(String pk) {
        this.pk = pk;
    }
    
    @DynamoDbSortKey
    public String getSk() {
        return sk;
    }
    
    public void setSk(String sk) {
        this.sk = sk;
    }
    
    @DynamoDbSecondaryPartitionKey(indexNames = "UserGroupIndex")
    public String getGsi1pk() {
        return gsi1pk;
    }
    
    public void setGsi1pk(String gsi1pk) {
        this.gsi1pk = gsi1pk;
    }
    
    @DynamoDbSecondarySortKey(indexNames = "UserGroupIndex")  
    public String getGsi1sk() {
        return gsi1sk;
    }
    
    public void setGsi1sk(String gsi1sk) {
        this.gsi1sk = gsi1sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = "PublicGroupIndex")
    public String getGsi2pk() {
        return gsi2pk;
    }

    public void setGsi2pk(String gsi2pk) {
        this.gsi2pk = gsi2pk;
    }

    @DynamoDbSecondarySortKey(indexNames = "PublicGroupIndex")
    public String getGsi2sk() {
        return gsi2sk;
    }

    public void setGsi2sk(String gsi2sk) {
        this.gsi2sk = gsi2sk;
    }

    @DynamoDbAttribute("itemType")
    public String getItemType() {
        return itemType;
    }
    
    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    public String getAddressProof() {
        return addressProof;
    }

    public void setAddressProof(String addressProof) {
        this.addressProof = addressProof;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
    
    @DynamoDbConvertedBy(InstantAsEpochSecondsAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
    
    @DynamoDbConvertedBy(InstantAsEpochSecondsAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    
    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
    
    /**
     * Stamp the record as modified at the given time.
     * Should be called before staging an update.
     */
    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
