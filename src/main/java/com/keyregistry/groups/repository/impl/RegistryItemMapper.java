package com.keyregistry.groups.repository.impl;

import com.keyregistry.groups.exception.InvalidKeyException;
import com.keyregistry.groups.exception.RepositoryException;
import com.keyregistry.groups.model.BaseItem;
import com.keyregistry.groups.model.CodeLookup;
import com.keyregistry.groups.model.Group;
import com.keyregistry.groups.model.GroupMembership;
import com.keyregistry.groups.model.InviteLink;
import com.keyregistry.groups.util.RecordAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Polymorphic mapping between registry records and raw DynamoDB items, keyed on the
 * itemType discriminator. Shared by every GroupRepository implementation so that all
 * stores persist the same item shape.
 *
 * <p>Every item read back is checked against the address its own fields derive. An item
 * stored at any other location, or with a proof that does not match, is rejected.
 */
@Component
public class RegistryItemMapper {

    private static final Logger logger = LoggerFactory.getLogger(RegistryItemMapper.class);

    private final TableSchema<Group> groupSchema;
    private final TableSchema<GroupMembership> membershipSchema;
    private final TableSchema<InviteLink> inviteLinkSchema;
    private final TableSchema<CodeLookup> codeLookupSchema;

    public RegistryItemMapper() {
        this.groupSchema = TableSchema.fromBean(Group.class);
        this.membershipSchema = TableSchema.fromBean(GroupMembership.class);
        this.inviteLinkSchema = TableSchema.fromBean(InviteLink.class);
        this.codeLookupSchema = TableSchema.fromBean(CodeLookup.class);
    }

    /**
     * Serialize an item for writing, stamping the version the write will carry.
     */
    public Map<String, AttributeValue> toAttributeMap(BaseItem item, long version) {
        Map<String, AttributeValue> map;
        if (item instanceof Group) {
            map = groupSchema.itemToMap((Group) item, true);
        } else if (item instanceof GroupMembership) {
            map = membershipSchema.itemToMap((GroupMembership) item, true);
        } else if (item instanceof InviteLink) {
            map = inviteLinkSchema.itemToMap((InviteLink) item, true);
        } else if (item instanceof CodeLookup) {
            map = codeLookupSchema.itemToMap((CodeLookup) item, true);
        } else {
            throw new IllegalArgumentException("Unsupported item class: " + item.getClass().getName());
        }
        Map<String, AttributeValue> result = new HashMap<>(map);
        result.put("version", AttributeValue.builder().n(String.valueOf(version)).build());
        return result;
    }

    /**
     * Primary key of an item as a DynamoDB key map.
     */
    public Map<String, AttributeValue> keyOf(BaseItem item) {
        return keyOf(item.getPk(), item.getSk());
    }

    public Map<String, AttributeValue> keyOf(String pk, String sk) {
        return Map.of(
            "pk", AttributeValue.builder().s(pk).build(),
            "sk", AttributeValue.builder().s(sk).build());
    }

    public Map<String, AttributeValue> keyOf(RecordAddress address) {
        return keyOf(address.getPk(), address.getSk());
    }

    /**
     * Deserialize a DynamoDB item based on its itemType discriminator and verify its address.
     *
     * @throws RepositoryException if the item is untyped or stored at an address it does not derive
     */
    public BaseItem fromAttributeMap(Map<String, AttributeValue> itemMap) {
        AttributeValue typeAttr = itemMap.get("itemType");
        if (typeAttr == null || typeAttr.s() == null) {
            throw new RepositoryException("Missing itemType discriminator on item " + describe(itemMap));
        }

        BaseItem item;
        switch (typeAttr.s()) {
            case "GROUP":
                item = groupSchema.mapToItem(itemMap);
                break;
            case "GROUP_MEMBERSHIP":
                item = membershipSchema.mapToItem(itemMap);
                break;
            case "INVITE_LINK":
                item = inviteLinkSchema.mapToItem(itemMap);
                break;
            case "CODE_LOOKUP":
                item = codeLookupSchema.mapToItem(itemMap);
                break;
            default:
                throw new RepositoryException("Unknown item type " + typeAttr.s() + " on item " + describe(itemMap));
        }

        verifyAddress(item);
        return item;
    }

    public <T extends BaseItem> T fromAttributeMap(Map<String, AttributeValue> itemMap, Class<T> expectedType) {
        BaseItem item = fromAttributeMap(itemMap);
        if (!expectedType.isInstance(item)) {
            throw new RepositoryException("Expected " + expectedType.getSimpleName() + " at "
                + describe(itemMap) + " but found " + item.getItemType());
        }
        return expectedType.cast(item);
    }

    private void verifyAddress(BaseItem item) {
        RecordAddress derived;
        try {
            derived = item.deriveAddress();
        } catch (InvalidKeyException e) {
            logger.error("Stored {} at {}/{} has underivable key fields", item.getItemType(), item.getPk(), item.getSk());
            throw new RepositoryException("Corrupt record at " + item.getPk() + "/" + item.getSk(), e);
        }
        if (!derived.matches(item.getPk(), item.getSk(), item.getAddressProof())) {
            logger.error("Address mismatch for {}: stored {}/{}, derived {}",
                item.getItemType(), item.getPk(), item.getSk(), derived);
            throw new RepositoryException("Record at " + item.getPk() + "/" + item.getSk()
                + " does not match its derived address " + derived);
        }
    }

    private static String describe(Map<String, AttributeValue> itemMap) {
        AttributeValue pk = itemMap.get("pk");
        AttributeValue sk = itemMap.get("sk");
        return (pk != null ? pk.s() : "?") + "/" + (sk != null ? sk.s() : "?");
    }
}
