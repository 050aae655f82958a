package com.keyregistry.groups.util;

import com.keyregistry.groups.exception.InvalidKeyException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.keyregistry.groups.util.TestConstants.*;
import static org.assertj.core.api.Assertions.*;

class RegistryKeyFactoryTest {

    @Nested
    class GroupAddresses {

        @Test
        void groupAddress_WithValidId_UsesGroupPartitionAndMetadataSortKey() {
            // When
            RecordAddress address = RegistryKeyFactory.groupAddress(GROUP_ID);

            // Then
            assertThat(address.getPk()).isEqualTo("GROUP#" + GROUP_ID);
            assertThat(address.getSk()).isEqualTo("METADATA");
            assertThat(address.getProof()).hasSize(64);
        }

        @Test
        void groupAddress_IsDeterministic() {
            assertThat(RegistryKeyFactory.groupAddress(GROUP_ID))
                .isEqualTo(RegistryKeyFactory.groupAddress(GROUP_ID));
        }

        @Test
        void groupAddress_WithUppercaseHex_NormalizesToLowercase() {
            // When
            RecordAddress upper = RegistryKeyFactory.groupAddress(GROUP_ID.toUpperCase());

            // Then
            assertThat(upper).isEqualTo(RegistryKeyFactory.groupAddress(GROUP_ID));
        }

        @Test
        void groupAddress_WithShortId_ThrowsInvalidKey() {
            assertThatThrownBy(() -> RegistryKeyFactory.groupAddress("abc123"))
                .isInstanceOf(InvalidKeyException.class);
        }

        @Test
        void groupAddress_WithNonHexId_ThrowsInvalidKey() {
            String notHex = "z".repeat(64);
            assertThatThrownBy(() -> RegistryKeyFactory.groupAddress(notHex))
                .isInstanceOf(InvalidKeyException.class);
        }

        @Test
        void groupAddress_WithNull_ThrowsInvalidKey() {
            assertThatThrownBy(() -> RegistryKeyFactory.groupAddress(null))
                .isInstanceOf(InvalidKeyException.class);
        }
    }

    @Nested
    class MembershipAddresses {

        @Test
        void membershipAddress_SharesGroupPartition() {
            // When
            RecordAddress membership = RegistryKeyFactory.membershipAddress(GROUP_ID, MEMBER_ID);

            // Then
            assertThat(membership.getPk()).isEqualTo(RegistryKeyFactory.getGroupPk(GROUP_ID));
            assertThat(membership.getSk()).isEqualTo("MEMBER#" + MEMBER_ID);
        }

        @Test
        void membershipAddress_DiffersPerMember() {
            RecordAddress first = RegistryKeyFactory.membershipAddress(GROUP_ID, MEMBER_ID);
            RecordAddress second = RegistryKeyFactory.membershipAddress(GROUP_ID, ADMIN_ID);

            assertThat(first).isNotEqualTo(second);
            assertThat(first.getProof()).isNotEqualTo(second.getProof());
        }

        @Test
        void membershipAddress_WithDelimiterInIdentity_ThrowsInvalidKey() {
            assertThatThrownBy(() -> RegistryKeyFactory.membershipAddress(GROUP_ID, "user#1"))
                .isInstanceOf(InvalidKeyException.class);
        }

        @Test
        void membershipAddress_WithEmptyIdentity_ThrowsInvalidKey() {
            assertThatThrownBy(() -> RegistryKeyFactory.membershipAddress(GROUP_ID, ""))
                .isInstanceOf(InvalidKeyException.class);
        }
    }

    @Nested
    class InviteAndCodeAddresses {

        @Test
        void inviteLinkAddress_KeepsCodeCase() {
            // When
            RecordAddress address = RegistryKeyFactory.inviteLinkAddress(GROUP_ID, INVITE_CODE);

            // Then
            assertThat(address.getSk()).isEqualTo("INVITE#" + INVITE_CODE);
            assertThat(address).isNotEqualTo(RegistryKeyFactory.inviteLinkAddress(GROUP_ID, INVITE_CODE.toLowerCase()));
        }

        @Test
        void inviteLinkAddress_WithSymbols_ThrowsInvalidKey() {
            assertThatThrownBy(() -> RegistryKeyFactory.inviteLinkAddress(GROUP_ID, "abc-1234"))
                .isInstanceOf(InvalidKeyException.class);
        }

        @Test
        void codeLookupAddress_FoldsCase() {
            // When
            RecordAddress upper = RegistryKeyFactory.codeLookupAddress("My-Group");
            RecordAddress lower = RegistryKeyFactory.codeLookupAddress("my-group");

            // Then
            assertThat(upper).isEqualTo(lower);
            assertThat(lower.getPk()).isEqualTo("CODE#my-group");
            assertThat(lower.getSk()).isEqualTo("METADATA");
        }

        @Test
        void codeLookupAddress_WithUnderscore_ThrowsInvalidKey() {
            assertThatThrownBy(() -> RegistryKeyFactory.codeLookupAddress("my_group"))
                .isInstanceOf(InvalidKeyException.class);
        }
    }

    @Nested
    class Proofs {

        @Test
        void matches_WithDerivedValues_ReturnsTrue() {
            RecordAddress address = RegistryKeyFactory.membershipAddress(GROUP_ID, MEMBER_ID);

            assertThat(address.matches(address.getPk(), address.getSk(), address.getProof())).isTrue();
        }

        @Test
        void matches_WithForeignProof_ReturnsFalse() {
            RecordAddress address = RegistryKeyFactory.membershipAddress(GROUP_ID, MEMBER_ID);
            RecordAddress other = RegistryKeyFactory.membershipAddress(GROUP_ID, ADMIN_ID);

            assertThat(address.matches(address.getPk(), address.getSk(), other.getProof())).isFalse();
        }

        @Test
        void proof_SeparatesRecordTypesWithSameComponents() {
            // A group address and a code lookup never share a proof, even for similar inputs
            RecordAddress group = RegistryKeyFactory.groupAddress(GROUP_ID);
            RecordAddress code = RegistryKeyFactory.codeLookupAddress("abc");

            assertThat(group.getProof()).isNotEqualTo(code.getProof());
        }
    }

    @Test
    void gsiKeys_UseMemberAndGroupPrefixes() {
        assertThat(RegistryKeyFactory.getMemberGsi1Pk(MEMBER_ID)).isEqualTo("MEMBER#" + MEMBER_ID);
        assertThat(RegistryKeyFactory.getGroupGsi1Sk(GROUP_ID)).isEqualTo("GROUP#" + GROUP_ID);
        assertThat(RegistryKeyFactory.getPublicGroupGsi2Pk()).isEqualTo("PUBLIC_GROUPS");
    }
}
