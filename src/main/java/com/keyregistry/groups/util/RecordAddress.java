package com.keyregistry.groups.util;

import java.util.Objects;

/**
 * Deterministic location of a registry record: table keys plus the proof that they
 * were derived from the record's logical key.
 */
public final class RecordAddress {

    private final String pk;
    private final String sk;
    private final String proof;

    RecordAddress(String pk, String sk, String proof) {
        this.pk = pk;
        this.sk = sk;
        this.proof = proof;
    }

    public String getPk() {
        return pk;
    }

    public String getSk() {
        return sk;
    }

    public String getProof() {
        return proof;
    }

    /**
     * True when the stored keys and proof are exactly the ones this address derives.
     */
    public boolean matches(String storedPk, String storedSk, String storedProof) {
        return pk.equals(storedPk) && sk.equals(storedSk) && proof.equals(storedProof);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordAddress)) return false;
        RecordAddress that = (RecordAddress) o;
        return pk.equals(that.pk) && sk.equals(that.sk) && proof.equals(that.proof);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pk, sk, proof);
    }

    @Override
    public String toString() {
        return pk + "/" + sk;
    }
}
