package com.keyregistry.groups.exception;

/**
 * Exception thrown when a record is created at an address that is already occupied.
 * This is the only uniqueness check in the registry: group ids, public codes, invite codes
 * and (group, member) pairs all rely on it.
 */
public class AlreadyExistsException extends RuntimeException {

    private final String address;

    public AlreadyExistsException(String address) {
        super("Record already exists at " + address);
        this.address = address;
    }

    public AlreadyExistsException(String address, Throwable cause) {
        super("Record already exists at " + address, cause);
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
