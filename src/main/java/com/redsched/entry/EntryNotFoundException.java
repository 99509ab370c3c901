package com.redsched.entry;

/**
 * No definition is stored for the requested entry.
 */
public class EntryNotFoundException extends RuntimeException {

    private final String key;

    public EntryNotFoundException(String key) {
        super("No entry stored at key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
