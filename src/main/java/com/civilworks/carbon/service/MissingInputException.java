package com.civilworks.carbon.service;

/** A table a stage depends on does not exist. The stage does not start. */
public class MissingInputException extends RuntimeException {
    private final String location;

    public MissingInputException(String location) {
        super("Could not find " + location);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
