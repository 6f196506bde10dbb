package com.gameday.leaguedata.exception;

/**
 * A sheet could not be read: the host was unreachable, the response status was not a
 * success, or a local file was missing or unreadable.
 */
public class ResourceFetchException extends RuntimeException {

    private final String location;

    public ResourceFetchException(String location, String message) {
        super(message);
        this.location = location;
    }

    public ResourceFetchException(String location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
