package com.authmap.watch.spi;

/** Thrown when a watch cannot be established at all. */
public class WatchOpenException extends Exception {

    public WatchOpenException(String message) {
        super(message);
    }

    public WatchOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
