package com.authmap.watch.spi;

/**
 * Minimal transport SPI: open a watch restricted to one named configuration resource.
 */
public interface WatchClient {

    WatchStream open(String resourceName) throws WatchOpenException;
}
