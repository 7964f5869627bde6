package com.mlld.sdk.transport;

/**
 * Opens a fresh session whenever the current one is missing or dead.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport open();
}
