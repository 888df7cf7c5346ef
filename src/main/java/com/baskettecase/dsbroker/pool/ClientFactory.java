package com.baskettecase.dsbroker.pool;

import java.io.Closeable;

/**
 * Builds a network client for a set of connection parameters.
 *
 * The parameters are only valid for the duration of the call; implementations must
 * not keep a reference to them.
 */
@FunctionalInterface
public interface ClientFactory<C extends Closeable> {

    C create(ConnectionParams params) throws Exception;
}
