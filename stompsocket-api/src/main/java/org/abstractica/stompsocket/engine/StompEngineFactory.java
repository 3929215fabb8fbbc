package org.abstractica.stompsocket.engine;

import java.net.URI;
import java.util.Map;

/**
 * Creates the engine a StompSocket owns for its whole lifetime.
 */
@FunctionalInterface
public interface StompEngineFactory
{
    /**
     * Creates an engine for an endpoint.
     *
     * @param endpoint          the web-socket endpoint
     * @param connectionHeaders headers sent when connecting
     * @return a new engine
     */
    StompEngine create(URI endpoint, Map<String, String> connectionHeaders);
}
