package com.programmersdiary.crondaemon.session;

/**
 * Outbound side of a connected interface.
 */
@FunctionalInterface
public interface SessionTransport {

    void send(String text) throws DeliveryException;
}
