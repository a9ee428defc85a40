package com.workhub.server.service;

/**
 * A message that cannot be routed as addressed. Thrown before anything is
 * pushed or stored.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }
}
