package com.workhub.server.service;

import com.workhub.server.model.OutboundFrame;

/**
 * Live duplex transport for one connection, as seen by the hub.
 */
public interface HubChannel {

    String getId();

    boolean isOpen();

    /**
     * Queue a frame for delivery. Never blocks on the network.
     *
     * @return true if the frame was accepted, false if the channel is closed or
     *         its write queue is full
     */
    boolean send(OutboundFrame frame);

    /**
     * Close the underlying transport. Best effort; implementations may throw, and
     * callers that must stay consistent catch and log.
     */
    void close();
}
