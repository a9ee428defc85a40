package com.workhub.server.model;

public enum PresenceStatus {
    ONLINE, OFFLINE
}
