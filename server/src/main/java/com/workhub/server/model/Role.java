package com.workhub.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum Role {
    MANAGER, WORKER;

    @JsonCreator
    public static Role fromString(String value) {
        if (value == null) {
            return null;
        }
        return Role.valueOf(value.trim().toUpperCase());
    }
}
