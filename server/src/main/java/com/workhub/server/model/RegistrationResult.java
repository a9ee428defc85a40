package com.workhub.server.model;

import lombok.Value;

@Value
public class RegistrationResult {
    ConnectionEntry entry;
    boolean superseded;
}
