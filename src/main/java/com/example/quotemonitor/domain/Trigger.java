package com.example.quotemonitor.domain;

import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * One scheduled firing of the quote check.
 */
@Value
public class Trigger {

    @NonNull
    ZonedDateTime firedAt;

    public static Trigger at(ZonedDateTime firedAt) {
        return new Trigger(firedAt);
    }

    public Instant toInstant() {
        return firedAt.toInstant();
    }
}
