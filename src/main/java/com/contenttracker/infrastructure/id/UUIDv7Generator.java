package com.contenttracker.infrastructure.id;

import com.contenttracker.application.port.out.IdGenerator;
import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Time-ordered ids for event envelopes, so envelope ids sort in dispatch order.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator;

    public UUIDv7Generator() {
        this.generator = Generators.timeBasedEpochGenerator();
    }

    @Override
    public UUID generate() {
        return generator.generate();
    }

    @Override
    public long extractTimestamp(UUID uuid) {
        // top 48 bits hold unix millis
        return uuid.getMostSignificantBits() >>> 16;
    }
}
