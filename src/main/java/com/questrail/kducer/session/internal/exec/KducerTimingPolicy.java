package com.questrail.kducer.session.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * KducerTimingPolicy
 * -----------------------------------------------------------------------------
 * Settle delays the device needs between commands.
 *
 * <p>These delays are part of how commands execute on the session loop; they
 * are not exchange timeouts (see
 * {@link com.questrail.kducer.session.config.KducerSessionConfig}).</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>shortSettle</b>: wait after a coil write (stop motor, remote lever)
 *       before the next exchange.</li>
 *   <li><b>programChangeSettle</b>: wait after selecting a different program or
 *       sequence so the device finishes loading it.</li>
 *   <li><b>leverRepressInterval</b>: spacing between remote lever presses while
 *       running the screwdriver until a result appears.</li>
 *   <li><b>permanentMemorySettle</b>: time the reprogram control register is
 *       held at 1 when data is committed to permanent memory.</li>
 * </ul>
 */
public record KducerTimingPolicy(
        Duration shortSettle,
        Duration programChangeSettle,
        Duration leverRepressInterval,
        Duration permanentMemorySettle
) {
    public KducerTimingPolicy {
        Objects.requireNonNull(shortSettle, "shortSettle");
        Objects.requireNonNull(programChangeSettle, "programChangeSettle");
        Objects.requireNonNull(leverRepressInterval, "leverRepressInterval");
        Objects.requireNonNull(permanentMemorySettle, "permanentMemorySettle");

        if (shortSettle.isNegative()) {
            throw new IllegalArgumentException("shortSettle must be non-negative");
        }
        if (programChangeSettle.isNegative()) {
            throw new IllegalArgumentException("programChangeSettle must be non-negative");
        }
        if (leverRepressInterval.isNegative()) {
            throw new IllegalArgumentException("leverRepressInterval must be non-negative");
        }
        if (permanentMemorySettle.isNegative()) {
            throw new IllegalArgumentException("permanentMemorySettle must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>shortSettle: 50ms</li>
     *   <li>programChangeSettle: 300ms</li>
     *   <li>leverRepressInterval: 50ms</li>
     *   <li>permanentMemorySettle: 1000ms</li>
     * </ul>
     */
    public static KducerTimingPolicy defaults() {
        return new KducerTimingPolicy(
                Duration.ofMillis(50),
                Duration.ofMillis(300),
                Duration.ofMillis(50),
                Duration.ofMillis(1000)
        );
    }

    /**
     * All delays zero. Intended for simulated devices in tests.
     */
    public static KducerTimingPolicy immediate() {
        return new KducerTimingPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }
}
