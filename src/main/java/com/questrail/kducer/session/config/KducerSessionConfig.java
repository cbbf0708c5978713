package com.questrail.kducer.session.config;

import com.questrail.kducer.session.internal.exec.KducerTimingPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for one K-Ducer device session.
 *
 * <p>Connection values mirror the device defaults: Modbus TCP port 502, unit
 * id 1, 5 s connect timeout, 250 ms per-exchange progress timeout and a 100 ms
 * poll interval.</p>
 *
 * <p>{@code reconnectDelay} is the wait before the first reconnect attempt; it
 * doubles on each further failure up to {@code reconnectBackoffCap} and resets
 * once a connection reaches ACTIVE. With the default cap (equal to the delay)
 * there is no growth.</p>
 */
public record KducerSessionConfig(
    String host,
    int port,
    int unitId,
    Duration connectTimeout,
    Duration exchangeTimeout,
    Duration pollInterval,
    Duration reconnectDelay,
    Duration reconnectBackoffCap,
    boolean lockScrewdriverUntilResultFetched,
    boolean lockScrewdriverIndefinitelyAfterResult,
    boolean replaceResultTimestampWithLocalTime,
    boolean fetchGraphs,
    boolean logFailedConnectionsAsWarning,
    KducerTimingPolicy timingPolicy
) {
    public static final int DEFAULT_PORT = 502;
    public static final int DEFAULT_UNIT_ID = 1;

    private static final Duration MIN_EXCHANGE_TIMEOUT = Duration.ofMillis(1);

    public KducerSessionConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(exchangeTimeout, "exchangeTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(reconnectBackoffCap, "reconnectBackoffCap");
        Objects.requireNonNull(timingPolicy, "timingPolicy");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("port must be 1..65535: " + port);
        }
        if (unitId < 0 || unitId > 0xFF) {
            throw new IllegalArgumentException("unitId must be 0..255: " + unitId);
        }
        requirePositive("connectTimeout", connectTimeout);
        requirePositive("exchangeTimeout", exchangeTimeout);
        if (exchangeTimeout.compareTo(MIN_EXCHANGE_TIMEOUT) < 0) {
            throw new IllegalArgumentException("exchangeTimeout must be at least 1 ms: " + exchangeTimeout);
        }
        requirePositive("pollInterval", pollInterval);
        if (reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must be non-negative");
        }
        if (reconnectBackoffCap.compareTo(reconnectDelay) < 0) {
            throw new IllegalArgumentException("reconnectBackoffCap must be >= reconnectDelay");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private int unitId = DEFAULT_UNIT_ID;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration exchangeTimeout = Duration.ofMillis(250);
        private Duration pollInterval = Duration.ofMillis(100);
        private Duration reconnectDelay = Duration.ofMillis(100);
        private Duration reconnectBackoffCap;
        private boolean lockScrewdriverUntilResultFetched = false;
        private boolean lockScrewdriverIndefinitelyAfterResult = false;
        private boolean replaceResultTimestampWithLocalTime = true;
        private boolean fetchGraphs = false;
        private boolean logFailedConnectionsAsWarning = true;
        private KducerTimingPolicy timingPolicy = KducerTimingPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUnitId(int unitId) {
            this.unitId = unitId;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withExchangeTimeout(Duration exchangeTimeout) {
            this.exchangeTimeout = exchangeTimeout;
            return this;
        }

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder withReconnectBackoffCap(Duration reconnectBackoffCap) {
            this.reconnectBackoffCap = reconnectBackoffCap;
            return this;
        }

        public Builder withLockScrewdriverUntilResultFetched(boolean enabled) {
            this.lockScrewdriverUntilResultFetched = enabled;
            return this;
        }

        public Builder withLockScrewdriverIndefinitelyAfterResult(boolean enabled) {
            this.lockScrewdriverIndefinitelyAfterResult = enabled;
            return this;
        }

        public Builder withReplaceResultTimestampWithLocalTime(boolean enabled) {
            this.replaceResultTimestampWithLocalTime = enabled;
            return this;
        }

        public Builder withFetchGraphs(boolean enabled) {
            this.fetchGraphs = enabled;
            return this;
        }

        public Builder withLogFailedConnectionsAsWarning(boolean enabled) {
            this.logFailedConnectionsAsWarning = enabled;
            return this;
        }

        public Builder withTimingPolicy(KducerTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public KducerSessionConfig build() {
            Duration cap = reconnectBackoffCap != null ? reconnectBackoffCap : reconnectDelay;
            return new KducerSessionConfig(host, port, unitId, connectTimeout, exchangeTimeout, pollInterval,
                    reconnectDelay, cap, lockScrewdriverUntilResultFetched, lockScrewdriverIndefinitelyAfterResult,
                    replaceResultTimestampWithLocalTime, fetchGraphs, logFailedConnectionsAsWarning, timingPolicy);
        }
    }
}
