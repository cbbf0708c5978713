package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.CancellationToken;
import com.questrail.kducer.protocol.modbus.client.ModbusExchangeClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything a {@link CommandOperation} may touch while it runs.
 *
 * @param token cancelled when either the caller or the session gives up
 */
public record CommandContext(
        ModbusExchangeClient client,
        SessionState state,
        KducerTimingPolicy timing,
        TighteningResultReader resultReader,
        CancellationToken token
) {
    public CommandContext {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(resultReader, "resultReader");
        Objects.requireNonNull(token, "token");
    }

    public KducerAddressMap addressMap() {
        return state.addressMap();
    }

    /**
     * Cancellable wait between exchanges.
     */
    public void settle(Duration delay) {
        token.sleep(delay);
    }
}
