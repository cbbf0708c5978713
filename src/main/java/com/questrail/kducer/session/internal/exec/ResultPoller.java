package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.CancellationToken;
import com.questrail.kducer.api.TighteningResultEvent;
import com.questrail.kducer.protocol.modbus.client.ModbusExchangeClient;

import java.util.Objects;
import java.util.Optional;

/**
 * ResultPoller
 * -----------------------------------------------------------------------------
 * The poll step the loop runs on every tick without a queued command.
 *
 * <pre>
 *   flag set   → read result (+ graph), publish, lock the motor if a lock policy is on
 *   flag clear → release a session-held lock once the result queue is drained
 *                (lock-until-fetched only)
 * </pre>
 *
 * <p>Only a lock the session itself placed is released; a stop-motor set by
 * the caller through {@code disableScrewdriver} stays in place.</p>
 */
public final class ResultPoller
{
    private final SessionState state;
    private final ResultQueue resultQueue;
    private final TighteningResultReader reader;
    private final KducerTimingPolicy timing;
    private final boolean lockUntilFetched;
    private final boolean lockIndefinitely;

    public ResultPoller(SessionState state,
                        ResultQueue resultQueue,
                        TighteningResultReader reader,
                        KducerTimingPolicy timing,
                        boolean lockUntilFetched,
                        boolean lockIndefinitely)
    {
        this.state = Objects.requireNonNull(state, "state");
        this.resultQueue = Objects.requireNonNull(resultQueue, "resultQueue");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.lockUntilFetched = lockUntilFetched;
        this.lockIndefinitely = lockIndefinitely;
    }

    /**
     * Read and discard the new-result flag so a result completed before the
     * connection is not reported.
     */
    public void discardPendingFlag(ModbusExchangeClient client)
    {
        client.readInputRegisters(KducerAddressMap.NEW_RESULT_FLAG_ADDRESS, 1);
    }

    public Optional<TighteningResultEvent> pollOnce(ModbusExchangeClient client, CancellationToken token)
    {
        if (readNewResultFlag(client)) {
            TighteningResultEvent event = reader.read(client, state.fetchGraphs());
            resultQueue.publish(event);

            if (lockUntilFetched || lockIndefinitely) {
                client.writeSingleCoil(KducerAddressMap.STOP_MOTOR_COIL, true);
                state.motorLockedBySession(true);
                token.sleep(timing.shortSettle());
            }
            return Optional.of(event);
        }

        if (lockUntilFetched && !lockIndefinitely && state.motorLockedBySession() && resultQueue.isEmpty()) {
            client.writeSingleCoil(KducerAddressMap.STOP_MOTOR_COIL, false);
            state.motorLockedBySession(false);
            token.sleep(timing.shortSettle());
        }
        return Optional.empty();
    }

    /**
     * The flag lives in the low byte of the register; reading it clears it.
     */
    static boolean readNewResultFlag(ModbusExchangeClient client)
    {
        byte[] flag = client.readInputRegisters(KducerAddressMap.NEW_RESULT_FLAG_ADDRESS, 1);
        return (flag[1] & 0xFF) != 0;
    }
}
