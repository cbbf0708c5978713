package com.questrail.kducer.api;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;

/**
 * KducerController
 * =============================================================================
 * Caller-facing view of one K-Ducer controller.
 *
 * <h2>Threading</h2>
 * Every method may be called from any thread. Blocking methods queue a command
 * for the session loop and wait for it; commands from all callers execute one
 * at a time in the order they were queued.
 *
 * <h2>Waiting and cancellation</h2>
 * Blocking methods take a {@link CancellationToken}. The session's own
 * shutdown token is always linked underneath it, so {@link #stop()} releases
 * every waiting caller with a {@link java.util.concurrent.CancellationException}.
 * Completion is detected by polling at the session poll interval.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@link com.questrail.kducer.protocol.modbus.ModbusDeviceBusyException}:
 *       the device could not process the command (for example, its menu is
 *       open on the touch screen).</li>
 *   <li>{@link com.questrail.kducer.protocol.modbus.ModbusDeviceException}: the
 *       device rejected the request.</li>
 *   <li>{@link com.questrail.kducer.protocol.modbus.ModbusProtocolException}:
 *       the response did not match the request.</li>
 *   <li>{@link IllegalArgumentException}: a number or data block outside the
 *       limits of the connected firmware.</li>
 * </ul>
 * A lost connection is not a command failure: the session reconnects and runs
 * the command again from the start. A data send with {@code permanent} set may
 * therefore repeat its permanent-memory commit. {@link #runScrewdriverUntilResult}
 * is the exception: it fails with a
 * {@link com.questrail.kducer.protocol.modbus.ModbusTransportException}
 * rather than tighten a second time.
 */
public interface KducerController extends AutoCloseable
{
    void start();

    void stop();

    @Override
    default void close() {
        stop();
    }

    SessionPhase phase();

    boolean isConnected();

    /**
     * Firmware version read on the most recent connection, if any.
     */
    OptionalInt firmwareVersion();

    int getFirmwareVersion(CancellationToken token);

    // ---- program / sequence selection ------------------------------------

    int getProgram(CancellationToken token);

    /**
     * Select {@code program}; returns without writing when it is already
     * active, otherwise waits for the device to load it.
     */
    void selectProgram(int program, CancellationToken token);

    int getSequence(CancellationToken token);

    void selectSequence(int sequence, CancellationToken token);

    // ---- screwdriver -----------------------------------------------------

    /**
     * Stop motor on: the operator's lever is ignored.
     */
    void disableScrewdriver(CancellationToken token);

    void enableScrewdriver(CancellationToken token);

    /**
     * Hold the remote lever until the current program completes and return the
     * resulting tightening. Intended for automatic (fixtured) screwdrivers.
     *
     * @throws com.questrail.kducer.protocol.modbus.ModbusTransportException when
     *         the connection drops while the lever is operated; the command is
     *         not repeated after the reconnect
     */
    TighteningResultEvent runScrewdriverUntilResult(CancellationToken token);

    // ---- results -----------------------------------------------------------

    /**
     * Wait for and remove the oldest result. Keeps waiting through
     * disconnects.
     */
    TighteningResultEvent getResult(CancellationToken token);

    /**
     * @param failFastOnDisconnect throw a
     *        {@link com.questrail.kducer.protocol.modbus.ModbusTransportException}
     *        instead of waiting while the session is not connected
     */
    TighteningResultEvent getResult(CancellationToken token, boolean failFastOnDisconnect);

    Optional<TighteningResultEvent> tryGetResult();

    boolean hasNewResult();

    void clearResultQueue();

    // ---- program, sequence and settings data -------------------------------

    byte[] getActiveProgramData(CancellationToken token);

    byte[] getProgramData(int program, CancellationToken token);

    SortedMap<Integer, byte[]> getAllProgramData(CancellationToken token);

    void sendProgramData(int program, byte[] data, boolean permanent, CancellationToken token);

    void sendMultipleProgramData(Map<Integer, byte[]> programs, boolean permanent, CancellationToken token);

    byte[] getSequenceData(int sequence, CancellationToken token);

    SortedMap<Integer, byte[]> getAllSequenceData(CancellationToken token);

    void sendSequenceData(int sequence, byte[] data, boolean permanent, CancellationToken token);

    void sendMultipleSequenceData(Map<Integer, byte[]> sequences, boolean permanent, CancellationToken token);

    byte[] getGeneralSettings(CancellationToken token);

    void sendGeneralSettings(byte[] settings, boolean permanent, CancellationToken token);

    void sendBarcode(String barcode, CancellationToken token);

    /**
     * Switch the device's graph resolution; while on, results are fetched
     * together with their torque and angle graphs.
     */
    void setHighResGraphMode(boolean enabled, CancellationToken token);

    // ---- convenience overloads for callers that never cancel --------------

    default int getFirmwareVersion() {
        return getFirmwareVersion(CancellationToken.none());
    }

    default void selectProgram(int program) {
        selectProgram(program, CancellationToken.none());
    }

    default int getProgram() {
        return getProgram(CancellationToken.none());
    }

    default void selectSequence(int sequence) {
        selectSequence(sequence, CancellationToken.none());
    }

    default int getSequence() {
        return getSequence(CancellationToken.none());
    }

    default void disableScrewdriver() {
        disableScrewdriver(CancellationToken.none());
    }

    default void enableScrewdriver() {
        enableScrewdriver(CancellationToken.none());
    }

    default TighteningResultEvent getResult() {
        return getResult(CancellationToken.none());
    }

    default TighteningResultEvent runScrewdriverUntilResult() {
        return runScrewdriverUntilResult(CancellationToken.none());
    }

    default byte[] getActiveProgramData() {
        return getActiveProgramData(CancellationToken.none());
    }

    default byte[] getProgramData(int program) {
        return getProgramData(program, CancellationToken.none());
    }

    default SortedMap<Integer, byte[]> getAllProgramData() {
        return getAllProgramData(CancellationToken.none());
    }

    default byte[] getSequenceData(int sequence) {
        return getSequenceData(sequence, CancellationToken.none());
    }

    default SortedMap<Integer, byte[]> getAllSequenceData() {
        return getAllSequenceData(CancellationToken.none());
    }

    default byte[] getGeneralSettings() {
        return getGeneralSettings(CancellationToken.none());
    }

    default void sendProgramData(int program, byte[] data) {
        sendProgramData(program, data, false, CancellationToken.none());
    }

    default void sendSequenceData(int sequence, byte[] data) {
        sendSequenceData(sequence, data, false, CancellationToken.none());
    }

    default void sendGeneralSettings(byte[] settings) {
        sendGeneralSettings(settings, false, CancellationToken.none());
    }

    default void sendBarcode(String barcode) {
        sendBarcode(barcode, CancellationToken.none());
    }

    default void setHighResGraphMode(boolean enabled) {
        setHighResGraphMode(enabled, CancellationToken.none());
    }
}
