package com.questrail.kducer.protocol.modbus.transport;

import java.time.Duration;

/**
 * ModbusTransport
 * -----------------------------------------------------------------------------
 * Blocking, byte-exact stream to one Modbus TCP device.
 *
 * <p>The exchange client is the only caller of {@link #sendAll} and
 * {@link #receiveAll}, and it calls them from a single thread.
 * {@link #close()} may be called from any thread and is the only way to abort
 * an exchange in progress.</p>
 *
 * <p>All failures are reported as
 * {@link com.questrail.kducer.protocol.modbus.ModbusTransportException}
 * (or its subtype
 * {@link com.questrail.kducer.protocol.modbus.ModbusConnectTimeoutException}).
 * After a failure the instance is not reused; the owner closes it and asks its
 * {@link ModbusTransportFactory} for a new one.</p>
 */
public interface ModbusTransport extends AutoCloseable
{
    /**
     * Establish the connection. A no-op when already connected.
     *
     * @param timeout maximum time to wait for the connection to be established
     */
    void connect(Duration timeout);

    /**
     * Write every byte of {@code bytes}. Inbound bytes left over from an earlier
     * exchange are discarded first.
     */
    void sendAll(byte[] bytes);

    /**
     * Block until exactly {@code count} bytes have been received.
     */
    byte[] receiveAll(int count);

    /**
     * Non-blocking connection check.
     */
    boolean isConnected();

    /**
     * Release the connection. Idempotent. A {@link #receiveAll} blocked on
     * another thread fails promptly.
     */
    @Override
    void close();
}
