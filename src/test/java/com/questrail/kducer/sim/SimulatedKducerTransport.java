package com.questrail.kducer.sim;

import com.questrail.kducer.protocol.modbus.ModbusTransportException;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransport;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransportFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * SimulatedKducerTransport
 * -----------------------------------------------------------------------------
 * Test-only in-memory {@link ModbusTransport} bound to a {@link SimulatedKducer}.
 *
 * <p>Each {@link #sendAll} is handed to the device immediately; its response is
 * buffered for the following {@link #receiveAll} calls. The transport also
 * checks that exchanges never overlap.</p>
 */
public final class SimulatedKducerTransport implements ModbusTransport {

    private final SimulatedKducer device;

    private byte[] pending = new byte[0];
    private volatile boolean connected;
    private volatile boolean closed;
    private volatile boolean overlapDetected;

    public SimulatedKducerTransport(SimulatedKducer device) {
        this.device = Objects.requireNonNull(device, "device");
    }

    public static ModbusTransportFactory factory(SimulatedKducer device) {
        return (host, port, exchangeTimeout) -> new SimulatedKducerTransport(device);
    }

    @Override
    public void connect(Duration timeout) {
        if (closed) {
            throw new ModbusTransportException("closed");
        }
        if (connected) {
            return;
        }
        if (!device.acceptConnection()) {
            throw new ModbusTransportException("Connection refused");
        }
        connected = true;
    }

    @Override
    public synchronized void sendAll(byte[] bytes) {
        requireConnected();
        if (pending.length > 0) {
            overlapDetected = true;
        }
        if (device.shouldDrop(bytes)) {
            connected = false;
            throw new ModbusTransportException("Connection reset by simulated device");
        }
        pending = device.handle(bytes);
    }

    @Override
    public synchronized byte[] receiveAll(int count) {
        requireConnected();
        if (pending.length < count) {
            throw new ModbusTransportException("Receive timed out after " + pending.length + " of " + count + " bytes");
        }
        byte[] out = Arrays.copyOfRange(pending, 0, count);
        pending = Arrays.copyOfRange(pending, count, pending.length);
        return out;
    }

    @Override
    public boolean isConnected() {
        return connected && !closed;
    }

    @Override
    public void close() {
        closed = true;
        connected = false;
    }

    public boolean overlapDetected() {
        return overlapDetected;
    }

    private void requireConnected() {
        if (closed || !connected) {
            throw new ModbusTransportException("Not connected");
        }
    }
}
