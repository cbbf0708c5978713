package com.questrail.kducer.protocol.modbus;

/**
 * A connection attempt was not established within the configured connect
 * timeout. Retried exactly like any other {@link ModbusTransportException}.
 */
public final class ModbusConnectTimeoutException extends ModbusTransportException
{
    public ModbusConnectTimeoutException(String message) {
        super(message);
    }

    public ModbusConnectTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
