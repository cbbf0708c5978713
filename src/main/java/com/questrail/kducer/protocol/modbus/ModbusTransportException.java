package com.questrail.kducer.protocol.modbus;

/**
 * The TCP link failed: connect refused or reset, peer closed, no progress on a
 * read or write within the exchange timeout, or the transport was closed under
 * an in-flight exchange.
 *
 * <p>The session treats every occurrence as "reconnect and keep going".</p>
 */
public class ModbusTransportException extends ModbusException
{
    public ModbusTransportException(String message) {
        super(message);
    }

    public ModbusTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
