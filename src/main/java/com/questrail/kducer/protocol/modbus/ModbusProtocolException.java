package com.questrail.kducer.protocol.modbus;

/**
 * A response did not match its request: wrong transaction/protocol/unit id,
 * unexpected length, unexpected function code or byte count.
 *
 * <p>Local to the exchange that produced it. The link itself may still be
 * healthy, so the session does not reconnect on this error.</p>
 */
public final class ModbusProtocolException extends ModbusException
{
    public ModbusProtocolException(String message) {
        super(message);
    }
}
