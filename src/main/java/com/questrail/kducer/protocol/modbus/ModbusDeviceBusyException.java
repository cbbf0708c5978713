package com.questrail.kducer.protocol.modbus;

/**
 * Exception code 6, "server busy": the device received the request but could not
 * act on it right now, typically because its configuration menu is open on the
 * touch screen.
 *
 * <p>Never retried by the session. Callers decide whether to try again.</p>
 */
public final class ModbusDeviceBusyException extends ModbusDeviceException
{
    public static final int SERVER_BUSY = 6;

    public ModbusDeviceBusyException(String message) {
        super(SERVER_BUSY, message);
    }
}
