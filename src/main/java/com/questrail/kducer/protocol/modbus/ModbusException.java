package com.questrail.kducer.protocol.modbus;

/**
 * ModbusException
 * -----------------------------------------------------------------------------
 * Root of the failures raised by the reduced Modbus TCP stack.
 *
 * <p>The subtypes are what callers and the session loop branch on:</p>
 * <ul>
 *   <li>{@link ModbusTransportException}: the link is unusable, the session
 *       reconnects</li>
 *   <li>{@link ModbusProtocolException}: one reply was malformed, only the
 *       current exchange fails</li>
 *   <li>{@link ModbusDeviceException}: the device answered with an exception
 *       response</li>
 * </ul>
 */
public class ModbusException extends RuntimeException
{
    public ModbusException(String message) {
        super(message);
    }

    public ModbusException(String message, Throwable cause) {
        super(message, cause);
    }
}
