package com.questrail.kducer.protocol.modbus;

/**
 * The device answered with a Modbus exception response (function code with the
 * high bit set) carrying {@link #exceptionCode()}.
 */
public class ModbusDeviceException extends ModbusException
{
    private final int exceptionCode;

    public ModbusDeviceException(int exceptionCode, String message) {
        super(message);
        this.exceptionCode = exceptionCode;
    }

    /**
     * @return the one-byte Modbus exception code (1..255)
     */
    public int exceptionCode() {
        return exceptionCode;
    }
}
