package com.questrail.kducer.protocol.modbus;

/**
 * The Modbus function codes spoken by the reduced client.
 */
public enum ModbusFunctionCode
{
    READ_HOLDING_REGISTERS(0x03),
    READ_INPUT_REGISTERS(0x04),
    WRITE_SINGLE_COIL(0x05),
    WRITE_SINGLE_REGISTER(0x06),
    WRITE_MULTIPLE_REGISTERS(0x10);

    private static final int EXCEPTION_FLAG = 0x80;

    private final int code;

    ModbusFunctionCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Function code the device echoes when it rejects this request.
     */
    public int exceptionCode() {
        return code | EXCEPTION_FLAG;
    }
}
