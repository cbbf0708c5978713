package com.questrail.kducer.protocol.modbus.codec;

import com.questrail.kducer.protocol.modbus.ModbusFunctionCode;

import java.util.Arrays;
import java.util.Objects;

/**
 * ModbusRequest
 * -----------------------------------------------------------------------------
 * One outbound request, before wire encoding.
 *
 * <p>{@code payload} is the PDU data following the function code.
 * {@code expectedResponseLength} is the value the response MBAP length field
 * must carry on success: unit id + function code + response data.</p>
 *
 * <p>Instances are created through the factory methods, which enforce the
 * Modbus quantity limits for each function.</p>
 */
public record ModbusRequest(
        int transactionId,
        int unitId,
        ModbusFunctionCode functionCode,
        byte[] payload,
        int expectedResponseLength
) {
    public static final int MAX_READ_REGISTERS = 125;
    public static final int MAX_WRITE_REGISTERS = 123;

    private static final int WRITE_RESPONSE_LENGTH = 1 + 1 + 2 + 2;
    private static final int COIL_ON = 0xFF00;
    private static final int COIL_OFF = 0x0000;

    public ModbusRequest {
        Objects.requireNonNull(functionCode, "functionCode");
        Objects.requireNonNull(payload, "payload");
        requireRange("transactionId", transactionId, 0, 0xFFFF);
        requireRange("unitId", unitId, 0, 0xFF);
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Read {@code count} holding (FC 3) or input (FC 4) registers.
     */
    public static ModbusRequest readRegisters(int transactionId, int unitId, ModbusFunctionCode functionCode,
                                              int address, int count)
    {
        if (functionCode != ModbusFunctionCode.READ_HOLDING_REGISTERS
                && functionCode != ModbusFunctionCode.READ_INPUT_REGISTERS) {
            throw new IllegalArgumentException("Not a register read: " + functionCode);
        }
        requireRange("address", address, 0, 0xFFFF);
        requireRange("count", count, 1, MAX_READ_REGISTERS);

        byte[] payload = new byte[4];
        ModbusBytes.writeUnsignedShort(address, payload, 0);
        ModbusBytes.writeUnsignedShort(count, payload, 2);

        return new ModbusRequest(transactionId, unitId, functionCode, payload, 1 + 1 + 1 + count * 2);
    }

    public static ModbusRequest writeSingleCoil(int transactionId, int unitId, int address, boolean value) {
        requireRange("address", address, 0, 0xFFFF);

        byte[] payload = new byte[4];
        ModbusBytes.writeUnsignedShort(address, payload, 0);
        ModbusBytes.writeUnsignedShort(value ? COIL_ON : COIL_OFF, payload, 2);

        return new ModbusRequest(transactionId, unitId, ModbusFunctionCode.WRITE_SINGLE_COIL,
                payload, WRITE_RESPONSE_LENGTH);
    }

    public static ModbusRequest writeSingleRegister(int transactionId, int unitId, int address, int value) {
        requireRange("address", address, 0, 0xFFFF);
        requireRange("value", value, 0, 0xFFFF);

        byte[] payload = new byte[4];
        ModbusBytes.writeUnsignedShort(address, payload, 0);
        ModbusBytes.writeUnsignedShort(value, payload, 2);

        return new ModbusRequest(transactionId, unitId, ModbusFunctionCode.WRITE_SINGLE_REGISTER,
                payload, WRITE_RESPONSE_LENGTH);
    }

    /**
     * Write raw register bytes starting at {@code address}. {@code data} must hold
     * a whole number of registers.
     */
    public static ModbusRequest writeMultipleRegisters(int transactionId, int unitId, int address, byte[] data) {
        Objects.requireNonNull(data, "data");
        requireRange("address", address, 0, 0xFFFF);
        if (data.length == 0 || data.length % 2 != 0) {
            throw new IllegalArgumentException("Register data must be a non-empty, even number of bytes: " + data.length);
        }
        int count = data.length / 2;
        requireRange("count", count, 1, MAX_WRITE_REGISTERS);
        requireRange("address + count", address + count - 1, 0, 0xFFFF);

        byte[] payload = new byte[5 + data.length];
        ModbusBytes.writeUnsignedShort(address, payload, 0);
        ModbusBytes.writeUnsignedShort(count, payload, 2);
        payload[4] = (byte) data.length;
        System.arraycopy(data, 0, payload, 5, data.length);

        return new ModbusRequest(transactionId, unitId, ModbusFunctionCode.WRITE_MULTIPLE_REGISTERS,
                payload, WRITE_RESPONSE_LENGTH);
    }

    @Override
    public String toString() {
        return "ModbusRequest[tx=" + transactionId + ", unit=" + unitId + ", " + functionCode
                + ", payload=" + ModbusBytes.toHex(payload) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModbusRequest other)) {
            return false;
        }
        return transactionId == other.transactionId
                && unitId == other.unitId
                && functionCode == other.functionCode
                && expectedResponseLength == other.expectedResponseLength
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(transactionId, unitId, functionCode, expectedResponseLength);
        return 31 * result + Arrays.hashCode(payload);
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be " + min + ".." + max + ": " + value);
        }
    }
}
