package com.questrail.kducer.protocol.modbus.codec.impl;

import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;
import com.questrail.kducer.protocol.modbus.codec.ModbusFrameEncoder;
import com.questrail.kducer.protocol.modbus.codec.ModbusRequest;

import java.util.Objects;

/**
 * DefaultModbusFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ModbusFrameEncoder}.
 *
 * <p>Layout of the produced ADU:</p>
 * <pre>
 *   [0..1]  transaction id
 *   [2..3]  protocol id (always 0)
 *   [4..5]  length = 1 (unit) + 1 (function) + payload
 *   [6]     unit id
 *   [7]     function code
 *   [8..]   payload
 * </pre>
 */
public final class DefaultModbusFrameEncoder implements ModbusFrameEncoder
{
    public static final int MBAP_HEADER_LENGTH = 7;

    @Override
    public byte[] encode(ModbusRequest request)
    {
        Objects.requireNonNull(request, "request");

        final byte[] payload = request.payload();
        final byte[] adu = new byte[MBAP_HEADER_LENGTH + 1 + payload.length];

        ModbusBytes.writeUnsignedShort(request.transactionId(), adu, 0);
        ModbusBytes.writeUnsignedShort(0, adu, 2);
        ModbusBytes.writeUnsignedShort(2 + payload.length, adu, 4);
        adu[6] = (byte) request.unitId();
        adu[7] = (byte) request.functionCode().code();
        System.arraycopy(payload, 0, adu, 8, payload.length);

        return adu;
    }
}
