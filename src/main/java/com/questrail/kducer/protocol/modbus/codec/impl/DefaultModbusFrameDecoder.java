package com.questrail.kducer.protocol.modbus.codec.impl;

import com.questrail.kducer.protocol.modbus.ModbusDeviceBusyException;
import com.questrail.kducer.protocol.modbus.ModbusDeviceException;
import com.questrail.kducer.protocol.modbus.ModbusProtocolException;
import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;
import com.questrail.kducer.protocol.modbus.codec.ModbusFrameDecoder;
import com.questrail.kducer.protocol.modbus.codec.ModbusRequest;
import com.questrail.kducer.protocol.modbus.codec.ModbusResponseHeader;

import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultModbusFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ModbusFrameDecoder}.
 *
 * <p>Header checks, in order:</p>
 * <ol>
 *   <li>transaction id equals the request's</li>
 *   <li>protocol id is 0</li>
 *   <li>length is either the expected success length or 3 (exception response)</li>
 *   <li>unit id equals the request's</li>
 * </ol>
 *
 * <p>PDU checks: a function code equal to the request's must come with the
 * expected success length; a function code equal to {@code request | 0x80} must
 * come with length 3 and is mapped to a device exception. Anything else is a
 * protocol violation.</p>
 */
public final class DefaultModbusFrameDecoder implements ModbusFrameDecoder
{
    public static final int EXCEPTION_RESPONSE_LENGTH = 3;

    @Override
    public ModbusResponseHeader decodeHeader(ModbusRequest request, byte[] header)
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(header, "header");

        if (header.length != DefaultModbusFrameEncoder.MBAP_HEADER_LENGTH) {
            throw new ModbusProtocolException("MBAP header must be 7 bytes, got " + header.length);
        }

        final int transactionId = ModbusBytes.readUnsignedShort(header, 0);
        final int protocolId = ModbusBytes.readUnsignedShort(header, 2);
        final int length = ModbusBytes.readUnsignedShort(header, 4);
        final int unitId = header[6] & 0xFF;

        if (transactionId != request.transactionId()) {
            throw new ModbusProtocolException("Transaction id mismatch: expected "
                    + request.transactionId() + ", got " + transactionId);
        }
        if (protocolId != 0) {
            throw new ModbusProtocolException("Unexpected protocol id " + protocolId);
        }
        if (length != request.expectedResponseLength() && length != EXCEPTION_RESPONSE_LENGTH) {
            throw new ModbusProtocolException("Unexpected response length " + length
                    + " (expected " + request.expectedResponseLength() + ")");
        }
        if (unitId != request.unitId()) {
            throw new ModbusProtocolException("Unit id mismatch: expected "
                    + request.unitId() + ", got " + unitId);
        }

        return new ModbusResponseHeader(transactionId, protocolId, length, unitId);
    }

    @Override
    public byte[] decodePdu(ModbusRequest request, ModbusResponseHeader header, byte[] body)
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");

        if (body.length != header.remaining() || body.length == 0) {
            throw new ModbusProtocolException("PDU length " + body.length
                    + " does not match header length " + header.length());
        }

        final int functionCode = body[0] & 0xFF;

        if (functionCode == request.functionCode().code()) {
            if (header.length() != request.expectedResponseLength()) {
                throw new ModbusProtocolException("Success response for " + request.functionCode()
                        + " has length " + header.length() + ", expected " + request.expectedResponseLength());
            }
            return Arrays.copyOfRange(body, 1, body.length);
        }

        if (functionCode == request.functionCode().exceptionCode()) {
            if (header.length() != EXCEPTION_RESPONSE_LENGTH) {
                throw new ModbusProtocolException("Exception response has length " + header.length());
            }
            final int exceptionCode = body[1] & 0xFF;
            if (exceptionCode == ModbusDeviceBusyException.SERVER_BUSY) {
                throw new ModbusDeviceBusyException("Device busy answering " + request.functionCode());
            }
            throw new ModbusDeviceException(exceptionCode,
                    "Device exception " + exceptionCode + " answering " + request.functionCode());
        }

        throw new ModbusProtocolException(String.format(
                "Unexpected function code 0x%02X answering %s", functionCode, request.functionCode()));
    }
}
