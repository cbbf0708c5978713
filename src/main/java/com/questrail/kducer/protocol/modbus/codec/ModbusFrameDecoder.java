package com.questrail.kducer.protocol.modbus.codec;

/**
 * ModbusFrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound half of the frame codec. A response is validated in two steps that
 * mirror how it is read from the stream:
 *
 * <pre>
 *   receiveAll(7)                 → decodeHeader(request, header)
 *   receiveAll(header.remaining()) → decodePdu(request, header, body)
 * </pre>
 *
 * <p>Both steps validate the response against the request that produced it.
 * Malformed or unmatched responses raise
 * {@link com.questrail.kducer.protocol.modbus.ModbusProtocolException};
 * exception responses raise
 * {@link com.questrail.kducer.protocol.modbus.ModbusDeviceException} or, for
 * code 6, {@link com.questrail.kducer.protocol.modbus.ModbusDeviceBusyException}.</p>
 */
public interface ModbusFrameDecoder
{
    /**
     * Validate the 7-byte MBAP header of a response.
     *
     * @param request the request being answered
     * @param header  exactly 7 bytes
     * @return the parsed header; {@link ModbusResponseHeader#remaining()} tells
     *         how many bytes to read next
     */
    ModbusResponseHeader decodeHeader(ModbusRequest request, byte[] header);

    /**
     * Validate the PDU (function code + data) of a response.
     *
     * @param request the request being answered
     * @param header  the header returned by {@link #decodeHeader}
     * @param body    exactly {@code header.remaining()} bytes
     * @return the response data following the function code
     */
    byte[] decodePdu(ModbusRequest request, ModbusResponseHeader header, byte[] body);
}
