package com.questrail.kducer.protocol.modbus.codec;

/**
 * ModbusFrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound half of the frame codec: {@link ModbusRequest} to wire bytes.
 *
 * <p>The produced ADU is the 7-byte MBAP header (transaction id, protocol id 0,
 * length of the remaining bytes, unit id) followed by the function code and the
 * request payload. Every multi-byte field is big-endian.</p>
 */
public interface ModbusFrameEncoder
{
    /**
     * @param request request to encode (must not be {@code null})
     * @return a complete ADU ready to be written to the transport
     */
    byte[] encode(ModbusRequest request);
}
