package com.questrail.kducer.protocol.modbus.codec;

/**
 * A validated MBAP response header.
 *
 * @param length bytes following the length field (unit id + PDU)
 */
public record ModbusResponseHeader(int transactionId, int protocolId, int length, int unitId) {

    /**
     * Number of bytes still to be read after the 7-byte header: the PDU.
     */
    public int remaining() {
        return length - 1;
    }
}
