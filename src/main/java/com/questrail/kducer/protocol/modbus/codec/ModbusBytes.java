package com.questrail.kducer.protocol.modbus.codec;

/**
 * ModbusBytes
 * -----------------------------------------------------------------------------
 * Big-endian ("network order") helpers for 16-bit Modbus quantities.
 *
 * <p>Java byte arrays have no host byte order, so these helpers are the single
 * place where register values are packed and unpacked.</p>
 */
public final class ModbusBytes
{
    private ModbusBytes() {}

    public static int readUnsignedShort(byte[] bytes, int index) {
        return ((bytes[index] & 0xFF) << 8) | (bytes[index + 1] & 0xFF);
    }

    public static void writeUnsignedShort(int value, byte[] bytes, int index) {
        bytes[index] = (byte) ((value >>> 8) & 0xFF);
        bytes[index + 1] = (byte) (value & 0xFF);
    }

    public static byte[] ofUnsignedShort(int value) {
        byte[] out = new byte[2];
        writeUnsignedShort(value, out, 0);
        return out;
    }

    /**
     * Renders bytes as space-separated hex for diagnostics.
     */
    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02X", bytes[i] & 0xFF));
        }
        return sb.toString();
    }
}
