package com.questrail.kducer.protocol.modbus.client;

import com.questrail.kducer.protocol.modbus.ModbusFunctionCode;
import com.questrail.kducer.protocol.modbus.ModbusProtocolException;
import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;
import com.questrail.kducer.protocol.modbus.codec.ModbusFrameDecoder;
import com.questrail.kducer.protocol.modbus.codec.ModbusFrameEncoder;
import com.questrail.kducer.protocol.modbus.codec.ModbusRequest;
import com.questrail.kducer.protocol.modbus.codec.ModbusResponseHeader;
import com.questrail.kducer.protocol.modbus.codec.impl.DefaultModbusFrameDecoder;
import com.questrail.kducer.protocol.modbus.codec.impl.DefaultModbusFrameEncoder;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransport;

import java.util.Arrays;
import java.util.Objects;

/**
 * ModbusExchangeClient
 * =============================================================================
 * Synchronous request/response exchanges over one {@link ModbusTransport}.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Each call performs exactly one request and reads exactly one response.</li>
 *   <li>Calls are made from a single thread, so at most one exchange is ever
 *       outstanding on the transport.</li>
 *   <li>No retries. Transport, protocol and device failures propagate to the
 *       caller unchanged.</li>
 *   <li>Transaction ids increase by one per request and wrap at 0xFFFF.</li>
 * </ul>
 *
 * <p>Register values are returned as raw big-endian bytes; interpreting them
 * is the caller's concern.</p>
 */
public final class ModbusExchangeClient
{
    private final ModbusTransport transport;
    private final ModbusFrameEncoder encoder;
    private final ModbusFrameDecoder decoder;
    private final int unitId;

    private int nextTransactionId;

    public ModbusExchangeClient(ModbusTransport transport,
                                ModbusFrameEncoder encoder,
                                ModbusFrameDecoder decoder,
                                int unitId)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        if (unitId < 0 || unitId > 0xFF) {
            throw new IllegalArgumentException("unitId must be 0..255: " + unitId);
        }
        this.unitId = unitId;
    }

    public ModbusExchangeClient(ModbusTransport transport, int unitId)
    {
        this(transport, new DefaultModbusFrameEncoder(), new DefaultModbusFrameDecoder(), unitId);
    }

    /**
     * FC 3. Returns {@code 2 * count} bytes.
     */
    public byte[] readHoldingRegisters(int address, int count)
    {
        return readRegisters(ModbusFunctionCode.READ_HOLDING_REGISTERS, address, count);
    }

    /**
     * FC 4. Returns {@code 2 * count} bytes.
     */
    public byte[] readInputRegisters(int address, int count)
    {
        return readRegisters(ModbusFunctionCode.READ_INPUT_REGISTERS, address, count);
    }

    public void writeSingleCoil(int address, boolean value)
    {
        ModbusRequest request = ModbusRequest.writeSingleCoil(nextTransactionId(), unitId, address, value);
        requireEcho(request, exchange(request));
    }

    public void writeSingleRegister(int address, int value)
    {
        ModbusRequest request = ModbusRequest.writeSingleRegister(nextTransactionId(), unitId, address, value);
        requireEcho(request, exchange(request));
    }

    /**
     * FC 16. {@code data} is written verbatim and must hold 1..123 whole registers.
     */
    public void writeMultipleRegisters(int address, byte[] data)
    {
        ModbusRequest request = ModbusRequest.writeMultipleRegisters(nextTransactionId(), unitId, address, data);
        requireEcho(request, exchange(request));
    }

    private byte[] readRegisters(ModbusFunctionCode functionCode, int address, int count)
    {
        ModbusRequest request = ModbusRequest.readRegisters(nextTransactionId(), unitId, functionCode, address, count);
        byte[] data = exchange(request);

        int byteCount = data[0] & 0xFF;
        if (byteCount != count * 2 || data.length != 1 + byteCount) {
            throw new ModbusProtocolException("Byte count " + byteCount + " does not match "
                    + count + " registers requested");
        }
        return Arrays.copyOfRange(data, 1, data.length);
    }

    private byte[] exchange(ModbusRequest request)
    {
        transport.sendAll(encoder.encode(request));

        byte[] headerBytes = transport.receiveAll(DefaultModbusFrameEncoder.MBAP_HEADER_LENGTH);
        ModbusResponseHeader header = decoder.decodeHeader(request, headerBytes);

        byte[] body = transport.receiveAll(header.remaining());
        return decoder.decodePdu(request, header, body);
    }

    // Write responses echo the start address; a different one means the
    // response belongs to some other request.
    private static void requireEcho(ModbusRequest request, byte[] data)
    {
        int requested = ModbusBytes.readUnsignedShort(request.payload(), 0);
        int echoed = ModbusBytes.readUnsignedShort(data, 0);
        if (requested != echoed) {
            throw new ModbusProtocolException("Write response echoes address " + echoed
                    + ", expected " + requested);
        }
    }

    private int nextTransactionId()
    {
        int id = nextTransactionId;
        nextTransactionId = (nextTransactionId + 1) & 0xFFFF;
        return id;
    }
}
