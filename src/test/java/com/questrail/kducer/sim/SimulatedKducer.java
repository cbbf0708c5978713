package com.questrail.kducer.sim;

import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * SimulatedKducer
 * -----------------------------------------------------------------------------
 * Test-only register model of a K-Ducer controller that answers real Modbus
 * TCP ADUs.
 *
 * <p>Behaviour modelled:</p>
 * <ul>
 *   <li>holding registers, input registers and coils with function codes
 *       3, 4, 5, 6 and 16;</li>
 *   <li>the new-result flag (input 294) is cleared by any read that covers it;</li>
 *   <li>{@link #produceResult()} fills the result block and raises the flag;</li>
 *   <li>remote lever presses (coil 32 on) produce a result after a configured
 *       number of presses;</li>
 *   <li>one-shot injected exception responses and connection drops.</li>
 * </ul>
 *
 * <p>Every request is recorded in order for assertions.</p>
 */
public final class SimulatedKducer {

    public static final int NEW_RESULT_FLAG = 294;
    public static final int RESULT_START = 295;
    public static final int RESULT_REGISTERS = 67;

    /**
     * One decoded request. {@code value} is the register count for reads and
     * FC 16, the written value for FC 6, and 1/0 for FC 5.
     */
    public record Request(int functionCode, int address, int value) {
        public boolean isWrite() {
            return functionCode == 5 || functionCode == 6 || functionCode == 16;
        }
    }

    private final Map<Integer, Integer> holding = new HashMap<>();
    private final Map<Integer, Integer> input = new HashMap<>();
    private final Map<Integer, Boolean> coils = new HashMap<>();
    private final List<Request> requests = new ArrayList<>();

    private Predicate<Request> exceptionMatcher;
    private int injectedExceptionCode;
    private Predicate<Request> dropMatcher;

    private int leverPressesUntilResult = -1;
    private int resultsProduced;
    private int connections;
    private boolean refuseConnections;

    public SimulatedKducer(String firmwareVersion) {
        setFirmwareVersion(firmwareVersion);
    }

    // ---------------------------------------------------------------------
    // Device model
    // ---------------------------------------------------------------------

    public synchronized void setFirmwareVersion(String text) {
        byte[] ascii = new byte[16];
        byte[] raw = text.getBytes(StandardCharsets.US_ASCII);
        System.arraycopy(raw, 0, ascii, 0, Math.min(raw.length, ascii.length));
        for (int i = 0; i < 8; i++) {
            input.put(100 + i, ModbusBytes.readUnsignedShort(ascii, i * 2));
        }
    }

    public synchronized void setHolding(int address, int value) {
        holding.put(address, value & 0xFFFF);
    }

    public synchronized int holding(int address) {
        return holding.getOrDefault(address, 0);
    }

    public synchronized boolean coil(int address) {
        return coils.getOrDefault(address, false);
    }

    public synchronized boolean newResultFlag() {
        return input.getOrDefault(NEW_RESULT_FLAG, 0) != 0;
    }

    /**
     * Complete a tightening: register 295 carries the result ordinal (1-based),
     * the other result registers carry their offset.
     */
    public synchronized void produceResult() {
        resultsProduced++;
        input.put(RESULT_START, resultsProduced);
        for (int i = 1; i < RESULT_REGISTERS; i++) {
            input.put(RESULT_START + i, i);
        }
        input.put(NEW_RESULT_FLAG, 1);
    }

    public synchronized int resultsProduced() {
        return resultsProduced;
    }

    public synchronized void produceResultAfterLeverPresses(int presses) {
        this.leverPressesUntilResult = presses;
    }

    // ---------------------------------------------------------------------
    // Fault injection
    // ---------------------------------------------------------------------

    /**
     * Answer the first request matching {@code matcher} with an exception response.
     */
    public synchronized void injectException(Predicate<Request> matcher, int exceptionCode) {
        this.exceptionMatcher = matcher;
        this.injectedExceptionCode = exceptionCode;
    }

    /**
     * Drop the connection instead of answering the first request matching
     * {@code matcher}. The request is not applied.
     */
    public synchronized void dropConnectionOn(Predicate<Request> matcher) {
        this.dropMatcher = matcher;
    }

    public synchronized void refuseConnections(boolean refuse) {
        this.refuseConnections = refuse;
    }

    public synchronized boolean acceptConnection() {
        if (refuseConnections) {
            return false;
        }
        connections++;
        return true;
    }

    public synchronized int connections() {
        return connections;
    }

    /**
     * @return true when the transport should drop the connection for this ADU
     */
    public synchronized boolean shouldDrop(byte[] adu) {
        if (dropMatcher == null) {
            return false;
        }
        Request request = decode(adu);
        if (dropMatcher.test(request)) {
            dropMatcher = null;
            return true;
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Request log
    // ---------------------------------------------------------------------

    public synchronized List<Request> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public synchronized List<Request> writes() {
        List<Request> writes = new ArrayList<>();
        for (Request r : requests) {
            if (r.isWrite()) {
                writes.add(r);
            }
        }
        return writes;
    }

    public synchronized List<Integer> registerWrites(int address) {
        List<Integer> values = new ArrayList<>();
        for (Request r : requests) {
            if (r.functionCode() == 6 && r.address() == address) {
                values.add(r.value());
            }
        }
        return values;
    }

    public synchronized void clearRequests() {
        requests.clear();
    }

    // ---------------------------------------------------------------------
    // Modbus TCP server side
    // ---------------------------------------------------------------------

    /**
     * Apply one request ADU and return the response ADU.
     */
    public synchronized byte[] handle(byte[] adu) {
        int txId = ModbusBytes.readUnsignedShort(adu, 0);
        int unit = adu[6] & 0xFF;
        int fc = adu[7] & 0xFF;

        Request request = decode(adu);
        requests.add(request);

        if (exceptionMatcher != null && exceptionMatcher.test(request)) {
            exceptionMatcher = null;
            return response(txId, unit, new byte[] { (byte) (fc | 0x80), (byte) injectedExceptionCode });
        }

        int address = request.address();
        switch (fc) {
            case 3:
            case 4: {
                Map<Integer, Integer> space = fc == 3 ? holding : input;
                int count = request.value();
                byte[] pdu = new byte[2 + count * 2];
                pdu[0] = (byte) fc;
                pdu[1] = (byte) (count * 2);
                for (int i = 0; i < count; i++) {
                    ModbusBytes.writeUnsignedShort(space.getOrDefault(address + i, 0), pdu, 2 + i * 2);
                }
                if (fc == 4 && address <= NEW_RESULT_FLAG && NEW_RESULT_FLAG < address + count) {
                    input.put(NEW_RESULT_FLAG, 0);
                }
                return response(txId, unit, pdu);
            }
            case 5: {
                boolean on = request.value() == 1;
                coils.put(address, on);
                if (address == 32 && on && leverPressesUntilResult > 0) {
                    leverPressesUntilResult--;
                    if (leverPressesUntilResult == 0) {
                        leverPressesUntilResult = -1;
                        produceResult();
                    }
                }
                return response(txId, unit, echo(adu));
            }
            case 6: {
                holding.put(address, request.value());
                return response(txId, unit, echo(adu));
            }
            case 16: {
                int count = request.value();
                for (int i = 0; i < count; i++) {
                    holding.put(address + i, ModbusBytes.readUnsignedShort(adu, 13 + i * 2));
                }
                return response(txId, unit, echo(adu));
            }
            default:
                return response(txId, unit, new byte[] { (byte) (fc | 0x80), 0x01 });
        }
    }

    private static Request decode(byte[] adu) {
        int fc = adu[7] & 0xFF;
        int address = ModbusBytes.readUnsignedShort(adu, 8);
        int value = ModbusBytes.readUnsignedShort(adu, 10);
        if (fc == 5) {
            value = value == 0xFF00 ? 1 : 0;
        }
        return new Request(fc, address, value);
    }

    // function code + address + value/count, as FC 5, 6 and 16 responses carry
    private static byte[] echo(byte[] adu) {
        byte[] pdu = new byte[5];
        System.arraycopy(adu, 7, pdu, 0, 5);
        return pdu;
    }

    private static byte[] response(int txId, int unit, byte[] pdu) {
        byte[] out = new byte[7 + pdu.length];
        ModbusBytes.writeUnsignedShort(txId, out, 0);
        ModbusBytes.writeUnsignedShort(0, out, 2);
        ModbusBytes.writeUnsignedShort(1 + pdu.length, out, 4);
        out[6] = (byte) unit;
        System.arraycopy(pdu, 0, out, 7, pdu.length);
        return out;
    }
}
