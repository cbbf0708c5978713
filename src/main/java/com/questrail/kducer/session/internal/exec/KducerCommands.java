package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.CancellationToken;
import com.questrail.kducer.api.TighteningResultEvent;
import com.questrail.kducer.protocol.modbus.ModbusException;
import com.questrail.kducer.protocol.modbus.client.ModbusExchangeClient;
import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;

/**
 * KducerCommands
 * =============================================================================
 * Factory for every command a caller can queue, and the register-level
 * behaviour of each one.
 *
 * <h2>Validation</h2>
 * Arguments that do not depend on the device (barcode text, null blobs) are
 * checked here on the caller's thread. Limits that depend on the firmware tier
 * (program/sequence ranges, blob sizes) are checked inside the operation,
 * before its first exchange, and surface as {@link IllegalArgumentException}
 * attached to the command.
 */
public final class KducerCommands
{
    private KducerCommands() {}

    public static KducerCommand<Integer> getFirmwareVersion(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_FIRMWARE_VERSION, ctx -> {
            SessionState state = ctx.state();
            FirmwareVersion fw = state.firmware().orElseGet(() -> readFirmwareVersion(ctx.client()));
            state.firmware(fw);
            return fw.number();
        }, token);
    }

    public static KducerCommand<Integer> getProgram(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_PROGRAM,
                ctx -> readRegister(ctx.client(), KducerAddressMap.ACTIVE_PROGRAM_ADDRESS), token);
    }

    public static KducerCommand<Void> selectProgram(int program, CancellationToken token) {
        return new KducerCommand<>(CommandKind.SELECT_PROGRAM, ctx -> {
            ctx.addressMap().requireProgram(program);
            selectIfDifferent(ctx, KducerAddressMap.ACTIVE_PROGRAM_ADDRESS, program);
            return null;
        }, token);
    }

    public static KducerCommand<Integer> getSequence(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_SEQUENCE,
                ctx -> readRegister(ctx.client(), KducerAddressMap.ACTIVE_SEQUENCE_ADDRESS), token);
    }

    public static KducerCommand<Void> selectSequence(int sequence, CancellationToken token) {
        return new KducerCommand<>(CommandKind.SELECT_SEQUENCE, ctx -> {
            ctx.addressMap().requireSequence(sequence);
            selectIfDifferent(ctx, KducerAddressMap.ACTIVE_SEQUENCE_ADDRESS, sequence);
            return null;
        }, token);
    }

    public static KducerCommand<Void> disableScrewdriver(CancellationToken token) {
        return new KducerCommand<>(CommandKind.DISABLE_SCREWDRIVER, ctx -> {
            writeStopMotor(ctx, true);
            return null;
        }, token);
    }

    public static KducerCommand<Void> enableScrewdriver(CancellationToken token) {
        return new KducerCommand<>(CommandKind.ENABLE_SCREWDRIVER, ctx -> {
            writeStopMotor(ctx, false);
            return null;
        }, token);
    }

    /**
     * Press the remote lever until the device reports a new result, then return
     * that result. The result is handed to the caller directly and is not
     * published to the result queue; lock policies do not apply.
     */
    public static KducerCommand<TighteningResultEvent> runScrewdriver(CancellationToken token) {
        return new KducerCommand<>(CommandKind.RUN_SCREWDRIVER, ctx -> {
            ModbusExchangeClient client = ctx.client();

            // clear a flag left over from an earlier tightening
            ResultPoller.readNewResultFlag(client);
            try {
                while (!ResultPoller.readNewResultFlag(client)) {
                    ctx.token().throwIfCancellationRequested();
                    client.writeSingleCoil(KducerAddressMap.REMOTE_LEVER_COIL, true);
                    ctx.settle(ctx.timing().leverRepressInterval());
                }
            }
            catch (CancellationException e) {
                releaseLever(client, e);
                throw e;
            }
            client.writeSingleCoil(KducerAddressMap.REMOTE_LEVER_COIL, false);

            return ctx.resultReader().read(client, ctx.state().fetchGraphs());
        }, token);
    }

    public static KducerCommand<byte[]> getActiveProgramData(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_ACTIVE_PROGRAM_DATA, ctx ->
                ctx.client().readHoldingRegisters(KducerAddressMap.ACTIVE_PROGRAM_DATA_ADDRESS,
                        ctx.addressMap().programRegisters()), token);
    }

    public static KducerCommand<byte[]> getProgramData(int program, CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_PROGRAM_DATA, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            return ctx.client().readHoldingRegisters(map.programAddress(program), map.programRegisters());
        }, token);
    }

    public static KducerCommand<SortedMap<Integer, byte[]>> getAllProgramData(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_ALL_PROGRAM_DATA, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            SortedMap<Integer, byte[]> programs = new TreeMap<>();
            for (int program = 1; program <= map.maxProgram(); program++) {
                ctx.token().throwIfCancellationRequested();
                programs.put(program, ctx.client().readHoldingRegisters(
                        map.programAddress(program), map.programRegisters()));
            }
            return Collections.unmodifiableSortedMap(programs);
        }, token);
    }

    public static KducerCommand<Void> sendProgramData(int program, byte[] data, boolean permanent,
                                                      CancellationToken token) {
        return sendMultipleProgramData(CommandKind.SEND_PROGRAM_DATA, Map.of(program, data), permanent, token);
    }

    public static KducerCommand<Void> sendMultipleProgramData(Map<Integer, byte[]> programs, boolean permanent,
                                                              CancellationToken token) {
        return sendMultipleProgramData(CommandKind.SEND_MULTIPLE_PROGRAM_DATA, programs, permanent, token);
    }

    private static KducerCommand<Void> sendMultipleProgramData(CommandKind kind, Map<Integer, byte[]> programs,
                                                               boolean permanent, CancellationToken token) {
        Map<Integer, byte[]> copy = copyBlobs(programs, "programs");
        return new KducerCommand<>(kind, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            for (Map.Entry<Integer, byte[]> e : copy.entrySet()) {
                map.requireProgram(e.getKey());
                requireLength("Program " + e.getKey() + " data", e.getValue(),
                        map.programBytes(), KducerAddressMap.MAX_PROGRAM_BYTES);
            }
            for (Map.Entry<Integer, byte[]> e : copy.entrySet()) {
                ctx.token().throwIfCancellationRequested();
                ctx.client().writeMultipleRegisters(map.programAddress(e.getKey()),
                        Arrays.copyOf(e.getValue(), map.programBytes()));
            }
            if (permanent) {
                commitToPermanentMemory(ctx);
            }
            return null;
        }, token);
    }

    public static KducerCommand<byte[]> getSequenceData(int sequence, CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_SEQUENCE_DATA, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            return ctx.client().readHoldingRegisters(map.sequenceAddress(sequence), map.sequenceRegisters());
        }, token);
    }

    public static KducerCommand<SortedMap<Integer, byte[]>> getAllSequenceData(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_ALL_SEQUENCE_DATA, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            SortedMap<Integer, byte[]> sequences = new TreeMap<>();
            for (int sequence = 1; sequence <= map.maxSequence(); sequence++) {
                ctx.token().throwIfCancellationRequested();
                sequences.put(sequence, ctx.client().readHoldingRegisters(
                        map.sequenceAddress(sequence), map.sequenceRegisters()));
            }
            return Collections.unmodifiableSortedMap(sequences);
        }, token);
    }

    public static KducerCommand<Void> sendSequenceData(int sequence, byte[] data, boolean permanent,
                                                       CancellationToken token) {
        return sendMultipleSequenceData(CommandKind.SEND_SEQUENCE_DATA, Map.of(sequence, data), permanent, token);
    }

    public static KducerCommand<Void> sendMultipleSequenceData(Map<Integer, byte[]> sequences, boolean permanent,
                                                               CancellationToken token) {
        return sendMultipleSequenceData(CommandKind.SEND_MULTIPLE_SEQUENCE_DATA, sequences, permanent, token);
    }

    private static KducerCommand<Void> sendMultipleSequenceData(CommandKind kind, Map<Integer, byte[]> sequences,
                                                                boolean permanent, CancellationToken token) {
        Map<Integer, byte[]> copy = copyBlobs(sequences, "sequences");
        return new KducerCommand<>(kind, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            for (Map.Entry<Integer, byte[]> e : copy.entrySet()) {
                map.requireSequence(e.getKey());
                requireLength("Sequence " + e.getKey() + " data", e.getValue(),
                        map.sequenceBytes(), map.sequenceBytes());
            }
            for (Map.Entry<Integer, byte[]> e : copy.entrySet()) {
                ctx.token().throwIfCancellationRequested();
                ctx.client().writeMultipleRegisters(map.sequenceAddress(e.getKey()), e.getValue());
            }
            if (permanent) {
                commitToPermanentMemory(ctx);
            }
            return null;
        }, token);
    }

    public static KducerCommand<byte[]> getGeneralSettings(CancellationToken token) {
        return new KducerCommand<>(CommandKind.GET_GENERAL_SETTINGS, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            byte[] first = ctx.client().readHoldingRegisters(KducerAddressMap.SETTINGS_ADDRESS,
                    map.settingsFirstTrancheBytes() / 2);
            if (!map.hasSettingsSecondTranche()) {
                return first;
            }
            byte[] second = ctx.client().readHoldingRegisters(KducerAddressMap.SETTINGS_SECOND_TRANCHE_ADDRESS,
                    KducerAddressMap.SETTINGS_SECOND_TRANCHE_BYTES / 2);
            byte[] settings = Arrays.copyOf(first, first.length + second.length);
            System.arraycopy(second, 0, settings, first.length, second.length);
            return settings;
        }, token);
    }

    public static KducerCommand<Void> sendGeneralSettings(byte[] settings, boolean permanent,
                                                          CancellationToken token) {
        Objects.requireNonNull(settings, "settings");
        byte[] copy = settings.clone();
        return new KducerCommand<>(CommandKind.SEND_GENERAL_SETTINGS, ctx -> {
            KducerAddressMap map = ctx.addressMap();
            requireLength("General settings", copy, map.settingsBytes(), KducerAddressMap.MAX_SETTINGS_BYTES);

            int firstBytes = map.settingsFirstTrancheBytes();
            ctx.client().writeMultipleRegisters(KducerAddressMap.SETTINGS_ADDRESS, Arrays.copyOf(copy, firstBytes));
            if (map.hasSettingsSecondTranche()) {
                ctx.client().writeMultipleRegisters(KducerAddressMap.SETTINGS_SECOND_TRANCHE_ADDRESS,
                        Arrays.copyOfRange(copy, firstBytes, firstBytes + KducerAddressMap.SETTINGS_SECOND_TRANCHE_BYTES));
            }
            if (permanent) {
                commitToPermanentMemory(ctx);
            }
            return null;
        }, token);
    }

    /**
     * @param barcode up to 16 printable ASCII characters; ',' is sent as '.'
     */
    public static KducerCommand<Void> sendBarcode(String barcode, CancellationToken token) {
        byte[] registers = encodeBarcode(barcode);
        return new KducerCommand<>(CommandKind.SEND_BARCODE, ctx -> {
            ctx.client().writeMultipleRegisters(KducerAddressMap.BARCODE_ADDRESS, registers);
            return null;
        }, token);
    }

    public static KducerCommand<Void> setHighResGraphMode(boolean enabled, CancellationToken token) {
        return new KducerCommand<>(CommandKind.SET_HIGH_RES_GRAPH_MODE, ctx -> {
            ctx.client().writeSingleRegister(KducerAddressMap.HIGH_RES_GRAPH_MODE_ADDRESS, enabled ? 1 : 0);
            ctx.state().fetchGraphs(enabled);
            return null;
        }, token);
    }

    public static FirmwareVersion readFirmwareVersion(ModbusExchangeClient client) {
        return FirmwareVersion.parse(client.readInputRegisters(
                KducerAddressMap.FIRMWARE_VERSION_ADDRESS, KducerAddressMap.FIRMWARE_VERSION_REGISTERS));
    }

    static byte[] encodeBarcode(String barcode) {
        Objects.requireNonNull(barcode, "barcode");
        if (barcode.length() > KducerAddressMap.BARCODE_BYTES) {
            throw new IllegalArgumentException("Barcode must be at most "
                    + KducerAddressMap.BARCODE_BYTES + " characters: " + barcode.length());
        }
        byte[] registers = new byte[KducerAddressMap.BARCODE_BYTES];
        byte[] ascii = barcode.replace(',', '.').getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < ascii.length; i++) {
            char c = barcode.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                throw new IllegalArgumentException("Barcode must be printable ASCII: " + barcode);
            }
            registers[i] = ascii[i];
        }
        return registers;
    }

    private static int readRegister(ModbusExchangeClient client, int address) {
        return ModbusBytes.readUnsignedShort(client.readHoldingRegisters(address, 1), 0);
    }

    private static void selectIfDifferent(CommandContext ctx, int address, int value) {
        if (readRegister(ctx.client(), address) == value) {
            return;
        }
        ctx.client().writeSingleRegister(address, value);
        ctx.settle(ctx.timing().programChangeSettle());
    }

    private static void writeStopMotor(CommandContext ctx, boolean on) {
        ctx.client().writeSingleCoil(KducerAddressMap.STOP_MOTOR_COIL, on);
        // an explicit caller request supersedes a lock the poller placed
        ctx.state().motorLockedBySession(false);
        ctx.settle(ctx.timing().shortSettle());
    }

    private static void commitToPermanentMemory(CommandContext ctx) {
        ModbusExchangeClient client = ctx.client();
        client.writeSingleRegister(KducerAddressMap.REPROGRAM_CONTROL_ADDRESS, 1);
        try {
            ctx.settle(ctx.timing().permanentMemorySettle());
        }
        catch (CancellationException e) {
            try {
                client.writeSingleRegister(KducerAddressMap.REPROGRAM_CONTROL_ADDRESS, 0);
            }
            catch (ModbusException reset) {
                e.addSuppressed(reset);
            }
            throw e;
        }
        client.writeSingleRegister(KducerAddressMap.REPROGRAM_CONTROL_ADDRESS, 0);
    }

    private static void releaseLever(ModbusExchangeClient client, CancellationException cancellation) {
        try {
            client.writeSingleCoil(KducerAddressMap.REMOTE_LEVER_COIL, false);
        }
        catch (ModbusException e) {
            cancellation.addSuppressed(e);
        }
    }

    private static Map<Integer, byte[]> copyBlobs(Map<Integer, byte[]> blobs, String name) {
        Objects.requireNonNull(blobs, name);
        if (blobs.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        Map<Integer, byte[]> copy = new LinkedHashMap<>();
        for (Map.Entry<Integer, byte[]> e : new TreeMap<>(blobs).entrySet()) {
            copy.put(e.getKey(), Objects.requireNonNull(e.getValue(), name + " entry " + e.getKey()).clone());
        }
        return copy;
    }

    private static void requireLength(String what, byte[] data, int min, int max) {
        if (data.length < min || data.length > max) {
            String range = min == max ? String.valueOf(min) : min + ".." + max;
            throw new IllegalArgumentException(what + " must be " + range + " bytes: " + data.length);
        }
    }
}
