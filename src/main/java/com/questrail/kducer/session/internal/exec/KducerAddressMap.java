package com.questrail.kducer.session.internal.exec;

/**
 * KducerAddressMap
 * =============================================================================
 * Register addresses and data sizes of the controller, by firmware tier.
 *
 * <h2>Common addresses</h2>
 * <pre>
 *   input    100  x 8    firmware version (ASCII)
 *   input    152  x 71   torque graph series
 *   input    223  x 71   angle graph series
 *   input    294  x 1    new-result flag (low byte, cleared by the read)
 *   input    295  x 67   tightening result
 *   holding  7372        active program number
 *   holding  7373        active sequence number
 *   holding  7380 x 8    barcode
 *   holding  7390        high-resolution graph mode
 *   holding  7399        reprogram control (permanent memory)
 *   holding  7400        general settings, first tranche
 *   holding  7460 x 2    general settings, second tranche (v40+)
 *   holding  0           active program data
 *   coil     32          remote lever
 *   coil     34          stop motor
 * </pre>
 *
 * <h2>Tiers</h2>
 * Firmware up to 37 uses the {@link Tier#LEGACY} sizes; 38 and later use
 * {@link Tier#EXTENDED}.
 */
public final class KducerAddressMap
{
    public static final int FIRMWARE_VERSION_ADDRESS = 100;
    public static final int FIRMWARE_VERSION_REGISTERS = 8;

    public static final int TORQUE_GRAPH_ADDRESS = 152;
    public static final int ANGLE_GRAPH_ADDRESS = 223;
    public static final int GRAPH_REGISTERS = 71;

    public static final int NEW_RESULT_FLAG_ADDRESS = 294;
    public static final int RESULT_ADDRESS = 295;
    public static final int RESULT_REGISTERS = 67;

    public static final int ACTIVE_PROGRAM_ADDRESS = 7372;
    public static final int ACTIVE_SEQUENCE_ADDRESS = 7373;
    public static final int BARCODE_ADDRESS = 7380;
    public static final int BARCODE_BYTES = 16;
    public static final int HIGH_RES_GRAPH_MODE_ADDRESS = 7390;
    public static final int REPROGRAM_CONTROL_ADDRESS = 7399;
    public static final int SETTINGS_ADDRESS = 7400;
    public static final int SETTINGS_SECOND_TRANCHE_ADDRESS = 7460;
    public static final int ACTIVE_PROGRAM_DATA_ADDRESS = 0;

    public static final int REMOTE_LEVER_COIL = 32;
    public static final int STOP_MOTOR_COIL = 34;

    public static final int PROGRAM_BANK_ADDRESS = 1000;
    public static final int SEQUENCE_BANK_ADDRESS = 25000;

    public static final int MAX_PROGRAM_BYTES = 230;
    public static final int SETTINGS_FIRST_TRANCHE_MAX_BYTES = 88;
    public static final int SETTINGS_SECOND_TRANCHE_BYTES = 4;
    public static final int MAX_SETTINGS_BYTES = SETTINGS_FIRST_TRANCHE_MAX_BYTES + SETTINGS_SECOND_TRANCHE_BYTES;

    public enum Tier
    {
        LEGACY(64, 180, 8, 64),
        EXTENDED(200, 230, 24, 112);

        private final int maxProgram;
        private final int programBytes;
        private final int maxSequence;
        private final int sequenceBytes;

        Tier(int maxProgram, int programBytes, int maxSequence, int sequenceBytes) {
            this.maxProgram = maxProgram;
            this.programBytes = programBytes;
            this.maxSequence = maxSequence;
            this.sequenceBytes = sequenceBytes;
        }

        public static Tier forVersion(int firmwareVersion) {
            return firmwareVersion >= 38 ? EXTENDED : LEGACY;
        }
    }

    private final int firmwareVersion;
    private final Tier tier;

    private KducerAddressMap(int firmwareVersion) {
        this.firmwareVersion = firmwareVersion;
        this.tier = Tier.forVersion(firmwareVersion);
    }

    public static KducerAddressMap forVersion(int firmwareVersion) {
        return new KducerAddressMap(firmwareVersion);
    }

    public Tier tier() {
        return tier;
    }

    public int maxProgram() {
        return tier.maxProgram;
    }

    public int programBytes() {
        return tier.programBytes;
    }

    public int programRegisters() {
        return tier.programBytes / 2;
    }

    public int maxSequence() {
        return tier.maxSequence;
    }

    public int sequenceBytes() {
        return tier.sequenceBytes;
    }

    public int sequenceRegisters() {
        return tier.sequenceBytes / 2;
    }

    /**
     * Bank address of program {@code program} (1-based).
     */
    public int programAddress(int program) {
        requireProgram(program);
        return PROGRAM_BANK_ADDRESS + (program - 1) * programRegisters();
    }

    /**
     * Bank address of sequence {@code sequence} (1-based).
     */
    public int sequenceAddress(int sequence) {
        requireSequence(sequence);
        return SEQUENCE_BANK_ADDRESS + (sequence - 1) * sequenceRegisters();
    }

    /**
     * Size of the general settings block for this firmware version.
     */
    public int settingsBytes() {
        if (firmwareVersion <= 37) {
            return 78;
        }
        if (firmwareVersion == 38) {
            return 86;
        }
        if (firmwareVersion == 39) {
            return 88;
        }
        return MAX_SETTINGS_BYTES;
    }

    public boolean hasSettingsSecondTranche() {
        return firmwareVersion >= 40;
    }

    public int settingsFirstTrancheBytes() {
        return Math.min(settingsBytes(), SETTINGS_FIRST_TRANCHE_MAX_BYTES);
    }

    public void requireProgram(int program) {
        if (program < 1 || program > tier.maxProgram) {
            throw new IllegalArgumentException("Program must be 1.." + tier.maxProgram
                    + " for firmware " + firmwareVersion + ": " + program);
        }
    }

    public void requireSequence(int sequence) {
        if (sequence < 1 || sequence > tier.maxSequence) {
            throw new IllegalArgumentException("Sequence must be 1.." + tier.maxSequence
                    + " for firmware " + firmwareVersion + ": " + sequence);
        }
    }
}
