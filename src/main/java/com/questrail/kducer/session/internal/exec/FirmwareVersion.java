package com.questrail.kducer.session.internal.exec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Firmware version of the connected controller, parsed from the ASCII version
 * block (for example {@code "KDU-1A v.00.38"} → 38).
 *
 * <p>When the block carries no trailing number the version is not
 * {@code recognized} and {@link #FALLBACK_NUMBER} is used, which selects the
 * smaller (legacy) address tier.</p>
 */
public record FirmwareVersion(String text, int number, boolean recognized)
{
    public static final int FALLBACK_NUMBER = 37;

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)\\s*$");

    public FirmwareVersion {
        Objects.requireNonNull(text, "text");
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative: " + number);
        }
    }

    public static FirmwareVersion of(int number) {
        return new FirmwareVersion("v." + number, number, true);
    }

    /**
     * @param registers raw version block, ASCII, NUL padded
     */
    public static FirmwareVersion parse(byte[] registers) {
        Objects.requireNonNull(registers, "registers");

        int end = registers.length;
        for (int i = 0; i < registers.length; i++) {
            if (registers[i] == 0) {
                end = i;
                break;
            }
        }
        String text = new String(registers, 0, end, StandardCharsets.US_ASCII).trim();

        Matcher m = TRAILING_NUMBER.matcher(text);
        if (m.find()) {
            try {
                return new FirmwareVersion(text, Integer.parseInt(m.group(1)), true);
            }
            catch (NumberFormatException e) {
                return new FirmwareVersion(text, FALLBACK_NUMBER, false);
            }
        }
        return new FirmwareVersion(text, FALLBACK_NUMBER, false);
    }
}
