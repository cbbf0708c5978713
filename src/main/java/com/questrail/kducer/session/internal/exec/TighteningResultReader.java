package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.TighteningResultEvent;
import com.questrail.kducer.protocol.modbus.client.ModbusExchangeClient;
import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;
import com.questrail.kducer.session.internal.time.WallClock;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Reads one tightening result (and optionally its graph) from the device.
 *
 * <p>The controller clock knows nothing about time zones or daylight saving.
 * When {@code replaceTimestamp} is set, the six timestamp registers of the
 * result (bytes 102..113: year % 2000, month, day, hour, minute, second) are
 * overwritten with local time taken from the wall clock at read time.</p>
 */
public final class TighteningResultReader
{
    static final int TIMESTAMP_OFFSET = 102;

    private static final byte[] NO_GRAPH = new byte[0];

    private final WallClock wallClock;
    private final ZoneId zone;
    private final boolean replaceTimestamp;

    public TighteningResultReader(WallClock wallClock, ZoneId zone, boolean replaceTimestamp)
    {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.replaceTimestamp = replaceTimestamp;
    }

    public TighteningResultEvent read(ModbusExchangeClient client, boolean withGraph)
    {
        byte[] result = client.readInputRegisters(KducerAddressMap.RESULT_ADDRESS, KducerAddressMap.RESULT_REGISTERS);

        byte[] torque = NO_GRAPH;
        byte[] angle = NO_GRAPH;
        if (withGraph) {
            torque = client.readInputRegisters(KducerAddressMap.TORQUE_GRAPH_ADDRESS, KducerAddressMap.GRAPH_REGISTERS);
            angle = client.readInputRegisters(KducerAddressMap.ANGLE_GRAPH_ADDRESS, KducerAddressMap.GRAPH_REGISTERS);
        }

        Instant now = wallClock.now();
        if (replaceTimestamp) {
            overrideTimestamp(result, LocalDateTime.ofInstant(now, zone));
        }
        return new TighteningResultEvent(now, result, torque, angle);
    }

    static void overrideTimestamp(byte[] result, LocalDateTime local)
    {
        int at = TIMESTAMP_OFFSET;
        ModbusBytes.writeUnsignedShort(local.getYear() % 2000, result, at);
        ModbusBytes.writeUnsignedShort(local.getMonthValue(), result, at + 2);
        ModbusBytes.writeUnsignedShort(local.getDayOfMonth(), result, at + 4);
        ModbusBytes.writeUnsignedShort(local.getHour(), result, at + 6);
        ModbusBytes.writeUnsignedShort(local.getMinute(), result, at + 8);
        ModbusBytes.writeUnsignedShort(local.getSecond(), result, at + 10);
    }
}
