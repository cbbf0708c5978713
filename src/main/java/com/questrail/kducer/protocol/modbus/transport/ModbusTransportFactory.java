package com.questrail.kducer.protocol.modbus.transport;

import java.time.Duration;

/**
 * Creates a fresh, unconnected {@link ModbusTransport} for each connection
 * attempt.
 */
@FunctionalInterface
public interface ModbusTransportFactory
{
    /**
     * @param host            device host name or address
     * @param port            device TCP port
     * @param exchangeTimeout send/receive progress timeout
     */
    ModbusTransport create(String host, int port, Duration exchangeTimeout);
}
