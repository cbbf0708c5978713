package com.questrail.kducer.protocol.modbus.transport.tcp.netty;

import com.questrail.kducer.protocol.modbus.ModbusTransportException;
import com.questrail.kducer.protocol.modbus.client.ModbusExchangeClient;
import com.questrail.kducer.protocol.modbus.codec.ModbusBytes;
import com.questrail.kducer.sim.SimulatedKducer;
import com.questrail.kducer.sim.SimulatedKducerTcpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpTransportTest
 * -----------------------------------------------------------------------------
 * Runs the Netty transport against real loopback sockets.
 */
@Timeout(20)
class NettyTcpTransportTest {

    private SimulatedKducer device;
    private SimulatedKducerTcpServer server;
    private NettyTcpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        device = new SimulatedKducer("KDU-1A v.00.38");
        server = new SimulatedKducerTcpServer(device);
        transport = new NettyTcpTransport(server.host(), server.port(), Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() throws IOException {
        transport.close();
        server.close();
    }

    @Test
    void exchangesRegistersWithDevice() {
        device.setHolding(7372, 12);
        transport.connect(Duration.ofSeconds(2));
        assertTrue(transport.isConnected());

        ModbusExchangeClient client = new ModbusExchangeClient(transport, 1);

        assertEquals(12, ModbusBytes.readUnsignedShort(client.readHoldingRegisters(7372, 1), 0));
        client.writeSingleRegister(7372, 13);
        client.writeSingleCoil(34, true);

        assertEquals(13, device.holding(7372));
        assertTrue(device.coil(34));
    }

    @Test
    void connectIsIdempotent() {
        transport.connect(Duration.ofSeconds(2));
        transport.connect(Duration.ofSeconds(2));

        assertTrue(transport.isConnected());
    }

    @Test
    void receiveTimesOutWithoutResponse() {
        transport.connect(Duration.ofSeconds(2));

        ModbusTransportException e = assertThrows(ModbusTransportException.class, () -> transport.receiveAll(7));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void peerCloseFailsBlockedReceive() throws Exception {
        transport.connect(Duration.ofSeconds(2));
        ModbusExchangeClient client = new ModbusExchangeClient(transport, 1);
        client.readHoldingRegisters(7372, 1);

        server.dropClient();

        assertThrows(ModbusTransportException.class, () -> {
            client.readHoldingRegisters(7372, 1);
            client.readHoldingRegisters(7372, 1);
        });
    }

    @Test
    void closeFromAnotherThreadAbortsReceive() throws Exception {
        try (ServerSocket silent = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            NettyTcpTransport slow = new NettyTcpTransport(
                    silent.getInetAddress().getHostAddress(), silent.getLocalPort(), Duration.ofSeconds(10));
            slow.connect(Duration.ofSeconds(2));
            try (Socket accepted = silent.accept()) {
                CountDownLatch failed = new CountDownLatch(1);
                Thread receiver = new Thread(() -> {
                    try {
                        slow.receiveAll(7);
                    } catch (ModbusTransportException e) {
                        failed.countDown();
                    }
                });
                receiver.start();

                Thread.sleep(100);
                slow.close();

                assertTrue(failed.await(2, TimeUnit.SECONDS), "receive should fail promptly after close");
                assertFalse(slow.isConnected());
            }
        }
    }

    @Test
    void refusedConnectionIsTransportFailure() throws IOException {
        int unusedPort;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            unusedPort = socket.getLocalPort();
        }
        NettyTcpTransport refused = new NettyTcpTransport("127.0.0.1", unusedPort, Duration.ofMillis(250));
        try {
            assertThrows(ModbusTransportException.class, () -> refused.connect(Duration.ofSeconds(2)));
            assertFalse(refused.isConnected());
        } finally {
            refused.close();
        }
    }
}
