package com.questrail.kducer.api;

import com.questrail.kducer.session.config.KducerSessionConfig;
import com.questrail.kducer.session.internal.exec.KducerTimingPolicy;
import com.questrail.kducer.session.runtime.KducerSession;
import com.questrail.kducer.sim.Await;
import com.questrail.kducer.sim.SimulatedKducer;
import com.questrail.kducer.sim.SimulatedKducerTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Caller tokens handed to a session must not keep links to it once the call
 * returns, whether the call succeeded or was rejected up front.
 */
@Timeout(20)
class KducerSessionTokenReleaseTest {

    private SimulatedKducer device;
    private KducerSession session;

    @BeforeEach
    void setUp() {
        device = new SimulatedKducer("KDU-1A v.00.38");
        session = KducerSession.builder()
            .withConfig(KducerSessionConfig.builder()
                .withHost("kducer.test")
                .withPollInterval(Duration.ofMillis(5))
                .withReconnectDelay(Duration.ofMillis(10))
                .withTimingPolicy(KducerTimingPolicy.immediate())
                .build())
            .withTransportFactory(SimulatedKducerTransport.factory(device))
            .build();
        session.start();
        Await.until(session::isConnected, "session connected");
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void rejectedArgumentsLeaveNoLinkOnCallerToken() {
        CancellationToken caller = CancellationToken.create();

        assertThrows(IllegalArgumentException.class,
            () -> session.sendBarcode("way too long for the device", caller));
        assertThrows(IllegalArgumentException.class,
            () -> session.sendMultipleProgramData(Map.of(), false, caller));
        assertThrows(NullPointerException.class,
            () -> session.sendMultipleSequenceData(null, false, caller));

        assertEquals(0, caller.linkedChildCount());
    }

    @Test
    void completedCallsLeaveNoLinkOnCallerToken() {
        CancellationToken caller = CancellationToken.create();

        session.selectProgram(3, caller);
        assertEquals(3, session.getProgram(caller));
        device.produceResult();
        assertNotNull(session.getResult(caller));

        assertEquals(0, caller.linkedChildCount());
    }
}
