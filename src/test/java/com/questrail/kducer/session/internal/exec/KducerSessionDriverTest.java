package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.CancellationToken;
import com.questrail.kducer.api.SessionPhase;
import com.questrail.kducer.api.TighteningResultEvent;
import com.questrail.kducer.protocol.modbus.ModbusDeviceBusyException;
import com.questrail.kducer.protocol.modbus.ModbusTransportException;
import com.questrail.kducer.session.config.KducerSessionConfig;
import com.questrail.kducer.session.internal.time.SystemMonotonicClock;
import com.questrail.kducer.session.observability.KducerCommandFailureEvent;
import com.questrail.kducer.session.observability.KducerErrorEvent;
import com.questrail.kducer.session.observability.KducerPhaseTransitionEvent;
import com.questrail.kducer.session.observability.KducerResultBacklogEvent;
import com.questrail.kducer.session.observability.KducerTransportEvent;
import com.questrail.kducer.session.observability.RecordingKducerObservabilitySink;
import com.questrail.kducer.sim.Await;
import com.questrail.kducer.sim.SimulatedKducer;
import com.questrail.kducer.sim.SimulatedKducerTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KducerSessionDriverTest
 * -----------------------------------------------------------------------------
 * The session loop against the in-memory simulated device: ordering,
 * reconnects, failure attribution and lifecycle.
 */
@Timeout(20)
class KducerSessionDriverTest {

    private static final Instant NOW = Instant.parse("2024-03-05T14:07:09Z");

    private final RecordingKducerObservabilitySink sink = new RecordingKducerObservabilitySink();
    private final CommandQueue commands = new CommandQueue();
    private final ResultQueue results = new ResultQueue();
    private final SessionState state = new SessionState(false);
    private final List<SimulatedKducerTransport> transports = new CopyOnWriteArrayList<>();

    private SimulatedKducer device;
    private KducerSessionDriver driver;

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.stop();
        }
    }

    private KducerSessionDriver driver(String firmware, boolean lockUntilFetched) {
        device = new SimulatedKducer(firmware);
        KducerSessionConfig config = KducerSessionConfig.builder()
            .withHost("kducer.test")
            .withPollInterval(Duration.ofMillis(5))
            .withReconnectDelay(Duration.ofMillis(10))
            .withLockScrewdriverUntilResultFetched(lockUntilFetched)
            .withTimingPolicy(KducerTimingPolicy.immediate())
            .build();

        driver = new KducerSessionDriver(
            config,
            (host, port, timeout) -> {
                SimulatedKducerTransport transport = new SimulatedKducerTransport(device);
                transports.add(transport);
                return transport;
            },
            commands,
            results,
            state,
            new TighteningResultReader(() -> NOW, ZoneOffset.UTC, false),
            sink,
            SystemMonotonicClock.INSTANCE,
            () -> NOW,
            CancellationToken.create()
        );
        return driver;
    }

    private static void awaitAll(List<? extends KducerCommand<?>> queued) {
        Await.until(() -> queued.stream().allMatch(KducerCommand::isCompleted), "all commands completed");
    }

    @Test
    void connectsReadsFirmwareAndBecomesActive() {
        driver("KDU-1A v.00.38", false).start();

        Await.until(() -> sink.eventsOfType(KducerPhaseTransitionEvent.class).size() == 2, "session active");

        assertEquals(SessionPhase.ACTIVE, driver.phase());
        assertTrue(driver.isConnected());
        assertEquals(38, state.firmware().orElseThrow().number());
        List<SessionPhase> phases = new ArrayList<>();
        for (KducerPhaseTransitionEvent e : sink.eventsOfType(KducerPhaseTransitionEvent.class)) {
            phases.add(e.newPhase());
        }
        assertEquals(List.of(SessionPhase.CONNECTING, SessionPhase.ACTIVE), phases);
        assertEquals(KducerTransportEvent.Kind.CONNECTED,
            sink.eventsOfType(KducerTransportEvent.class).get(0).kind());
    }

    @Test
    void commandsRunOneAtATimeInQueueOrder() {
        driver("KDU-1A v.00.38", false);
        List<KducerCommand<Void>> queued = new ArrayList<>();
        for (int program = 1; program <= 10; program++) {
            KducerCommand<Void> command = KducerCommands.selectProgram(program, CancellationToken.create());
            queued.add(command);
            commands.enqueue(command);
        }

        driver.start();
        awaitAll(queued);

        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10),
            device.registerWrites(KducerAddressMap.ACTIVE_PROGRAM_ADDRESS));
        assertFalse(transports.get(0).overlapDetected());
    }

    @Test
    void droppedConnectionRequeuesInFlightCommandAtHead() {
        driver("KDU-1A v.00.38", false);
        device.dropConnectionOn(r -> r.functionCode() == 6
            && r.address() == KducerAddressMap.ACTIVE_PROGRAM_ADDRESS && r.value() == 3);
        List<KducerCommand<Void>> queued = new ArrayList<>();
        for (int program = 1; program <= 5; program++) {
            KducerCommand<Void> command = KducerCommands.selectProgram(program, CancellationToken.create());
            queued.add(command);
            commands.enqueue(command);
        }

        driver.start();
        awaitAll(queued);

        assertEquals(2, device.connections());
        assertEquals(List.of(1, 2, 3, 4, 5), device.registerWrites(KducerAddressMap.ACTIVE_PROGRAM_ADDRESS));
        for (KducerCommand<Void> command : queued) {
            assertDoesNotThrow(() -> command.await(Duration.ofMillis(1)));
        }
        assertTrue(sink.eventsOfType(KducerTransportEvent.class).stream()
            .anyMatch(e -> e.kind() == KducerTransportEvent.Kind.CONNECTION_LOST));
    }

    @Test
    void droppedConnectionFailsRunScrewdriverInsteadOfRepeatingIt() {
        driver("KDU-1A v.00.38", false);
        device.produceResultAfterLeverPresses(3);
        device.dropConnectionOn(r -> r.functionCode() == 5
            && r.address() == KducerAddressMap.REMOTE_LEVER_COIL && r.value() == 1);
        KducerCommand<TighteningResultEvent> run = KducerCommands.runScrewdriver(CancellationToken.create());
        KducerCommand<Void> select = KducerCommands.selectProgram(2, CancellationToken.create());
        commands.enqueue(run);
        commands.enqueue(select);

        driver.start();
        awaitAll(List.of(run, select));

        assertThrows(ModbusTransportException.class, () -> run.await(Duration.ofMillis(1)));
        assertDoesNotThrow(() -> select.await(Duration.ofMillis(1)));
        assertEquals(List.of(2), device.registerWrites(KducerAddressMap.ACTIVE_PROGRAM_ADDRESS));
        assertEquals(2, device.connections());
    }

    @Test
    void busyDeviceFailsOnlyTheCommand() {
        driver("KDU-1A v.00.38", false);
        device.injectException(r -> r.functionCode() == 6, ModbusDeviceBusyException.SERVER_BUSY);
        KducerCommand<Void> first = KducerCommands.selectProgram(4, CancellationToken.create());
        KducerCommand<Void> second = KducerCommands.selectProgram(4, CancellationToken.create());
        commands.enqueue(first);
        commands.enqueue(second);

        driver.start();
        awaitAll(List.of(first, second));

        assertThrows(ModbusDeviceBusyException.class, () -> first.await(Duration.ofMillis(1)));
        assertDoesNotThrow(() -> second.await(Duration.ofMillis(1)));
        assertEquals(4, device.holding(KducerAddressMap.ACTIVE_PROGRAM_ADDRESS));
        assertEquals(1, device.connections());
        KducerCommandFailureEvent failure = sink.eventsOfType(KducerCommandFailureEvent.class).get(0);
        assertEquals("SELECT_PROGRAM", failure.operation());
    }

    @Test
    void commandCancelledBeforeExecutionNeverTouchesDevice() {
        driver("KDU-1A v.00.38", false);
        CancellationToken token = CancellationToken.create();
        KducerCommand<Void> command = KducerCommands.selectProgram(9, token);
        token.cancel();
        commands.enqueue(command);

        driver.start();
        Await.until(command::isCompleted, "cancelled command completed");

        assertThrows(CancellationException.class, () -> command.await(Duration.ofMillis(1)));
        assertTrue(device.registerWrites(KducerAddressMap.ACTIVE_PROGRAM_ADDRESS).isEmpty());
    }

    @Test
    void resultsArePolledBetweenCommands() {
        driver("KDU-1A v.00.38", true).start();
        Await.until(driver::isConnected, "session connected");

        device.produceResult();
        Await.until(() -> results.size() == 1, "result published");

        Await.until(() -> device.coil(KducerAddressMap.STOP_MOTOR_COIL), "motor locked");
        results.clear();
        Await.until(() -> !device.coil(KducerAddressMap.STOP_MOTOR_COIL), "motor released");
    }

    @Test
    void resultCompletedBeforeConnectIsNotReported() {
        driver("KDU-1A v.00.38", false);
        device.produceResult();

        driver.start();
        Await.until(driver::isConnected, "session connected");
        KducerCommand<Integer> marker = KducerCommands.getProgram(CancellationToken.create());
        commands.enqueue(marker);
        Await.until(marker::isCompleted, "marker command completed");

        assertTrue(results.isEmpty());
    }

    @Test
    void backlogIsReportedAtTenResults() {
        driver("KDU-1A v.00.38", false).start();
        Await.until(driver::isConnected, "session connected");

        for (int i = 1; i <= 10; i++) {
            device.produceResult();
            final int expected = i;
            Await.until(() -> results.size() == expected, "result " + expected + " published");
        }
        Await.until(() -> sink.hasEventOfType(KducerResultBacklogEvent.class), "backlog reported");

        assertEquals(10, sink.eventsOfType(KducerResultBacklogEvent.class).get(0).queuedResults());
    }

    @Test
    void refusedConnectionsAreRetried() {
        driver("KDU-1A v.00.38", false);
        device.refuseConnections(true);

        driver.start();
        Await.until(() -> sink.eventsOfType(KducerTransportEvent.class).size() >= 2, "connect retried");
        assertEquals(SessionPhase.CONNECTING, driver.phase());
        assertTrue(sink.eventsOfType(KducerTransportEvent.class).stream()
            .allMatch(e -> e.kind() == KducerTransportEvent.Kind.CONNECT_FAILED));

        device.refuseConnections(false);
        Await.until(driver::isConnected, "session connected");
    }

    @Test
    void unrecognizedFirmwareFallsBackToLegacyTier() {
        driver("KDU-1A", false).start();
        Await.until(driver::isConnected, "session connected");

        assertEquals(FirmwareVersion.FALLBACK_NUMBER, state.firmware().orElseThrow().number());
        assertTrue(sink.hasEventOfType(KducerErrorEvent.class));
    }

    @Test
    void stopDiscardsQueuedCommandsAndIsTerminal() {
        driver("KDU-1A v.00.38", false);
        device.refuseConnections(true);
        commands.enqueue(KducerCommands.getProgram(CancellationToken.create()));

        driver.start();
        driver.stop();

        assertEquals(SessionPhase.STOPPED, driver.phase());
        assertTrue(commands.isEmpty());
        assertFalse(driver.isConnected());
        assertThrows(IllegalStateException.class, driver::start);
    }
}
