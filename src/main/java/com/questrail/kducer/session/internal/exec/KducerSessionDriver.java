package com.questrail.kducer.session.internal.exec;

import com.questrail.kducer.api.CancellationToken;
import com.questrail.kducer.api.SessionPhase;
import com.questrail.kducer.protocol.modbus.ModbusDeviceException;
import com.questrail.kducer.protocol.modbus.ModbusException;
import com.questrail.kducer.protocol.modbus.ModbusProtocolException;
import com.questrail.kducer.protocol.modbus.ModbusTransportException;
import com.questrail.kducer.protocol.modbus.client.ModbusExchangeClient;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransport;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransportFactory;
import com.questrail.kducer.session.config.KducerSessionConfig;
import com.questrail.kducer.session.internal.time.MonotonicClock;
import com.questrail.kducer.session.internal.time.WallClock;
import com.questrail.kducer.session.observability.KducerCommandFailureEvent;
import com.questrail.kducer.session.observability.KducerErrorEvent;
import com.questrail.kducer.session.observability.KducerObservabilitySink;
import com.questrail.kducer.session.observability.KducerPhaseTransitionEvent;
import com.questrail.kducer.session.observability.KducerResultBacklogEvent;
import com.questrail.kducer.session.observability.KducerTransportEvent;
import com.questrail.kducer.session.observability.NullKducerObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * KducerSessionDriver
 * =============================================================================
 * The session loop: one dedicated thread that owns the connection and performs
 * every exchange with the device.
 *
 * <h2>Threading Model</h2>
 * Callers never touch the transport. They enqueue {@link KducerCommand}s and
 * wait for completion; the loop thread drains them one per tick. This ensures:
 * <ul>
 *   <li>at most one Modbus exchange outstanding at any time</li>
 *   <li>commands complete in the order they were queued</li>
 *   <li>result polling never interleaves with a command</li>
 * </ul>
 *
 * <h2>Tick</h2>
 * <pre>
 *   deadline = now + pollInterval
 *   queued command? → execute exactly one
 *   otherwise       → one result poll step
 *   sleep until deadline (cancellable by stop)
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>{@link ModbusTransportException}: drop the connection, put the
 *       in-flight command back at the head of the queue, wait the reconnect
 *       delay and reconnect. Retries never stop. A command that is not
 *       {@linkplain CommandKind#isRepeatableAfterReconnect() repeatable}
 *       fails with the transport error instead of being put back.</li>
 *   <li>Protocol, device and validation errors: attached to the command that
 *       caused them; the connection is kept.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()  → DISCONNECTED → CONNECTING → ACTIVE
 *   driver.stop()   → STOPPED (terminal), queued commands discarded
 * </pre>
 */
public final class KducerSessionDriver
{
    private static final String RESULT_POLL = "RESULT_POLL";
    private static final int FIRST_BACKLOG_WARNING = 10;

    private final KducerSessionConfig config;
    private final ModbusTransportFactory transportFactory;
    private final CommandQueue commandQueue;
    private final ResultQueue resultQueue;
    private final SessionState state;
    private final TighteningResultReader resultReader;
    private final ResultPoller poller;
    private final KducerObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final CancellationToken sessionToken;
    private final String endpoint;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final Object phaseLock = new Object();

    private volatile SessionPhase phase = SessionPhase.DISCONNECTED;
    private volatile ModbusTransport transport;
    private volatile Thread loopThread;

    private int backlogWarningThreshold = FIRST_BACKLOG_WARNING;

    public KducerSessionDriver(KducerSessionConfig config,
                               ModbusTransportFactory transportFactory,
                               CommandQueue commandQueue,
                               ResultQueue resultQueue,
                               SessionState state,
                               TighteningResultReader resultReader,
                               KducerObservabilitySink observabilitySink,
                               MonotonicClock clock,
                               WallClock wallClock,
                               CancellationToken sessionToken)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.commandQueue = Objects.requireNonNull(commandQueue, "commandQueue");
        this.resultQueue = Objects.requireNonNull(resultQueue, "resultQueue");
        this.state = Objects.requireNonNull(state, "state");
        this.resultReader = Objects.requireNonNull(resultReader, "resultReader");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullKducerObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sessionToken = Objects.requireNonNull(sessionToken, "sessionToken");
        this.endpoint = config.host() + ":" + config.port();

        this.poller = new ResultPoller(state, resultQueue, resultReader, config.timingPolicy(),
                config.lockScrewdriverUntilResultFetched(), config.lockScrewdriverIndefinitelyAfterResult());
    }

    /**
     * Starts the loop thread.
     * Idempotent; a stopped driver cannot be restarted.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Session driver has been stopped");
        }
        if (running.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, "kducer-session-" + config.host());
            loopThread.setDaemon(true);
            loopThread.start();
        }
    }

    /**
     * Stops the loop and blocks until its thread terminates.
     *
     * <p>Wakes every sleep through the session token, closes the transport to
     * abort an exchange in progress and discards queued commands without
     * completing them. Waiting callers observe the cancellation through their
     * linked tokens.</p>
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        sessionToken.cancel();

        ModbusTransport t = transport;
        if (t != null) {
            t.close();
        }

        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        commandQueue.discardAll();
        transition(SessionPhase.STOPPED);
    }

    public SessionPhase phase() {
        return phase;
    }

    /**
     * True when the loop is ACTIVE and the transport reports a live connection.
     */
    public boolean isConnected() {
        ModbusTransport t = transport;
        return phase == SessionPhase.ACTIVE && t != null && t.isConnected();
    }

    /**
     * Main loop - runs on the dedicated thread.
     */
    private void runLoop() {
        Duration reconnectDelay = config.reconnectDelay();

        while (running.get()) {
            transition(SessionPhase.CONNECTING);
            try {
                ModbusExchangeClient client = connect();
                enterActive(client);
                reconnectDelay = config.reconnectDelay();
                runActive(client);
            } catch (CancellationException e) {
                break;
            } catch (ModbusTransportException e) {
                if (!running.get()) {
                    break;
                }
                observabilitySink.onTransportEvent(new KducerTransportEvent(wallClock.now(), endpoint,
                    phase == SessionPhase.ACTIVE
                        ? KducerTransportEvent.Kind.CONNECTION_LOST
                        : KducerTransportEvent.Kind.CONNECT_FAILED,
                    e));
            } catch (RuntimeException e) {
                if (!running.get()) {
                    break;
                }
                observabilitySink.onError(new KducerErrorEvent(wallClock.now(), endpoint,
                    "Session loop error, reconnecting", e));
            } finally {
                closeTransport();
            }

            if (!running.get()) {
                break;
            }
            transition(SessionPhase.CONNECTING);
            try {
                sessionToken.sleep(reconnectDelay);
            } catch (CancellationException e) {
                break;
            }
            reconnectDelay = nextBackoff(reconnectDelay);
        }
    }

    private ModbusExchangeClient connect() {
        ModbusTransport t = transportFactory.create(config.host(), config.port(), config.exchangeTimeout());
        transport = t;
        if (!running.get()) {
            throw new CancellationException("Session stopped while connecting");
        }
        t.connect(config.connectTimeout());
        return new ModbusExchangeClient(t, config.unitId());
    }

    private void enterActive(ModbusExchangeClient client) {
        FirmwareVersion firmware = KducerCommands.readFirmwareVersion(client);
        if (!firmware.recognized()) {
            observabilitySink.onError(new KducerErrorEvent(wallClock.now(), endpoint,
                "Unrecognized firmware version '" + firmware.text() + "', assuming "
                    + FirmwareVersion.FALLBACK_NUMBER, null));
        }
        state.firmware(firmware);
        poller.discardPendingFlag(client);

        backlogWarningThreshold = FIRST_BACKLOG_WARNING;
        observabilitySink.onTransportEvent(new KducerTransportEvent(wallClock.now(), endpoint,
            KducerTransportEvent.Kind.CONNECTED, null));
        transition(SessionPhase.ACTIVE);
    }

    private void runActive(ModbusExchangeClient client) {
        final long intervalNanos = config.pollInterval().toNanos();

        while (running.get()) {
            final long deadline = clock.nowNanos() + intervalNanos;

            KducerCommand<?> command = commandQueue.poll();
            if (command != null) {
                executeCommand(command, client);
            } else {
                pollStep(client);
            }
            checkBacklog();

            final long remaining = deadline - clock.nowNanos();
            if (remaining > 0L) {
                sessionToken.sleep(Duration.ofNanos(remaining));
            }
        }
    }

    private void executeCommand(KducerCommand<?> command, ModbusExchangeClient client) {
        if (command.token().isCancellationRequested()) {
            command.fail(new CancellationException(command.kind() + " cancelled before execution"));
            return;
        }

        CommandContext context = new CommandContext(client, state, config.timingPolicy(), resultReader,
            command.token());
        try {
            command.execute(context);
        } catch (ModbusTransportException e) {
            if (!command.kind().isRepeatableAfterReconnect()) {
                command.fail(e);
            } else if (running.get()) {
                commandQueue.requeueFirst(command);
            }
            throw e;
        } catch (CancellationException e) {
            command.fail(e);
            if (sessionToken.isCancellationRequested()) {
                throw e;
            }
        } catch (ModbusException | IllegalArgumentException e) {
            command.fail(e);
            observabilitySink.onCommandFailure(new KducerCommandFailureEvent(wallClock.now(), endpoint,
                command.kind().name(), e));
        } catch (RuntimeException e) {
            command.fail(e);
            observabilitySink.onError(new KducerErrorEvent(wallClock.now(), endpoint,
                "Unexpected failure executing " + command.kind(), e));
        }
    }

    private void pollStep(ModbusExchangeClient client) {
        try {
            poller.pollOnce(client, sessionToken);
        } catch (ModbusProtocolException | ModbusDeviceException e) {
            observabilitySink.onCommandFailure(new KducerCommandFailureEvent(wallClock.now(), endpoint,
                RESULT_POLL, e));
        }
    }

    private void checkBacklog() {
        int queued = resultQueue.size();
        if (queued >= backlogWarningThreshold) {
            observabilitySink.onResultBacklog(new KducerResultBacklogEvent(wallClock.now(), endpoint, queued));
            backlogWarningThreshold *= 10;
        }
    }

    private Duration nextBackoff(Duration current) {
        Duration doubled = current.multipliedBy(2);
        if (doubled.isZero()) {
            return current;
        }
        return doubled.compareTo(config.reconnectBackoffCap()) > 0 ? config.reconnectBackoffCap() : doubled;
    }

    private void closeTransport() {
        ModbusTransport t = transport;
        transport = null;
        if (t != null) {
            t.close();
        }
    }

    private void transition(SessionPhase next) {
        final SessionPhase previous;
        synchronized (phaseLock) {
            previous = phase;
            if (previous == next || previous == SessionPhase.STOPPED) {
                return;
            }
            phase = next;
        }
        observabilitySink.onPhaseTransition(new KducerPhaseTransitionEvent(wallClock.now(), endpoint, previous, next));
    }
}
