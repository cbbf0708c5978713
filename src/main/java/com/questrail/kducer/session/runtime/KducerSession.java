package com.questrail.kducer.session.runtime;

import com.questrail.kducer.api.CancellationToken;
import com.questrail.kducer.api.KducerController;
import com.questrail.kducer.api.SessionPhase;
import com.questrail.kducer.api.TighteningResultEvent;
import com.questrail.kducer.protocol.modbus.ModbusTransportException;
import com.questrail.kducer.protocol.modbus.transport.ModbusTransportFactory;
import com.questrail.kducer.protocol.modbus.transport.tcp.netty.NettyTcpTransport;
import com.questrail.kducer.session.config.KducerSessionConfig;
import com.questrail.kducer.session.internal.exec.CommandQueue;
import com.questrail.kducer.session.internal.exec.FirmwareVersion;
import com.questrail.kducer.session.internal.exec.KducerCommand;
import com.questrail.kducer.session.internal.exec.KducerCommands;
import com.questrail.kducer.session.internal.exec.KducerSessionDriver;
import com.questrail.kducer.session.internal.exec.ResultQueue;
import com.questrail.kducer.session.internal.exec.SessionState;
import com.questrail.kducer.session.internal.exec.TighteningResultReader;
import com.questrail.kducer.session.internal.time.MonotonicClock;
import com.questrail.kducer.session.internal.time.SystemMonotonicClock;
import com.questrail.kducer.session.internal.time.SystemWallClock;
import com.questrail.kducer.session.internal.time.WallClock;
import com.questrail.kducer.session.observability.KducerObservabilitySink;
import com.questrail.kducer.session.observability.Slf4jKducerObservabilitySink;

import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.function.Function;

/**
 * KducerSession
 * =============================================================================
 * Composition root and lifecycle owner for one K-Ducer controller session.
 *
 * <p>Wires the transport factory, the session loop, the command and result
 * queues and the observability sink, and implements {@link KducerController}
 * on top of them.</p>
 *
 * <pre>
 *   try (KducerSession kdu = KducerSession.builder()
 *           .withConfig(KducerSessionConfig.builder().withHost("192.168.5.6").build())
 *           .build()) {
 *       kdu.start();
 *       kdu.selectProgram(3);
 *       TighteningResultEvent result = kdu.getResult();
 *   }
 * </pre>
 */
public final class KducerSession implements KducerController {
    private final KducerSessionConfig config;
    private final KducerSessionDriver driver;
    private final CommandQueue commandQueue;
    private final ResultQueue resultQueue;
    private final SessionState state;
    private final CancellationToken sessionToken;

    private KducerSession(KducerSessionConfig config,
                          KducerSessionDriver driver,
                          CommandQueue commandQueue,
                          ResultQueue resultQueue,
                          SessionState state,
                          CancellationToken sessionToken) {
        this.config = config;
        this.driver = driver;
        this.commandQueue = commandQueue;
        this.resultQueue = resultQueue;
        this.state = state;
        this.sessionToken = sessionToken;
    }

    @Override
    public void start() {
        driver.start();
    }

    @Override
    public void stop() {
        driver.stop();
    }

    @Override
    public SessionPhase phase() {
        return driver.phase();
    }

    @Override
    public boolean isConnected() {
        return driver.isConnected();
    }

    @Override
    public OptionalInt firmwareVersion() {
        Optional<FirmwareVersion> fw = state.firmware();
        return fw.isPresent() ? OptionalInt.of(fw.get().number()) : OptionalInt.empty();
    }

    @Override
    public int getFirmwareVersion(CancellationToken token) {
        return submit(KducerCommands::getFirmwareVersion, token);
    }

    @Override
    public int getProgram(CancellationToken token) {
        return submit(KducerCommands::getProgram, token);
    }

    @Override
    public void selectProgram(int program, CancellationToken token) {
        submit(t -> KducerCommands.selectProgram(program, t), token);
    }

    @Override
    public int getSequence(CancellationToken token) {
        return submit(KducerCommands::getSequence, token);
    }

    @Override
    public void selectSequence(int sequence, CancellationToken token) {
        submit(t -> KducerCommands.selectSequence(sequence, t), token);
    }

    @Override
    public void disableScrewdriver(CancellationToken token) {
        submit(KducerCommands::disableScrewdriver, token);
    }

    @Override
    public void enableScrewdriver(CancellationToken token) {
        submit(KducerCommands::enableScrewdriver, token);
    }

    @Override
    public TighteningResultEvent runScrewdriverUntilResult(CancellationToken token) {
        return submit(KducerCommands::runScrewdriver, token);
    }

    @Override
    public TighteningResultEvent getResult(CancellationToken token) {
        return getResult(token, false);
    }

    @Override
    public TighteningResultEvent getResult(CancellationToken token, boolean failFastOnDisconnect) {
        Objects.requireNonNull(token, "token");
        CancellationToken linked = CancellationToken.linked(token, sessionToken);
        try {
            while (true) {
                Optional<TighteningResultEvent> result = resultQueue.poll();
                if (result.isPresent()) {
                    return result.get();
                }
                if (failFastOnDisconnect && driver.phase() != SessionPhase.ACTIVE) {
                    throw new ModbusTransportException("Not connected to " + config.host() + ":" + config.port());
                }
                linked.sleep(config.pollInterval());
            }
        } finally {
            linked.release();
        }
    }

    @Override
    public Optional<TighteningResultEvent> tryGetResult() {
        return resultQueue.poll();
    }

    @Override
    public boolean hasNewResult() {
        return !resultQueue.isEmpty();
    }

    @Override
    public void clearResultQueue() {
        resultQueue.clear();
    }

    @Override
    public byte[] getActiveProgramData(CancellationToken token) {
        return submit(KducerCommands::getActiveProgramData, token);
    }

    @Override
    public byte[] getProgramData(int program, CancellationToken token) {
        return submit(t -> KducerCommands.getProgramData(program, t), token);
    }

    @Override
    public SortedMap<Integer, byte[]> getAllProgramData(CancellationToken token) {
        return submit(KducerCommands::getAllProgramData, token);
    }

    @Override
    public void sendProgramData(int program, byte[] data, boolean permanent, CancellationToken token) {
        submit(t -> KducerCommands.sendProgramData(program, data, permanent, t), token);
    }

    @Override
    public void sendMultipleProgramData(Map<Integer, byte[]> programs, boolean permanent, CancellationToken token) {
        submit(t -> KducerCommands.sendMultipleProgramData(programs, permanent, t), token);
    }

    @Override
    public byte[] getSequenceData(int sequence, CancellationToken token) {
        return submit(t -> KducerCommands.getSequenceData(sequence, t), token);
    }

    @Override
    public SortedMap<Integer, byte[]> getAllSequenceData(CancellationToken token) {
        return submit(KducerCommands::getAllSequenceData, token);
    }

    @Override
    public void sendSequenceData(int sequence, byte[] data, boolean permanent, CancellationToken token) {
        submit(t -> KducerCommands.sendSequenceData(sequence, data, permanent, t), token);
    }

    @Override
    public void sendMultipleSequenceData(Map<Integer, byte[]> sequences, boolean permanent, CancellationToken token) {
        submit(t -> KducerCommands.sendMultipleSequenceData(sequences, permanent, t), token);
    }

    @Override
    public byte[] getGeneralSettings(CancellationToken token) {
        return submit(KducerCommands::getGeneralSettings, token);
    }

    @Override
    public void sendGeneralSettings(byte[] settings, boolean permanent, CancellationToken token) {
        submit(t -> KducerCommands.sendGeneralSettings(settings, permanent, t), token);
    }

    @Override
    public void sendBarcode(String barcode, CancellationToken token) {
        submit(t -> KducerCommands.sendBarcode(barcode, t), token);
    }

    @Override
    public void setHighResGraphMode(boolean enabled, CancellationToken token) {
        submit(t -> KducerCommands.setHighResGraphMode(enabled, t), token);
    }

    private <T> T submit(Function<CancellationToken, KducerCommand<T>> factory, CancellationToken token) {
        Objects.requireNonNull(token, "token");
        if (driver.phase() == SessionPhase.STOPPED) {
            throw new IllegalStateException("Session is stopped");
        }
        CancellationToken linked = CancellationToken.linked(token, sessionToken);
        final KducerCommand<T> command;
        try {
            command = factory.apply(linked);
        } catch (RuntimeException e) {
            // argument validation on the caller's thread; nothing was queued
            linked.release();
            throw e;
        }
        commandQueue.enqueue(command);
        return command.await(config.pollInterval());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private KducerSessionConfig config;
        private ModbusTransportFactory transportFactory = NettyTcpTransport.factory();
        private KducerObservabilitySink observabilitySink;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ZoneId zone = ZoneId.systemDefault();

        public Builder withConfig(KducerSessionConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransportFactory(ModbusTransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder withObservabilitySink(KducerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        /**
         * Time zone used when result timestamps are replaced with local time.
         */
        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public KducerSession build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transportFactory, "transportFactory");
            Objects.requireNonNull(monotonicClock, "monotonicClock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(zone, "zone");

            KducerObservabilitySink sink = observabilitySink != null
                ? observabilitySink
                : new Slf4jKducerObservabilitySink(config.logFailedConnectionsAsWarning());

            CancellationToken sessionToken = CancellationToken.create();
            CommandQueue commandQueue = new CommandQueue();
            ResultQueue resultQueue = new ResultQueue();
            SessionState state = new SessionState(config.fetchGraphs());
            TighteningResultReader reader = new TighteningResultReader(wallClock, zone,
                config.replaceResultTimestampWithLocalTime());

            KducerSessionDriver driver = new KducerSessionDriver(
                config,
                transportFactory,
                commandQueue,
                resultQueue,
                state,
                reader,
                sink,
                monotonicClock,
                wallClock,
                sessionToken
            );

            return new KducerSession(config, driver, commandQueue, resultQueue, state, sessionToken);
        }
    }
}
