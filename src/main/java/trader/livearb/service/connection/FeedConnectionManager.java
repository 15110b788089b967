package trader.livearb.service.connection;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import trader.livearb.client.FeedSession;
import trader.livearb.client.FeedSessionHandler;
import trader.livearb.client.FeedTransport;
import trader.livearb.model.ConnectionState;
import trader.livearb.model.ConnectionStatus;
import trader.livearb.service.InboundFrameProcessor;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Owns the feed session and drives the connection state machine.
 * <p>
 * Handshakes, inbound frames, timer firings and API calls are handled one at a time under
 * this object's monitor. Every session and every reconnect timer is tagged with the epoch it
 * was started in; {@link #close()} advances the epoch so callbacks of an abandoned session or
 * timer are dropped.
 */
@Slf4j
@Service
public class FeedConnectionManager implements FeedConnection {

    private final FeedTransport transport;
    private final InboundFrameProcessor frameProcessor;
    private final ReconnectPolicy reconnectPolicy;
    private final Scheduler timerScheduler;
    private final ConnectionStatsTracker stats;
    private final Counter reconnectCounter;
    private final Counter terminalFailureCounter;
    private final ConnectionStateMachine stateMachine = new ConnectionStateMachine();

    private long epoch;
    private Disposable sessionSubscription;
    private Disposable reconnectTimer;
    private volatile FeedSession session;
    private volatile boolean terminal;

    public FeedConnectionManager(FeedTransport transport,
                                 InboundFrameProcessor frameProcessor,
                                 ReconnectPolicy reconnectPolicy,
                                 Scheduler timerScheduler,
                                 ConnectionStatsTracker stats,
                                 MeterRegistry meterRegistry) {
        this.transport = transport;
        this.frameProcessor = frameProcessor;
        this.reconnectPolicy = reconnectPolicy;
        this.timerScheduler = timerScheduler;
        this.stats = stats;
        this.reconnectCounter = Counter.builder("feed.reconnects")
                .description("Number of scheduled feed reconnect attempts")
                .register(meterRegistry);
        this.terminalFailureCounter = Counter.builder("feed.connection.terminal")
                .description("Number of times reconnect attempts were exhausted")
                .register(meterRegistry);
    }

    /**
     * Starts a session unless one is already open or opening. A pending reconnect timer is
     * cancelled and the retry budget starts over, which is also how a terminal error is
     * recovered from.
     */
    public synchronized void open() {
        ConnectionState state = stateMachine.current();
        if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED) {
            log.debug("Feed is already {}, ignoring open()", state);
            return;
        }
        cancelReconnectTimer();
        if (terminal) {
            log.info("Recovering feed connection after exhausted reconnect attempts");
        }
        terminal = false;
        stats.resetReconnectAttempts();
        connect();
    }

    /**
     * Tears the session down and cancels any pending reconnect before returning. Safe to
     * call in any state, any number of times.
     */
    public synchronized void close() {
        epoch++;
        cancelReconnectTimer();
        if (sessionSubscription != null) {
            sessionSubscription.dispose();
            sessionSubscription = null;
        }
        session = null;
        terminal = false;
        if (stateMachine.current() != ConnectionState.DISCONNECTED) {
            log.info("Closing feed connection to {}", transport.describe());
        }
        stateMachine.transition(ConnectionState.DISCONNECTED);
    }

    @Override
    public ConnectionState getState() {
        return stateMachine.current();
    }

    @Override
    public Optional<FeedSession> currentSession() {
        return Optional.ofNullable(session);
    }

    @Override
    public Flux<ConnectionState> stateChanges() {
        return stateMachine.changes();
    }

    public boolean isTerminal() {
        return terminal;
    }

    public synchronized boolean isReconnectScheduled() {
        return reconnectTimer != null && !reconnectTimer.isDisposed();
    }

    public ConnectionStatus status() {
        return ConnectionStatus.builder()
                .state(stateMachine.current())
                .terminal(terminal)
                .reconnectScheduled(isReconnectScheduled())
                .stats(stats.snapshot())
                .build();
    }

    private void connect() {
        long sessionEpoch = ++epoch;
        stateMachine.transition(ConnectionState.CONNECTING);
        log.info("Connecting to feed {} (session #{})", transport.describe(), sessionEpoch);
        SessionCallbacks callbacks = new SessionCallbacks(sessionEpoch);
        Disposable subscription = transport.open(callbacks)
                .subscribe(
                        null,
                        error -> onSessionEnded(sessionEpoch, error),
                        () -> onSessionEnded(sessionEpoch, null)
                );
        // the transport may already have failed or closed inside subscribe()
        ConnectionState state = stateMachine.current();
        if (sessionEpoch == epoch && (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED)) {
            sessionSubscription = subscription;
        }
    }

    private synchronized void onSessionOpened(long sessionEpoch, FeedSession openedSession) {
        if (sessionEpoch != epoch) {
            log.debug("Ignoring handshake of abandoned session #{}", sessionEpoch);
            return;
        }
        session = openedSession;
        stats.resetReconnectAttempts();
        stateMachine.transition(ConnectionState.CONNECTED);
        log.info("Feed connection established (session #{}, id {})", sessionEpoch, openedSession.getId());
    }

    private synchronized void onFrame(long sessionEpoch, String frame) {
        if (sessionEpoch != epoch) {
            return;
        }
        frameProcessor.process(frame);
    }

    private synchronized void onSessionEnded(long sessionEpoch, Throwable error) {
        if (sessionEpoch != epoch) {
            return;
        }
        session = null;
        sessionSubscription = null;
        if (error == null) {
            log.info("Feed connection closed cleanly");
            stateMachine.transition(ConnectionState.DISCONNECTED);
            return;
        }
        log.warn("Feed connection lost: {}", error.getMessage());
        stateMachine.transition(ConnectionState.ERROR);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        int attempts = stats.getReconnectAttempts();
        if (!reconnectPolicy.canRetry(attempts)) {
            terminal = true;
            terminalFailureCounter.increment();
            log.error("Max reconnection attempts ({}) reached, stopping reconnection", reconnectPolicy.getMaxAttempts());
            return;
        }
        Duration delay = reconnectPolicy.delayFor(attempts);
        int attempt = stats.incrementReconnectAttempts();
        reconnectCounter.increment();
        long timerEpoch = epoch;
        log.info("Attempting to reconnect in {} ms (attempt {}/{})",
                delay.toMillis(), attempt, reconnectPolicy.getMaxAttempts());
        reconnectTimer = timerScheduler.schedule(() -> onReconnectTimer(timerEpoch),
                delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void onReconnectTimer(long timerEpoch) {
        if (timerEpoch != epoch || stateMachine.current() != ConnectionState.ERROR) {
            return;
        }
        reconnectTimer = null;
        connect();
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.dispose();
            reconnectTimer = null;
        }
    }

    private final class SessionCallbacks implements FeedSessionHandler {

        private final long sessionEpoch;

        private SessionCallbacks(long sessionEpoch) {
            this.sessionEpoch = sessionEpoch;
        }

        @Override
        public void onOpen(FeedSession openedSession) {
            onSessionOpened(sessionEpoch, openedSession);
        }

        @Override
        public void onFrame(String frame) {
            FeedConnectionManager.this.onFrame(sessionEpoch, frame);
        }
    }
}
