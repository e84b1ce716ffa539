package com.chainwatch.watcher;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Watcher that prefers the strategy's push subscription and falls back to polling when the subscription
 * cannot be established or breaks. Emits one ordered, deduplicated stream of updates either way.
 * <p>
 * Flow:
 * <ol>
 *     <li>CONNECTING: race {@code subscribe} against {@code wsConnectTimeout}. Failures are retried with the
 *     reconnect policy (RECONNECTING); once retries are exhausted the watcher polls, or stops with an
 *     {@link UnrecoverableWatcherException} when the strategy has no poll.</li>
 *     <li>STREAMING: one seed poll, then the stream. Optional heartbeat polls run alongside.</li>
 *     <li>POLLING: one poll immediately, then one per {@code pollInterval}. Failed polls are reported and
 *     the timer keeps going.</li>
 * </ol>
 * All producers feed a single {@link SlotGate}; every scheduled task and in-flight call is disposed by
 * {@link #stop()}.
 */
@Slf4j
public final class UnifiedWatcher<R, N> implements WatcherHandle {

    private final WatcherStrategy<R, N> strategy;
    private final WatcherOptions<N> options;
    private final Scheduler scheduler;
    private final String name;
    private final SlotGate<N> gate;
    private final CancellationToken cancellation = CancellationToken.create();

    private final AtomicReference<WatcherState> state = new AtomicReference<>(WatcherState.CONNECTING);
    private final AtomicInteger failedAttempts = new AtomicInteger();
    private final AtomicBoolean polling = new AtomicBoolean();

    private final Disposable.Swap connectTask = Disposables.swap();
    private final Disposable.Swap streamTask = Disposables.swap();
    private final Disposable.Swap heartbeatTask = Disposables.swap();
    private final Disposable.Swap pollTask = Disposables.swap();
    private final Disposable.Swap reconnectTask = Disposables.swap();
    private final Disposable.Composite tasks =
            Disposables.composite(connectTask, streamTask, heartbeatTask, pollTask, reconnectTask);

    private UnifiedWatcher(WatcherStrategy<R, N> strategy, WatcherOptions<N> options) {
        this.strategy = strategy;
        this.options = options;
        this.scheduler = options.getScheduler();
        this.name = options.getName();
        this.gate = new SlotGate<>(name, options.getOnUpdate(), options.getOnError());
    }

    /**
     * Starts watching and returns immediately. Connection and poll failures are reported through
     * {@code onError}, never thrown from here.
     *
     * @throws IllegalArgumentException when strategy or options are missing
     */
    public static <R, N> WatcherHandle start(WatcherStrategy<R, N> strategy, WatcherOptions<N> options) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (options == null) {
            throw new IllegalArgumentException("options are required");
        }
        UnifiedWatcher<R, N> watcher = new UnifiedWatcher<>(strategy, options);
        watcher.begin();
        return watcher;
    }

    private void begin() {
        log.info("[{}] starting: poll={}, retryMode={}, maxRetries={}",
                name, strategy.hasPoll(), options.getRetryMode(), options.getMaxRetries());
        if (options.getParentToken() != null) {
            options.getParentToken().onCancel(this::stop);
        }
        connect();
    }

    @Override
    public void stop() {
        if (!gate.close()) {
            return;
        }
        WatcherState previous = state.getAndSet(WatcherState.STOPPED);
        log.info("[{}] stopped in state {} at slot {}", name, previous, gate.lastAcceptedSlot());
        cancellation.cancel();
        tasks.dispose();
    }

    @Override
    public boolean isStopped() {
        return gate.isClosed();
    }

    @Override
    public WatcherState state() {
        return state.get();
    }

    @Override
    public long lastAcceptedSlot() {
        return gate.lastAcceptedSlot();
    }

    @Override
    public String name() {
        return name;
    }

    // --- connect / reconnect ---

    private void connect() {
        if (gate.isClosed()) {
            return;
        }
        Duration timeout = options.getWsConnectTimeout();
        connectTask.update(Mono.defer(() -> strategy.subscribe(cancellation))
                .subscribeOn(scheduler)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("subscribe completed without a stream")))
                .timeout(timeout, Mono.<Flux<SubscriptionItem<R>>>error(() -> new WsConnectTimeoutException(timeout)), scheduler)
                .subscribe(this::onConnected, this::onConnectFailed));
    }

    private void onConnected(Flux<SubscriptionItem<R>> stream) {
        if (gate.isClosed()) {
            return;
        }
        failedAttempts.set(0);
        if (polling.compareAndSet(true, false)) {
            log.info("[{}] subscription re-established, stopping poll timer", name);
            cancel(pollTask);
        }
        transition(WatcherState.STREAMING);
        Mono<Void> seed = strategy.hasPoll() ? pollOnce("seed") : Mono.empty();
        streamTask.update(seed
                .then(Mono.fromRunnable(this::startHeartbeat))
                .thenMany(stream)
                .subscribe(this::onItem, this::onStreamError, this::onStreamComplete));
    }

    private void onConnectFailed(Throwable error) {
        if (gate.isClosed()) {
            return;
        }
        int failures = failedAttempts.incrementAndGet();
        log.warn("[{}] subscription attempt {} failed: {}", name, failures, messageOf(error));
        gate.report(error);
        if (polling.get()) {
            scheduleReconnectWhilePolling();
            return;
        }
        RetryPolicy policy = options.getReconnectPolicy();
        if (failures <= policy.getMaxAttempts()) {
            transition(WatcherState.RECONNECTING);
            scheduleConnect(Duration.ofMillis(policy.delayMs(failures - 1)));
            return;
        }
        log.warn("[{}] giving up on subscription after {} attempts", name, failures);
        startPolling();
    }

    private void scheduleConnect(Duration delay) {
        reconnectTask.update(Mono.delay(delay, scheduler).subscribe(tick -> connect()));
    }

    private void scheduleReconnectWhilePolling() {
        Duration every = options.getPollingReconnectInterval();
        if (options.getRetryMode() != RetryMode.PERPETUAL || every.isZero() || gate.isClosed()) {
            return;
        }
        scheduleConnect(every);
    }

    // --- streaming ---

    private void onItem(SubscriptionItem<R> item) {
        if (item instanceof SubscriptionItem.Enveloped<R> enveloped) {
            gate.offer(enveloped.slot(), normalize(enveloped.value()));
        } else {
            gate.offerNext(normalize(item.value()));
        }
    }

    private void onStreamError(Throwable error) {
        if (gate.isClosed()) {
            return;
        }
        cancel(heartbeatTask);
        log.warn("[{}] subscription stream failed: {}", name, messageOf(error));
        gate.report(error);
        afterStreamLoss();
    }

    private void onStreamComplete() {
        if (gate.isClosed()) {
            return;
        }
        cancel(heartbeatTask);
        log.info("[{}] subscription stream closed", name);
        afterStreamLoss();
    }

    private void afterStreamLoss() {
        if (options.getRetryMode() == RetryMode.PERPETUAL) {
            transition(WatcherState.RECONNECTING);
            scheduleConnect(Duration.ofMillis(options.getReconnectPolicy().delayMs(0)));
            return;
        }
        startPolling();
    }

    private void startHeartbeat() {
        Duration every = options.getHeartbeatPollInterval();
        if (every.isZero() || !strategy.hasPoll() || gate.isClosed()) {
            return;
        }
        heartbeatTask.update(Flux.interval(every, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> pollOnce("heartbeat"))
                .subscribe());
    }

    private N normalize(R raw) {
        try {
            return strategy.normalize(raw);
        } catch (RuntimeException e) {
            log.warn("[{}] normalize failed, treating value as absent: {}", name, e.getMessage());
            return null;
        }
    }

    // --- polling ---

    private void startPolling() {
        if (gate.isClosed()) {
            return;
        }
        if (!strategy.hasPoll()) {
            failTerminally();
            return;
        }
        transition(WatcherState.POLLING);
        polling.set(true);
        Duration interval = options.getPollInterval();
        Flux<Void> periodic = interval.isZero()
                ? Flux.empty()
                : Flux.interval(interval, scheduler)
                        .onBackpressureDrop()
                        .concatMap(tick -> pollOnce("poll"));
        pollTask.update(pollOnce("poll").thenMany(periodic).subscribe());
        scheduleReconnectWhilePolling();
    }

    private Mono<Void> pollOnce(String reason) {
        return Mono.defer(() -> {
                    if (gate.isClosed()) {
                        return Mono.<Void>empty();
                    }
                    return strategy.poll(this::onPollEmission, cancellation);
                })
                .onErrorResume(error -> {
                    if (!gate.isClosed()) {
                        log.warn("[{}] {} poll failed: {}", name, reason, messageOf(error));
                        gate.report(error);
                    }
                    return Mono.empty();
                });
    }

    private void onPollEmission(PollEmission<N> emission) {
        if (emission == null) {
            return;
        }
        if (emission.slot() == null) {
            gate.offerNext(emission.value());
        } else {
            gate.offer(emission.slot(), emission.value());
        }
    }

    private void failTerminally() {
        log.error("[{}] subscription failed and no poll strategy is available", name);
        gate.report(new UnrecoverableWatcherException(
                "Subscription failed and no poll strategy is available. Watcher stopped."));
        stop();
    }

    // --- helpers ---

    private void transition(WatcherState next) {
        WatcherState previous = state.get();
        if (previous == WatcherState.STOPPED || previous == next) {
            return;
        }
        if (state.compareAndSet(previous, next)) {
            log.info("[{}] {} -> {}", name, previous, next);
        }
    }

    private static void cancel(Disposable.Swap task) {
        task.update(Disposables.disposed());
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
