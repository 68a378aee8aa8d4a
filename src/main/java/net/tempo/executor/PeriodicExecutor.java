package net.tempo.executor;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.netty.channel.DefaultEventLoop;
import io.netty.channel.EventLoop;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import net.tempo.executor.exceptions.ExecutorStartupException;
import net.tempo.executor.exceptions.TempoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs periodic tasks on a single dedicated thread.
 *
 * <p>The thread hosts one Netty event loop. Every task scheduled on the executor is multiplexed
 * on that loop, so callbacks never run in parallel and a blocking callback delays every other
 * task. Tasks cannot be cancelled individually; they end when the executor is stopped.
 *
 * <p>Stopping never interrupts a running callback. Once termination has been requested the
 * callback in progress, if any, runs to completion and no further iteration is started.
 */
public class PeriodicExecutor extends AbstractIdleService implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PeriodicExecutor.class);

  private final ExecutorConfig config;
  private final Ticker ticker;
  private final ThreadFactory threadFactory;
  private final AtomicReference<Thread> thread = new AtomicReference<>();

  private volatile DefaultEventLoop eventLoop;

  @VisibleForTesting
  PeriodicExecutor(ExecutorConfig config, ThreadFactory threadFactory, Ticker ticker) {
    this.config = Preconditions.checkNotNull(config);
    this.ticker = Preconditions.checkNotNull(ticker);
    this.threadFactory = runnable -> {
      var t = threadFactory.newThread(runnable);
      Preconditions.checkState(thread.compareAndSet(null, t), "event loop thread already created");
      return t;
    };
  }

  private PeriodicExecutor(ExecutorConfig config) {
    this(config, new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat(config.threadName().replace("%", "%%"))
            .build(),
        Ticker.systemTicker());
  }

  /**
   * Starts an executor with the configured settings.
   */
  public static PeriodicExecutor start() throws IOException {
    return start(ExecutorConfig.load());
  }

  /**
   * Starts an executor whose thread is named {@code threadName}.
   */
  public static PeriodicExecutor start(String threadName) throws IOException {
    return start(ImmutableExecutorConfig.copyOf(ExecutorConfig.load()).withThreadName(threadName));
  }

  /**
   * Starts an executor, returning once its event loop thread is running.
   *
   * @throws ExecutorStartupException if the thread or event loop could not be started
   */
  public static PeriodicExecutor start(ExecutorConfig config) {
    return start(new PeriodicExecutor(config));
  }

  @VisibleForTesting
  static PeriodicExecutor start(PeriodicExecutor executor) {
    try {
      executor.startAsync().awaitRunning();
    } catch (IllegalStateException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ExecutorStartupException) {
        throw (ExecutorStartupException) cause;
      }
      throw new ExecutorStartupException("executor failed to start", cause);
    }
    log.debug("Executor created; threadName={}", executor.config.threadName());
    return executor;
  }

  @Override
  protected void startUp() {
    log.debug("Event loop starting; threadName={}", config.threadName());
    var loop = new DefaultEventLoop(threadFactory);
    try {
      // The loop thread is created lazily. Running a task proves it exists.
      loop.submit(() -> log.debug("Event loop running")).syncUninterruptibly();
    } catch (Throwable e) {
      loop.shutdownGracefully(0, 0, MILLISECONDS);
      throw new ExecutorStartupException("failed to start event loop thread", e);
    }

    loop.terminationFuture().addListener(f -> log.debug("Event loop terminated"));
    eventLoop = loop;
  }

  @Override
  protected void shutDown() {
    eventLoop.shutdownGracefully(0, 0, MILLISECONDS).syncUninterruptibly();

    var t = thread.get();
    if (t != null) {
      Uninterruptibles.joinUninterruptibly(t);
    }
  }

  @Override
  protected String serviceName() {
    return "PeriodicExecutor[" + config.threadName() + "]";
  }

  /**
   * The event loop hosting every task of this executor. Callbacks receive the same loop.
   */
  public EventLoop eventLoop() {
    Preconditions.checkState(eventLoop != null, "executor not started");
    return eventLoop;
  }

  /**
   * Runs {@code callback} now and then {@code interval} after each run finishes.
   */
  public void scheduleFixedInterval(Duration interval, ScheduledCallback callback) {
    schedule(ImmutableScheduledTask.of(callback, interval, SchedulingPolicy.FIXED_INTERVAL));
  }

  /**
   * Runs {@code callback} now and then once per {@code interval} on average, firing back to
   * back after slow runs until the schedule has caught up.
   */
  public void scheduleFixedRate(Duration interval, ScheduledCallback callback) {
    schedule(ImmutableScheduledTask.of(callback, interval, SchedulingPolicy.FIXED_RATE));
  }

  private void schedule(ScheduledTask task) {
    Preconditions.checkState(isRunning(), "executor is not running: %s", state());

    var loop = SchedulingLoop.start(task, eventLoop, ticker, this::callbackFailed);
    try {
      eventLoop.execute(loop);
    } catch (RejectedExecutionException e) {
      throw new IllegalStateException("executor is shutting down", e);
    }
  }

  private void callbackFailed(ScheduledTask task, Throwable failure) {
    if (failure instanceof Error
        || config.callbackFailurePolicy() == CallbackFailurePolicy.STOP_EXECUTOR) {
      log.error("Scheduled callback failed. Stopping executor; task={}", task, failure);
      // Marks the loop as shutting down before the callback's iteration can re-arm.
      eventLoop.shutdownGracefully(0, 0, MILLISECONDS);
      stopAsync();
      return;
    }

    log.error("Scheduled callback failed. Continuing; task={}", task, failure);
  }

  /**
   * Requests termination and waits until the executor thread has exited.
   */
  public void stopSync() {
    checkNotOnEventLoop();
    stopAsync().awaitTerminated();
  }

  /**
   * Requests termination and waits at most {@code timeout} for the executor thread to exit.
   */
  public void stopSync(Duration timeout) throws TimeoutException {
    checkNotOnEventLoop();
    stopAsync().awaitTerminated(timeout);
  }

  private void checkNotOnEventLoop() {
    var loop = eventLoop;
    Preconditions.checkState(loop == null || !loop.inEventLoop(),
        "cannot wait for executor termination from the executor thread");
  }

  /**
   * Stops the executor, waiting up to the configured shutdown timeout.
   */
  @Override
  public void close() {
    try {
      stopSync(config.shutdownTimeout());
    } catch (TimeoutException e) {
      throw new TempoException(
          "executor did not terminate within " + config.shutdownTimeout(), e);
    }
  }
}
