package dev.socks.server.pool;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size pool of worker threads consuming one FIFO task queue.
 *
 * <p>Two shutdown paths exist. {@link #gracefulStop()} refuses new work, lets the workers drain
 * the queue and joins them. {@link #immediateStop()} refuses new work, discards every task that
 * has not started yet and joins the workers once their current task returns. An immediate stop
 * may also cut short a graceful stop that is still draining. Either way the pool is inert
 * afterwards and cannot be restarted.</p>
 *
 * <p>A task that throws is logged and forgotten; the worker keeps running.</p>
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

    private enum State {
        RUNNING, DRAINING, TERMINATING, STOPPED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<Task> tasks = new ArrayDeque<>();
    private final List<Thread> workers = new ArrayList<>();

    private volatile State state = State.RUNNING;
    private volatile boolean terminating;

    public WorkerPool(int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be positive, got " + threadCount);
        }
        LOGGER.info("Starting worker pool with {} threads", threadCount);
        for (int i = 0; i < threadCount; i++) {
            Thread worker = new Thread(this::work, "socks-worker-" + (i + 1));
            worker.setDaemon(true);
            workers.add(worker);
        }
        workers.forEach(Thread::start);
    }

    /**
     * Queue a fire-and-forget task and wake one idle worker.
     * @throws PoolClosedException when the pool is stopping or stopped
     */
    public void enqueue(Runnable task) {
        offer(new Task(task, null));
    }

    /**
     * Queue a task whose return value, or failure, completes the returned future. The future is
     * cancelled if {@link #immediateStop()} discards the task before it starts.
     * @throws PoolClosedException when the pool is stopping or stopped
     */
    public <T> CompletableFuture<T> submitWithResult(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        offer(new Task(() -> {
            try {
                result.complete(task.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        }, result));
        return result;
    }

    /**
     * Stop accepting tasks, run everything already queued, then join all workers. A caller that
     * arrives while another stop is in progress waits for the workers as well.
     */
    public void gracefulStop() {
        boolean initiated;
        lock.lock();
        try {
            if (state == State.STOPPED) {
                return;
            }
            initiated = state == State.RUNNING;
            if (initiated) {
                state = State.DRAINING;
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (joinWorkers() && initiated) {
            LOGGER.info("Worker pool drained, all worker threads joined");
        }
    }

    /**
     * Stop accepting tasks, drop everything not yet started, then join all workers.
     */
    public void immediateStop() {
        List<Task> abandoned = List.of();
        boolean initiated;
        lock.lock();
        try {
            if (state == State.STOPPED) {
                return;
            }
            initiated = state != State.TERMINATING;
            if (initiated) {
                state = State.TERMINATING;
                terminating = true;
                abandoned = new ArrayList<>(tasks);
                tasks.clear();
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
        abandoned.forEach(Task::abandon);
        if (joinWorkers() && initiated) {
            LOGGER.warn("Worker pool terminated immediately, {} pending tasks abandoned", abandoned.size());
        }
    }

    /**
     * True once {@link #immediateStop()} was requested. Long-running tasks may poll this to
     * give up early.
     */
    public boolean isTerminating() {
        return terminating;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public int size() {
        return workers.size();
    }

    /**
     * Number of worker threads still alive.
     */
    public int liveThreads() {
        int live = 0;
        for (Thread worker : workers) {
            if (worker.isAlive()) {
                live++;
            }
        }
        return live;
    }

    /**
     * Same as {@link #gracefulStop()}.
     */
    @Override
    public void close() {
        gracefulStop();
    }

    private void offer(Task task) {
        lock.lock();
        try {
            if (state != State.RUNNING) {
                throw new PoolClosedException(
                    "Cannot enqueue on a " + state.name().toLowerCase(Locale.ROOT) + " worker pool");
            }
            tasks.addLast(task);
            changed.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Join every worker except the calling thread.
     * @return false when interrupted before all workers finished
     */
    private boolean joinWorkers() {
        Thread current = Thread.currentThread();
        for (Thread worker : workers) {
            if (worker == current) {
                continue;
            }
            try {
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while joining {}", worker.getName());
                return false;
            }
        }
        state = State.STOPPED;
        return true;
    }

    private void work() {
        while (true) {
            Task task;
            lock.lock();
            try {
                while (state == State.RUNNING && tasks.isEmpty()) {
                    changed.awaitUninterruptibly();
                }
                if (terminating) {
                    LOGGER.debug("{} exiting on termination request", Thread.currentThread().getName());
                    return;
                }
                task = tasks.pollFirst();
                if (task == null) {
                    return;
                }
            } finally {
                lock.unlock();
            }
            task.run();
        }
    }

    private final class Task {

        private final Runnable body;
        private final CompletableFuture<?> result;

        Task(Runnable body, CompletableFuture<?> result) {
            this.body = body;
            this.result = result;
        }

        void run() {
            if (terminating) {
                abandon();
                return;
            }
            try {
                body.run();
            } catch (Throwable t) {
                LOGGER.warn("Task failed on {}", Thread.currentThread().getName(), t);
            }
        }

        void abandon() {
            if (result != null) {
                result.cancel(false);
            }
        }
    }
}
