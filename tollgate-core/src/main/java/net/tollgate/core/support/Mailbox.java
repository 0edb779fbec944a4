package net.tollgate.core.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 공유 Executor 위에서 도는 단일 소비자 메일박스.
 * <ul>
 *   <li>한 번에 하나의 핸들러만 실행되며 메시지는 도착 순서대로 처리된다.</li>
 *   <li>수신 큐는 유한하다. 가득 차면 {@link #tell}이 false를 돌려준다.</li>
 *   <li>종료 신호는 데이터 메시지보다 먼저 확인된다. 남은 메시지는 onDropped로 넘긴다.</li>
 * </ul>
 */
public final class Mailbox<M> {
    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);
    private static final int BATCH = 64;

    private final String name;
    private final BlockingQueue<M> inbox;
    private final Executor executor;
    private final Consumer<M> handler;
    private final Consumer<M> onDropped;
    private final Runnable onExit;

    private final AtomicBoolean scheduled = new AtomicBoolean();
    private volatile boolean exitRequested;
    private volatile boolean closed;

    public Mailbox(String name, int capacity, Executor executor,
                   Consumer<M> handler, Consumer<M> onDropped, Runnable onExit) {
        this.name = Objects.requireNonNull(name);
        this.inbox = new ArrayBlockingQueue<>(capacity);
        this.executor = Objects.requireNonNull(executor);
        this.handler = Objects.requireNonNull(handler);
        this.onDropped = Objects.requireNonNull(onDropped);
        this.onExit = Objects.requireNonNull(onExit);
    }

    /** @return 큐에 들어갔으면 true. 닫혔거나 가득 찼으면 false */
    public boolean tell(M message) {
        if (closed || exitRequested) return false;
        if (!inbox.offer(message)) {
            log.warn("mailbox {} is full ({} messages), rejecting {}", name, inbox.size(), message.getClass().getSimpleName());
            return false;
        }
        // shutdown과 경합: 이미 닫혔고 아직 아무도 꺼내가지 않았다면 직접 회수
        if (closed && inbox.remove(message)) return false;
        schedule();
        return true;
    }

    /** 협력적 종료. 다음 수신 시점에 확인된다. */
    public void requestExit() {
        exitRequested = true;
        schedule();
    }

    public boolean closed() { return closed; }

    public boolean exitRequested() { return exitRequested; }

    public int size() { return inbox.size(); }

    public String name() { return name; }

    private void schedule() {
        if (closed) return;
        if (scheduled.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
                log.warn("executor rejected mailbox {}, shutting it down", name);
                exitRequested = true;
                shutdown();
            }
        }
    }

    private void drain() {
        try {
            for (int processed = 0; processed < BATCH; processed++) {
                if (exitRequested) {
                    shutdown();
                    return;
                }
                M message = inbox.poll();
                if (message == null) break;
                try {
                    handler.accept(message);
                } catch (RuntimeException e) {
                    log.error("error in mailbox {} while handling {}", name, message.getClass().getSimpleName(), e);
                }
            }
        } finally {
            scheduled.set(false);
        }
        if (!inbox.isEmpty() || exitRequested) schedule();
    }

    private synchronized void shutdown() {
        if (closed) return;
        closed = true;
        M m;
        int dropped = 0;
        while ((m = inbox.poll()) != null) {
            dropped++;
            try {
                onDropped.accept(m);
            } catch (RuntimeException e) {
                log.error("error in mailbox {} while dropping {}", name, m.getClass().getSimpleName(), e);
            }
        }
        if (dropped > 0) log.info("mailbox {} closed with {} undelivered message(s)", name, dropped);
        try {
            onExit.run();
        } catch (RuntimeException e) {
            log.error("error in mailbox {} exit hook", name, e);
        }
    }
}
