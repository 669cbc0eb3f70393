package org.edgelink.gateway.concurrent;

import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 异步互斥锁,等待锁时不阻塞线程,按申请顺序获得锁.
 * <p>
 * 不可重入:持有锁的操作内再次申请同一把锁将一直等待.
 *
 * @since 1.0.0
 */
public class ReactiveLock {

    private final Queue<Waiter> waiters = new ArrayDeque<>();

    private boolean locked;

    /**
     * 获得锁后执行操作,操作完成、失败或取消后释放锁.
     *
     * @param action 需要互斥执行的操作,获得锁后才会调用
     */
    public <T> Mono<T> withLock(Supplier<? extends Mono<T>> action) {
        return Mono.usingWhen(
                acquire(),
                permit -> Mono.defer(action),
                Permit::release,
                (permit, error) -> permit.release(),
                Permit::release);
    }

    public synchronized boolean isLocked() {
        return locked;
    }

    public synchronized int getQueueLength() {
        return waiters.size();
    }

    private Mono<Permit> acquire() {
        return Mono.<Permit>create(sink -> {
            Waiter waiter = new Waiter(sink);
            boolean granted = false;
            synchronized (this) {
                if (!locked) {
                    locked = true;
                    granted = true;
                } else {
                    waiters.add(waiter);
                }
            }
            if (granted) {
                waiter.grant();
            } else {
                sink.onCancel(waiter::cancel);
            }
        }).doOnDiscard(Permit.class, Permit::doRelease);
    }

    //释放次数,同一时刻只有一个线程移交锁,其余释放由该线程循环处理
    private final AtomicInteger pendingReleases = new AtomicInteger();

    private void releaseLock() {
        if (pendingReleases.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        for (; ; ) {
            for (int i = 0; i < missed; i++) {
                handOff();
            }
            missed = pendingReleases.addAndGet(-missed);
            if (missed == 0) {
                return;
            }
        }
    }

    //交给下一个等待者,等待者的操作同步完成时其释放只计数,不在当前栈上递归移交
    private void handOff() {
        for (; ; ) {
            Waiter next;
            synchronized (this) {
                next = waiters.poll();
                if (next == null) {
                    locked = false;
                    return;
                }
            }
            //已取消的等待者直接跳过
            if (next.grant()) {
                return;
            }
        }
    }

    private class Permit {

        private final AtomicBoolean released = new AtomicBoolean();

        private Mono<Void> release() {
            return Mono.fromRunnable(this::doRelease);
        }

        private void doRelease() {
            if (released.compareAndSet(false, true)) {
                releaseLock();
            }
        }
    }

    private class Waiter {
        private static final int WAITING = 0, GRANTED = 1, CANCELLED = 2;

        private final MonoSink<Permit> sink;

        private final AtomicInteger state = new AtomicInteger(WAITING);

        private Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }

        private boolean grant() {
            if (state.compareAndSet(WAITING, GRANTED)) {
                sink.success(new Permit());
                return true;
            }
            return false;
        }

        private void cancel() {
            state.compareAndSet(WAITING, CANCELLED);
        }
    }
}
