package org.edgelink.gateway.connection;

import lombok.Getter;
import org.edgelink.gateway.session.DeviceProxy;
import org.edgelink.gateway.session.DeviceSession;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 关闭时通过代理关闭底层连接
 */
public class TestDeviceSession implements DeviceSession {

    @Getter
    private volatile DeviceProxy proxy;

    private final AtomicInteger bound = new AtomicInteger();

    private final AtomicInteger closed = new AtomicInteger();

    @Override
    public void bindProxy(DeviceProxy proxy) {
        bound.incrementAndGet();
        this.proxy = proxy;
    }

    @Override
    public Mono<Void> close() {
        closed.incrementAndGet();
        return proxy.close(null);
    }

    public int getBindTimes() {
        return bound.get();
    }

    public int getCloseTimes() {
        return closed.get();
    }
}
