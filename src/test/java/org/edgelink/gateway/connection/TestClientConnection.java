package org.edgelink.gateway.connection;

import org.edgelink.gateway.session.ClientConnection;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

public class TestClientConnection implements ClientConnection {

    private final AtomicInteger closed = new AtomicInteger();

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(closed::incrementAndGet);
    }

    public int getCloseTimes() {
        return closed.get();
    }
}
