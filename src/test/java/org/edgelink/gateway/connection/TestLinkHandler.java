package org.edgelink.gateway.connection;

import lombok.Getter;
import lombok.Setter;
import org.edgelink.gateway.link.LinkType;
import org.edgelink.gateway.link.SendingLinkHandler;
import org.edgelink.gateway.message.Message;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 记录发送的消息和关闭次数
 */
public class TestLinkHandler implements SendingLinkHandler {

    @Getter
    private final LinkType type;

    @Getter
    private final String correlationId;

    @Getter
    private final List<Message> sent = new CopyOnWriteArrayList<>();

    private final AtomicInteger closed = new AtomicInteger();

    @Setter
    private Supplier<Mono<Void>> onClose = Mono::empty;

    public TestLinkHandler(LinkType type, String correlationId) {
        this.type = type;
        this.correlationId = correlationId;
    }

    public TestLinkHandler(LinkType type) {
        this(type, null);
    }

    @Override
    public Mono<Void> send(Message message) {
        return Mono.fromRunnable(() -> sent.add(message));
    }

    @Override
    public Mono<Void> close(Duration timeout) {
        closed.incrementAndGet();
        return onClose.get();
    }

    public int getCloseTimes() {
        return closed.get();
    }

    @Override
    public String toString() {
        return type + "[" + correlationId + "]";
    }
}
