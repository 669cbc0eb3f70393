package org.edgelink.gateway.connection;

import lombok.extern.slf4j.Slf4j;
import org.edgelink.gateway.concurrent.ReactiveLock;
import org.edgelink.gateway.identity.Identity;
import org.edgelink.gateway.link.LinkHandler;
import org.edgelink.gateway.link.LinkType;
import org.edgelink.gateway.link.SendingLinkHandler;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 一个连接上已注册的链路,每种链路类型最多一条.
 * <p>
 * 所有修改在同一把锁内进行,读取不加锁.
 * 成对的链路(见 {@link LinkType#pair()})注册后必须具有相同的correlationId,
 * 不一致的旧链路在注册新链路前被关闭并移除.
 */
@Slf4j
class LinkRegistry {

    private final Map<LinkType, LinkHandler> handlers = new ConcurrentHashMap<>();

    private final ReactiveLock lock = new ReactiveLock();

    private final Identity identity;

    LinkRegistry(Identity identity) {
        this.identity = identity;
    }

    Optional<LinkHandler> get(LinkType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    Set<LinkType> getLinkTypes() {
        //EnumSet.copyOf(Collection)在集合为空时失败,注册表可能在判断后被并发清空
        EnumSet<LinkType> types = EnumSet.noneOf(LinkType.class);
        types.addAll(handlers.keySet());
        return types;
    }

    boolean isEmpty() {
        return handlers.isEmpty();
    }

    Mono<Void> register(LinkHandler handler, Duration closeTimeout) {
        Objects.requireNonNull(handler, "linkHandler");
        Objects.requireNonNull(handler.getType(), "linkHandler.type");
        if (handler.getType().isSending() && !(handler instanceof SendingLinkHandler)) {
            throw new IllegalArgumentException(handler.getType() + " link handler must be able to send messages");
        }
        LinkType type = handler.getType();
        return lock.withLock(() -> closeSuperseded(handler, closeTimeout)
                .then(Mono.defer(() -> closeUncorrelated(handler, closeTimeout)))
                .then(Mono.<Void>fromRunnable(() -> {
                    handlers.put(type, handler);
                    log.debug("registered {} link for [{}]", type, identity.getId());
                })));
    }

    /**
     * 移除链路,只有当前注册的就是该链路时才会移除,已被替换的旧链路不会影响新链路.
     *
     * @param onDrained 移除后没有任何链路时执行,在锁内执行
     */
    Mono<Void> remove(LinkHandler handler, Supplier<Mono<Void>> onDrained) {
        Objects.requireNonNull(handler, "linkHandler");
        return lock.<Void>withLock(() -> {
            if (!handlers.remove(handler.getType(), handler)) {
                return Mono.empty();
            }
            log.debug("removed {} link for [{}]", handler.getType(), identity.getId());
            if (handlers.isEmpty()) {
                return onDrained.get();
            }
            return Mono.empty();
        });
    }

    private Mono<Void> closeSuperseded(LinkHandler handler, Duration closeTimeout) {
        LinkHandler current = handlers.get(handler.getType());
        if (current == null || current == handler) {
            return Mono.empty();
        }
        log.debug("closing superseded {} link for [{}]", current.getType(), identity.getId());
        return close(current, closeTimeout);
    }

    private Mono<Void> closeUncorrelated(LinkHandler handler, Duration closeTimeout) {
        return handler.getType()
                .pair()
                .map(handlers::get)
                .filter(paired -> !Objects.equals(paired.getCorrelationId(), handler.getCorrelationId()))
                .map(paired -> {
                    log.debug("closing {} link for [{}], correlation id [{}] does not match [{}]",
                            paired.getType(),
                            identity.getId(),
                            paired.getCorrelationId(),
                            handler.getCorrelationId());
                    return close(paired, closeTimeout)
                            .then(Mono.<Void>fromRunnable(() -> handlers.remove(paired.getType(), paired)));
                })
                .orElseGet(Mono::empty);
    }

    private Mono<Void> close(LinkHandler handler, Duration closeTimeout) {
        return Mono.defer(() -> handler.close(closeTimeout))
                .timeout(closeTimeout)
                .doOnError(error -> log.warn("close {} link for [{}] failed", handler.getType(), identity.getId(), error));
    }
}
