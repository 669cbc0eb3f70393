package org.edgelink.gateway.connection;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.edgelink.gateway.identity.Identity;
import org.edgelink.gateway.concurrent.ReactiveLock;
import org.edgelink.gateway.link.LinkHandler;
import org.edgelink.gateway.link.LinkType;
import org.edgelink.gateway.session.ClientConnection;
import org.edgelink.gateway.session.DeviceProxy;
import org.edgelink.gateway.session.DeviceSession;
import org.edgelink.gateway.session.DeviceSessionProvider;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 维护一个客户端连接上的链路和设备会话.
 * <p>
 * 链路注册表保证每种类型只有一条链路,且成对链路的correlationId一致.
 * 设备会话在第一次使用时创建,并绑定一个 {@link ClientDeviceProxy},会话通过代理向链路发送消息.
 * 最后一条链路移除后关闭会话,会话再通过代理关闭底层连接.
 *
 * @since 1.0.0
 */
@Slf4j
public class ClientConnectionHandler implements ConnectionHandler {

    static final Duration DEFAULT_LINK_CLOSE_TIMEOUT =
            Duration.ofSeconds(Long.getLong("edgelink.link.close-timeout-seconds", 60));

    @Getter
    private final Identity identity;

    private final DeviceSessionProvider sessionProvider;

    @Getter(AccessLevel.PACKAGE)
    private final ClientConnection connection;

    @Getter(AccessLevel.PACKAGE)
    private final LinkRegistry registry;

    //会话创建和关闭
    private final ReactiveLock sessionLock = new ReactiveLock();

    //正在进行或已成功的会话创建,失败后清空以便下次重新创建
    private final AtomicReference<Mono<DeviceSession>> sessionCreation = new AtomicReference<>();

    //绑定代理后才赋值
    private volatile DeviceSession session;

    private volatile ClientDeviceProxy deviceProxy;

    @Getter
    private volatile Duration linkCloseTimeout = DEFAULT_LINK_CLOSE_TIMEOUT;

    public ClientConnectionHandler(Identity identity, DeviceSessionProvider sessionProvider, ClientConnection connection) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.sessionProvider = Objects.requireNonNull(sessionProvider, "sessionProvider");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.registry = new LinkRegistry(identity);
    }

    public void setLinkCloseTimeout(Duration linkCloseTimeout) {
        Objects.requireNonNull(linkCloseTimeout, "linkCloseTimeout");
        if (linkCloseTimeout.isNegative() || linkCloseTimeout.isZero()) {
            throw new IllegalArgumentException("linkCloseTimeout must be positive");
        }
        this.linkCloseTimeout = linkCloseTimeout;
    }

    @Override
    public Mono<DeviceSession> getDeviceSession() {
        return Mono.defer(() -> {
            DeviceSession current = session;
            if (current != null) {
                return Mono.just(current);
            }
            for (; ; ) {
                Mono<DeviceSession> creation = sessionCreation.get();
                if (creation == null) {
                    Mono<DeviceSession> candidate = sessionLock.withLock(this::createSession).cache();
                    if (!sessionCreation.compareAndSet(null, candidate)) {
                        continue;
                    }
                    creation = candidate;
                }
                Mono<DeviceSession> attempt = creation;
                return attempt.doOnError(error -> sessionCreation.compareAndSet(attempt, null));
            }
        });
    }

    private Mono<DeviceSession> createSession() {
        return sessionProvider
                .createSession(identity)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("no device session created for " + identity)))
                .map(created -> {
                    ClientDeviceProxy proxy = new ClientDeviceProxy(this, identity);
                    created.bindProxy(proxy);
                    deviceProxy = proxy;
                    session = created;
                    log.debug("created device session for [{}]", identity.getId());
                    return created;
                })
                .doOnError(error -> log.warn("create device session for [{}] failed", identity.getId(), error));
    }

    @Override
    public Mono<Void> registerLinkHandler(LinkHandler linkHandler) {
        return registry.register(linkHandler, linkCloseTimeout);
    }

    @Override
    public Mono<Void> removeLinkHandler(LinkHandler linkHandler) {
        Objects.requireNonNull(linkHandler, "linkHandler");
        return registry.remove(linkHandler, () -> {
            log.debug("all links closed for client [{}]", identity.getId());
            return closeConnection();
        });
    }

    /**
     * 关闭设备会话,底层连接由会话通过代理关闭.
     */
    Mono<Void> closeConnection() {
        return sessionLock.<Void>withLock(() -> {
            DeviceSession current = session;
            if (current == null) {
                return Mono.empty();
            }
            log.debug("closing underlying connection for client [{}]", identity.getId());
            return current.close();
        });
    }

    public Optional<LinkHandler> getLinkHandler(LinkType type) {
        return registry.get(type);
    }

    public Set<LinkType> getLinkTypes() {
        return registry.getLinkTypes();
    }

    public Optional<DeviceProxy> getDeviceProxy() {
        return Optional.ofNullable(deviceProxy);
    }

    @Override
    public String toString() {
        return "ClientConnection[" + identity.getId() + "]" + registry.getLinkTypes();
    }
}
