package org.edgelink.gateway.connection;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.edgelink.gateway.identity.Identity;
import org.edgelink.gateway.identity.ModuleIdentity;
import org.edgelink.gateway.link.LinkType;
import org.edgelink.gateway.link.SendingLinkHandler;
import org.edgelink.gateway.message.Message;
import org.edgelink.gateway.message.MethodRequest;
import org.edgelink.gateway.message.MethodResponse;
import org.edgelink.gateway.message.SystemProperties;
import org.edgelink.gateway.session.DeviceProxy;
import reactor.core.publisher.Mono;

import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 将会话发出的消息转发到连接上对应类型的链路,链路不存在时丢弃消息.
 *
 * @since 1.0.0
 */
@Slf4j
class ClientDeviceProxy implements DeviceProxy {

    private final ClientConnectionHandler connectionHandler;

    @Getter
    private final Identity identity;

    private final AtomicBoolean active = new AtomicBoolean(true);

    ClientDeviceProxy(ClientConnectionHandler connectionHandler, Identity identity) {
        this.connectionHandler = Objects.requireNonNull(connectionHandler, "connectionHandler");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    @Override
    public Mono<Void> close(Throwable error) {
        return Mono.defer(() -> {
            if (active.compareAndSet(true, false)) {
                log.info("closing device proxy for [{}]", identity.getId(), error);
                return connectionHandler.getConnection().close();
            }
            return Mono.empty();
        });
    }

    @Override
    public Mono<Void> sendC2DMessage(Message message) {
        Objects.requireNonNull(message, "message");
        return Mono.defer(() -> findSendingLink(LinkType.C2D, "C2D message")
                .map(link -> {
                    message.systemProperty(SystemProperties.TO, getAddress());
                    log.debug("sending C2D message to [{}]", identity.getId());
                    return link.send(message);
                })
                .orElseGet(Mono::empty));
    }

    @Override
    public Mono<Void> sendMessage(Message message, String input) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(input, "input");
        return Mono.defer(() -> findSendingLink(LinkType.MODULE_MESSAGES, "message")
                .map(link -> {
                    message.systemProperty(SystemProperties.INPUT_NAME, input);
                    log.debug("sending message to [{}] input [{}]", identity.getId(), input);
                    return link.send(message);
                })
                .orElseGet(Mono::empty));
    }

    @Override
    public Mono<MethodResponse> invokeMethod(MethodRequest request) {
        Objects.requireNonNull(request, "request");
        return Mono.defer(() -> findSendingLink(LinkType.METHOD_SENDING, "method request")
                .map(link -> link
                        .send(request.toMessage())
                        .doOnSuccess(ignore -> log.debug("sent method invocation {} to [{}]", request, identity.getId()))
                        //响应通过METHOD_RECEIVING链路回到会话
                        .then(Mono.<MethodResponse>empty()))
                .orElseGet(Mono::empty));
    }

    @Override
    public Mono<Void> onDesiredPropertyUpdates(Message desiredProperties) {
        Objects.requireNonNull(desiredProperties, "desiredProperties");
        return Mono.defer(() -> findSendingLink(LinkType.TWIN_SENDING, "desired properties update")
                .map(link -> {
                    log.debug("sending desired properties update to [{}]", identity.getId());
                    return link.send(desiredProperties);
                })
                .orElseGet(Mono::empty));
    }

    @Override
    public Mono<Void> sendTwinUpdate(Message twin) {
        Objects.requireNonNull(twin, "twin");
        return Mono.defer(() -> findSendingLink(LinkType.TWIN_SENDING, "twin update")
                .map(link -> {
                    log.debug("sending twin update to [{}]", identity.getId());
                    return link.send(twin);
                })
                .orElseGet(Mono::empty));
    }

    @Override
    public void setInactive() {
        log.info("setting proxy inactive for [{}]", identity.getId());
        active.set(false);
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    @Override
    public Mono<Identity> getUpdatedIdentity() {
        return Mono.error(() -> new UnsupportedOperationException("updated identity is not supported by connection of " + identity.getId()));
    }

    String getAddress() {
        if (identity instanceof ModuleIdentity) {
            ModuleIdentity module = (ModuleIdentity) identity;
            return "/devices/" + encode(module.getDeviceId()) + "/modules/" + encode(module.getModuleId());
        }
        return "/devices/" + encode(identity.getId());
    }

    private Optional<SendingLinkHandler> findSendingLink(LinkType type, String operation) {
        Optional<SendingLinkHandler> link = connectionHandler
                .getRegistry()
                .get(type)
                .map(SendingLinkHandler.class::cast);
        if (!link.isPresent()) {
            log.warn("unable to send {} to [{}] because {} link was not found", operation, identity.getId(), type);
        }
        return link;
    }

    private static String encode(String value) {
        try {
            return URLEncoder.encode(value, StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return "DeviceProxy[" + identity.getId() + "]";
    }
}
