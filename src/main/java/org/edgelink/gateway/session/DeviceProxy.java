package org.edgelink.gateway.session;

import org.edgelink.gateway.identity.Identity;
import org.edgelink.gateway.message.Message;
import org.edgelink.gateway.message.MethodRequest;
import org.edgelink.gateway.message.MethodResponse;
import reactor.core.publisher.Mono;

/**
 * 会话向客户端发送消息的出口.
 * <p>
 * 对应的链路不存在时消息将被丢弃,不会返回错误.
 *
 * @since 1.0.0
 */
public interface DeviceProxy {

    Mono<Void> sendC2DMessage(Message message);

    Mono<Void> sendMessage(Message message, String input);

    /**
     * 向客户端发送方法调用请求.
     * <p>
     * 客户端的响应通过方法接收链路回到会话,不会由此方法返回,请求发出后返回的 {@link Mono} 为空.
     */
    Mono<MethodResponse> invokeMethod(MethodRequest request);

    Mono<Void> onDesiredPropertyUpdates(Message desiredProperties);

    Mono<Void> sendTwinUpdate(Message twin);

    /**
     * 关闭代理及底层连接,多次调用只会关闭一次连接.
     *
     * @param error 关闭原因,可能为null
     */
    Mono<Void> close(Throwable error);

    void setInactive();

    boolean isActive();

    Identity getIdentity();

    /**
     * 尚未支持,始终返回 {@link UnsupportedOperationException}.
     */
    Mono<Identity> getUpdatedIdentity();
}
