package org.edgelink.gateway.session;

import reactor.core.publisher.Mono;

/**
 * 设备或模块的逻辑会话,与具体传输协议无关.
 * 会话通过绑定的 {@link DeviceProxy} 向客户端发送消息.
 *
 * @since 1.0.0
 */
public interface DeviceSession {

    /**
     * 创建会话后调用一次
     */
    void bindProxy(DeviceProxy proxy);

    Mono<Void> close();
}
