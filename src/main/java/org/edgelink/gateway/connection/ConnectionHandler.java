package org.edgelink.gateway.connection;

import org.edgelink.gateway.identity.Identity;
import org.edgelink.gateway.link.LinkHandler;
import org.edgelink.gateway.session.DeviceSession;
import reactor.core.publisher.Mono;

/**
 * 一个客户端连接上所有链路的公共入口.
 * 链路打开或关闭时调用,链路处理器通过它获取设备会话.
 *
 * @since 1.0.0
 */
public interface ConnectionHandler {

    Identity getIdentity();

    /**
     * 获取设备会话,不存在时创建.同一个连接只会创建一次会话.
     */
    Mono<DeviceSession> getDeviceSession();

    /**
     * 注册链路.同类型的旧链路以及correlationId不一致的配对链路会先被关闭.
     */
    Mono<Void> registerLinkHandler(LinkHandler linkHandler);

    /**
     * 移除链路,最后一条链路移除后关闭会话.
     */
    Mono<Void> removeLinkHandler(LinkHandler linkHandler);
}
