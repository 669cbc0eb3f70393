package org.edgelink.gateway.session;

import reactor.core.publisher.Mono;

/**
 * 客户端的物理连接,其上复用多条链路.
 */
public interface ClientConnection {

    Mono<Void> close();
}
