package org.edgelink.gateway.link;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 连接上一条已打开的链路.
 *
 * @since 1.0.0
 */
public interface LinkHandler {

    LinkType getType();

    /**
     * 打开链路时由客户端指定,用于匹配成对的发送和接收链路,可能为null.
     */
    String getCorrelationId();

    /**
     * 关闭链路.注册新链路时可能在注册表的锁内调用,返回的Mono不能等待链路的移除操作完成.
     */
    Mono<Void> close(Duration timeout);
}
