package org.edgelink.gateway.link;

import org.edgelink.gateway.message.Message;
import reactor.core.publisher.Mono;

/**
 * 网关可以通过其向客户端发送消息的链路,见 {@link LinkType#isSending()}.
 */
public interface SendingLinkHandler extends LinkHandler {

    Mono<Void> send(Message message);
}
