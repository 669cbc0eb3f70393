package org.edgelink.gateway.link;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * 一个客户端连接上的链路类型,每种类型在同一个连接上最多存在一条链路.
 *
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum LinkType {
    //认证令牌
    CBS(true),
    //设备上报消息
    EVENTS(false),
    //云到设备消息
    C2D(true),
    //发往模块输入的消息
    MODULE_MESSAGES(true),
    METHOD_SENDING(true),
    METHOD_RECEIVING(false),
    TWIN_SENDING(true),
    TWIN_RECEIVING(false);

    //网关是否通过此链路向客户端发送消息
    private final boolean sending;

    /**
     * 成对的链路必须具有相同的correlationId.
     *
     * @return 与当前类型配对的链路类型
     */
    public Optional<LinkType> pair() {
        switch (this) {
            case METHOD_SENDING:
                return Optional.of(METHOD_RECEIVING);
            case METHOD_RECEIVING:
                return Optional.of(METHOD_SENDING);
            case TWIN_SENDING:
                return Optional.of(TWIN_RECEIVING);
            case TWIN_RECEIVING:
                return Optional.of(TWIN_SENDING);
            default:
                return Optional.empty();
        }
    }
}
