package org.edgelink.gateway.identity;

/**
 * 连接上客户端的身份,设备或模块.
 *
 * @since 1.0.0
 */
public interface Identity {

    /**
     * @return 唯一标识,模块为 {@code deviceId/moduleId}
     */
    String getId();

    String getDeviceId();
}
