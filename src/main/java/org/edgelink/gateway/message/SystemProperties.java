package org.edgelink.gateway.message;

/**
 * 网关在消息上写入的系统属性.
 */
public interface SystemProperties {

    //消息发往的地址,如: /devices/{deviceId}/modules/{moduleId}
    String TO = "to";

    String CORRELATION_ID = "correlationId";

    //模块输入名称
    String INPUT_NAME = "inputName";
}
