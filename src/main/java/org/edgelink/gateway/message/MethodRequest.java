package org.edgelink.gateway.message;

import lombok.Getter;

import java.util.Objects;

/**
 * 直接方法调用请求
 */
@Getter
public class MethodRequest {

    public static final String METHOD_NAME_PROPERTY = "methodName";

    private final String correlationId;

    private final String name;

    private final byte[] data;

    public MethodRequest(String correlationId, String name, byte[] data) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.name = Objects.requireNonNull(name, "name");
        this.data = data == null ? new byte[0] : data;
    }

    public Message toMessage() {
        return new Message(data)
                .property(METHOD_NAME_PROPERTY, name)
                .systemProperty(SystemProperties.CORRELATION_ID, correlationId);
    }

    @Override
    public String toString() {
        return "MethodRequest[" + name + "," + correlationId + "]";
    }
}
