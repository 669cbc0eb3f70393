package org.edgelink.gateway.message;

import lombok.Getter;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 发往设备或来自设备的消息,消息体对网关透明.
 *
 * @since 1.0.0
 */
@Getter
public class Message {

    private final byte[] body;

    private final Map<String, String> properties = new ConcurrentHashMap<>();

    private final Map<String, String> systemProperties = new ConcurrentHashMap<>();

    public Message(byte[] body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    public Message property(String key, String value) {
        properties.put(key, value);
        return this;
    }

    public Message systemProperty(String key, String value) {
        systemProperties.put(key, value);
        return this;
    }

    public String getSystemProperty(String key) {
        return systemProperties.get(key);
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    @Override
    public String toString() {
        return "Message{properties=" + properties
                + ", systemProperties=" + systemProperties
                + ", body=" + Arrays.toString(Arrays.copyOf(body, Math.min(body.length, 32)))
                + "}";
    }
}
