package org.edgelink.gateway.identity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

@Getter
@EqualsAndHashCode
public class DeviceIdentity implements Identity {

    private final String deviceId;

    public DeviceIdentity(String deviceId) {
        this.deviceId = requireNotEmpty(deviceId, "deviceId");
    }

    @Override
    public String getId() {
        return deviceId;
    }

    static String requireNotEmpty(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
        return value;
    }

    @Override
    public String toString() {
        return "Device[" + deviceId + "]";
    }
}
