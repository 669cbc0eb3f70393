package org.edgelink.gateway.identity;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import static org.edgelink.gateway.identity.DeviceIdentity.requireNotEmpty;

/**
 * 设备下的模块,父设备ID和模块ID共同确定身份.
 */
@Getter
@EqualsAndHashCode
public class ModuleIdentity implements Identity {

    private final String deviceId;

    private final String moduleId;

    public ModuleIdentity(String deviceId, String moduleId) {
        this.deviceId = requireNotEmpty(deviceId, "deviceId");
        this.moduleId = requireNotEmpty(moduleId, "moduleId");
    }

    @Override
    public String getId() {
        return deviceId + "/" + moduleId;
    }

    @Override
    public String toString() {
        return "Module[" + getId() + "]";
    }
}
