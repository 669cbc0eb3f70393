package org.edgelink.gateway.message;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class MethodResponse {

    private final String correlationId;

    private final int status;

    private final byte[] data;
}
