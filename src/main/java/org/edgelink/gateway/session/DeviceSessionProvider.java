package org.edgelink.gateway.session;

import org.edgelink.gateway.identity.Identity;
import reactor.core.publisher.Mono;

/**
 * @since 1.0.0
 */
public interface DeviceSessionProvider {

    Mono<DeviceSession> createSession(Identity identity);
}
