package io.vidsort4j.core;

import io.vidsort4j.PlatformGateway;
import io.vidsort4j.core.error.PlatformErrorKind;
import io.vidsort4j.core.error.PlatformException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class GatewayRegistry {

    private final Map<Platform, PlatformGateway> gatewaysByPlatform = new EnumMap<>(Platform.class);

    public GatewayRegistry(List<PlatformGateway> gateways) {
        for (PlatformGateway gateway : gateways) {
            for (Platform platform : gateway.platforms()) {
                PlatformGateway previous = gatewaysByPlatform.putIfAbsent(platform, gateway);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate PlatformGateway for platform: " + platform);
                }
            }
        }
    }

    public boolean supports(Platform platform) {
        return gatewaysByPlatform.containsKey(platform);
    }

    public PlatformGateway getRequired(Platform platform) throws PlatformException {
        PlatformGateway gateway = gatewaysByPlatform.get(platform);
        if (gateway == null) {
            throw new PlatformException(PlatformErrorKind.UNSUPPORTED, "No PlatformGateway registered for platform: " + platform);
        }
        return gateway;
    }
}
