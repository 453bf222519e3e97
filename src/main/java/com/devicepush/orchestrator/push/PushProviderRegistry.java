package com.devicepush.orchestrator.push;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds each configured {@link PushPlatform} to its provider. Providers are initialized on first lookup.
 */
@Component
public class PushProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(PushProviderRegistry.class);

    private final Map<PushPlatform, PushDeliveryProvider> providers = new EnumMap<>(PushPlatform.class);

    @Autowired
    public PushProviderRegistry(ObjectProvider<PushDeliveryProvider> configuredProviders) {
        this(configuredProviders.orderedStream().toList());
    }

    public PushProviderRegistry(List<PushDeliveryProvider> configuredProviders) {
        for (PushDeliveryProvider provider : configuredProviders) {
            PushDeliveryProvider previous = providers.put(provider.platform(), provider);
            if (previous != null) {
                throw new PushConfigurationException("More than one provider configured for " + provider.platform().key());
            }
        }
        log.info("PROVIDER_REGISTRY_READY - Push providers registered [platforms={}]", providers.keySet());
    }

    /**
     * Returns the initialized provider for a platform, or empty when it is not configured or failed to initialize.
     */
    public Optional<PushDeliveryProvider> resolve(PushPlatform platform) {
        PushDeliveryProvider provider = providers.get(platform);
        if (provider == null) {
            log.warn("PROVIDER_NOT_CONFIGURED - No provider for platform [platform={}]", platform.key());
            return Optional.empty();
        }
        if (!provider.initialize()) {
            log.warn("PROVIDER_UNAVAILABLE - Provider failed to initialize [platform={}]", platform.key());
            return Optional.empty();
        }
        return Optional.of(provider);
    }

    public boolean isConfigured(PushPlatform platform) {
        return providers.containsKey(platform);
    }

    public Map<String, Object> platformInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        providers.forEach((platform, provider) -> {
            Map<String, Object> details = new LinkedHashMap<>(provider.getPlatformInfo());
            details.put("health", provider.healthCheck());
            info.put(platform.key(), details);
        });
        return info;
    }
}
