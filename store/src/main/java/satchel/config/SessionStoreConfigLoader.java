package satchel.config;

import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

/**
 * Loads {@link SessionStoreConfigMapping} outside a managed runtime.
 *
 * <p>Sources, highest ordinal first: system properties, environment variables,
 * {@code META-INF/microprofile-config.properties} on the class path.
 */
public final class SessionStoreConfigLoader {

    private SessionStoreConfigLoader() {}

    public static SessionStoreConfigMapping load() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDiscoveredConverters()
                .withMapping(SessionStoreConfigMapping.class)
                .build();
        return config.getConfigMapping(SessionStoreConfigMapping.class);
    }
}
