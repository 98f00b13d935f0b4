package peroxo.chat.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;

/**
 * Client settings.
 * <p>
 * Every key is resolved from a JVM system property first, then from {@code application.yml} on the
 * classpath, then from the built-in default. YAML values may reference environment variables as
 * {@code ${NAME:default}}.
 */
@Slf4j
@Getter
public class ClientConfig {
    public static final String DEFAULT_RESOURCE = "application.yml";

    private static final String DEFAULT_SOCKET_URL = "ws://localhost:4001";
    private static final long DEFAULT_RECONNECT_BASE_MS = 1500;
    private static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;
    private static final long DEFAULT_DELIVERY_TIMEOUT_MS = 30_000;
    private static final long DEFAULT_READ_DEBOUNCE_MS = 100;
    private static final int DEFAULT_MAX_MESSAGES_PER_CHAT = 100;
    private static final int DEFAULT_MAX_CACHED_CHATS = 30;
    private static final int DEFAULT_MAX_STORAGE_MB = 3;
    private static final int DEFAULT_CLEANUP_THRESHOLD_DAYS = 30;
    private static final String DEFAULT_STORE_TYPE = "sqlite";
    private static final String DEFAULT_STORE_PATH = "peroxo_cache";

    private final String socketUrl;
    private final Duration reconnectBaseInterval;
    private final int maxReconnectAttempts;
    private final Duration deliveryTimeout;
    private final Duration readDebounce;
    private final int maxMessagesPerChat;
    private final int maxCachedChats;
    private final int maxStorageMb;
    private final int cleanupThresholdDays;
    private final String storeType;
    private final String storePath;

    public static ClientConfig load() {
        return new ClientConfig(System.getProperties(), DEFAULT_RESOURCE, System::getenv);
    }

    public ClientConfig(Properties overrides, String resource, Function<String, String> environment) {
        JsonNode yaml = readYaml(resource);
        Resolver resolver = new Resolver(overrides, yaml, environment);

        this.socketUrl = resolver.string("peroxo.socket-url", DEFAULT_SOCKET_URL);
        this.reconnectBaseInterval = Duration.ofMillis(resolver.number("peroxo.reconnect.base-interval-ms", DEFAULT_RECONNECT_BASE_MS));
        this.maxReconnectAttempts = (int) resolver.number("peroxo.reconnect.max-attempts", DEFAULT_MAX_RECONNECT_ATTEMPTS);
        this.deliveryTimeout = Duration.ofMillis(resolver.number("peroxo.delivery.timeout-ms", DEFAULT_DELIVERY_TIMEOUT_MS));
        this.readDebounce = Duration.ofMillis(resolver.number("peroxo.read.debounce-ms", DEFAULT_READ_DEBOUNCE_MS));
        this.maxMessagesPerChat = (int) resolver.number("peroxo.cache.max-messages-per-chat", DEFAULT_MAX_MESSAGES_PER_CHAT);
        this.maxCachedChats = (int) resolver.number("peroxo.cache.max-cached-chats", DEFAULT_MAX_CACHED_CHATS);
        this.maxStorageMb = (int) resolver.number("peroxo.cache.max-storage-mb", DEFAULT_MAX_STORAGE_MB);
        this.cleanupThresholdDays = (int) resolver.number("peroxo.cache.cleanup-threshold-days", DEFAULT_CLEANUP_THRESHOLD_DAYS);
        this.storeType = resolver.string("peroxo.store.type", DEFAULT_STORE_TYPE);
        this.storePath = resolver.string("peroxo.store.path", DEFAULT_STORE_PATH);

        log.info("Client configuration: socketUrl={}, reconnectBase={}ms, maxReconnectAttempts={}, deliveryTimeout={}ms, "
                        + "maxMessagesPerChat={}, maxCachedChats={}, maxStorageMb={}, cleanupThresholdDays={}, store={}:{}",
                socketUrl, reconnectBaseInterval.toMillis(), maxReconnectAttempts, deliveryTimeout.toMillis(),
                maxMessagesPerChat, maxCachedChats, maxStorageMb, cleanupThresholdDays, storeType, storePath);
    }

    public long getMaxStorageBytes() {
        return (long) maxStorageMb * 1024 * 1024;
    }

    public Duration getCleanupThreshold() {
        return Duration.ofDays(cleanupThresholdDays);
    }

    private static JsonNode readYaml(String resource) {
        if (resource == null) {
            return null;
        }
        try (InputStream is = ClientConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                return null;
            }
            return new ObjectMapper(new YAMLFactory()).readTree(is);
        } catch (IOException e) {
            log.warn("Failed to load client config from {}: {}", resource, e.getMessage());
            return null;
        }
    }

    private static final class Resolver {
        private final Properties overrides;
        private final JsonNode yaml;
        private final Function<String, String> environment;

        private Resolver(Properties overrides, JsonNode yaml, Function<String, String> environment) {
            this.overrides = overrides == null ? new Properties() : overrides;
            this.yaml = yaml;
            this.environment = environment;
        }

        String string(String key, String defaultValue) {
            String value = overrides.getProperty(key);
            if (value == null) {
                value = fromYaml(key);
            }
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        long number(String key, long defaultValue) {
            String value = string(key, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric value '{}' for {}", value, key);
                return defaultValue;
            }
        }

        private String fromYaml(String key) {
            if (yaml == null) {
                return null;
            }
            // accept both nested maps and flat dotted keys
            JsonNode flat = yaml.get(key);
            if (flat != null && flat.isValueNode()) {
                return expand(flat.asText());
            }
            JsonNode node = yaml;
            for (String part : key.split("\\.")) {
                node = node.get(part);
                if (node == null) {
                    return null;
                }
            }
            return node.isValueNode() ? expand(node.asText()) : null;
        }

        private String expand(String value) {
            if (value.startsWith("${") && value.endsWith("}")) {
                String varPart = value.substring(2, value.length() - 1);
                int colonIndex = varPart.indexOf(':');
                String envVar = colonIndex >= 0 ? varPart.substring(0, colonIndex) : varPart;
                String defaultVal = colonIndex >= 0 ? varPart.substring(colonIndex + 1) : null;
                String envValue = environment.apply(envVar);
                return envValue != null ? envValue : defaultVal;
            }
            return value;
        }
    }
}
