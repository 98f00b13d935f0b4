package peroxo.chat.cache;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class CacheOptions {
    @Builder.Default
    int maxMessagesPerChat = 100;
    // Conversations kept in the hot tier before the least recently used one is flushed out
    @Builder.Default
    int maxCachedChats = 30;
    @Builder.Default
    long maxStorageBytes = 3L * 1024 * 1024;
    @Builder.Default
    Duration cleanupThreshold = Duration.ofDays(30);

    public static CacheOptions defaults() {
        return CacheOptions.builder().build();
    }
}
