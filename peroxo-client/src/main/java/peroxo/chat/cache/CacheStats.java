package peroxo.chat.cache;

import lombok.Value;

import java.time.Instant;

@Value
public class CacheStats {
    int memoryCacheSize;
    int totalChats;
    long storageBytes;
    String storageMb;
    Instant oldestChat;
    Instant newestChat;
}
