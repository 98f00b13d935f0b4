package peroxo.chat.cache.store;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class SqliteKeyValueStoreTest {

    @TempDir
    Path tempDir;

    private SqliteKeyValueStore store;

    @BeforeEach
    void openStore() {
        store = new SqliteKeyValueStore(tempDir.resolve("cache.db").toString());
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void storesAndOverwritesValues() {
        store.put("msgcache_chat_1_2", "{\"a\":1}");
        store.put("msgcache_chat_1_2", "{\"a\":2}");

        assertThat(store.get("msgcache_chat_1_2")).contains("{\"a\":2}");
        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void listsAndMeasuresByPrefix() {
        store.put("msgcache_chat_1_2", "abc");
        store.put("msgcache_chat_metadata", "{}");
        store.put("other", "zzzz");

        assertThat(store.keys("msgcache_")).containsExactly("msgcache_chat_1_2", "msgcache_chat_metadata");
        assertThat(store.sizeInBytes("msgcache_"))
                .isEqualTo("msgcache_chat_1_2".length() + 3 + "msgcache_chat_metadata".length() + 2);
        assertThat(store.sizeInBytes("nothing_")).isZero();
    }

    @Test
    void prefixIsMatchedLiterally() {
        store.put("msgcache_x", "1");
        store.put("msgcacheAx", "2");

        assertThat(store.keys("msgcache_")).containsExactly("msgcache_x");
    }

    @Test
    void removesKeys() {
        store.put("k", "v");

        store.remove("k");
        store.remove("never-there");

        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void keepsDataAcrossReopen() {
        store.put("msgcache_chat_1_2", "persisted");
        store.close();

        store = new SqliteKeyValueStore(tempDir.resolve("cache.db").toString());

        assertThat(store.get("msgcache_chat_1_2")).contains("persisted");
    }

    @Test
    void databaseFileIsPerIdentity() {
        assertThat(SqliteKeyValueStore.databaseFileFor("data/peroxo_cache", "42")).isEqualTo("data/peroxo_cache_42.db");
        assertThat(SqliteKeyValueStore.databaseFileFor("peroxo_cache", "../evil user")).isEqualTo("peroxo_cache____evil_user.db");
    }
}
