package com.github.rudygunawan.tokencache.builder;

import com.github.rudygunawan.tokencache.api.CountFunction;
import com.github.rudygunawan.tokencache.config.CacheConfig;
import com.github.rudygunawan.tokencache.impl.DefaultTokenCountCache;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenCountCacheBuilderTest {

    private static final CountFunction ONE = (content, encoding) -> CompletableFuture.completedFuture(1L);

    @Test
    void testCountFunctionRequired() {
        assertThrows(IllegalStateException.class, () -> TokenCountCacheBuilder.newBuilder().build());
    }

    @Test
    void testNullArgumentsRejected() {
        TokenCountCacheBuilder builder = TokenCountCacheBuilder.newBuilder();
        assertThrows(NullPointerException.class, () -> builder.config(null));
        assertThrows(NullPointerException.class, () -> builder.countFunction(null));
        assertThrows(NullPointerException.class, () -> builder.activePredicate(null));
        assertThrows(NullPointerException.class, () -> builder.hostBusy(null));
        assertThrows(NullPointerException.class, () -> builder.ticker(null));
        assertThrows(NullPointerException.class, () -> builder.scheduler(null));
        assertThrows(NullPointerException.class, () -> builder.executor(null));
    }

    @Test
    void testDefaults() {
        TokenCountCacheBuilder builder = TokenCountCacheBuilder.newBuilder().countFunction(ONE);

        assertEquals(CacheConfig.defaults().getTickInterval(), builder.getConfig().getTickInterval());
        assertFalse(builder.getActivePredicate().isActive("/any.txt"));
        assertFalse(builder.getHostBusy().getAsBoolean());
        assertNull(builder.getScheduler());
        assertNull(builder.getExecutor());
    }

    @Test
    void testBuildAppliesConfig() {
        CacheConfig config = CacheConfig.builder().tickInterval(5, TimeUnit.SECONDS).build();

        DefaultTokenCountCache cache = TokenCountCacheBuilder.newBuilder()
                .config(config)
                .countFunction(ONE)
                .build();
        try {
            assertSame(config, cache.getConfig());
            assertTrue(cache.stats().isIdle());
        } finally {
            cache.close();
        }
    }
}
