package com.github.rudygunawan.tokencache.policy;

import com.github.rudygunawan.tokencache.config.CacheConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceGovernorTest {

    @TempDir
    Path dir;

    private final ResourceGovernor governor = new ResourceGovernor(CacheConfig.defaults(), () -> false);

    private String write(String name, int bytes) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, new byte[bytes]);
        return file.toString();
    }

    @Test
    void testNameRules() {
        assertEquals(Eligibility.EMPTY_KEY, governor.checkName(""));
        assertEquals(Eligibility.EMPTY_KEY, governor.checkName(null));
        assertEquals(Eligibility.IGNORED, governor.checkName("/work/.env"));
        assertEquals(Eligibility.IGNORED, governor.checkName("/work/package.lock"));
        assertEquals(Eligibility.IGNORED, governor.checkName("/work/scratch.tmp"));
        assertEquals(Eligibility.NO_EXTENSION, governor.checkName("/work/Makefile"));
        assertEquals(Eligibility.INVALID_EXTENSION, governor.checkName("/work/image.png"));
        assertEquals(Eligibility.ELIGIBLE, governor.checkName("/work/Main.java"));
        assertEquals(Eligibility.ELIGIBLE, governor.checkName("/work/README.MD"));
    }

    @Test
    void testFilesystemRules() throws IOException {
        assertEquals(Eligibility.ELIGIBLE, governor.check(write("small.txt", 100)));
        assertEquals(Eligibility.OVERSIZED, governor.check(write("big.txt", 512 * 1024 + 1)));
        assertEquals(Eligibility.MISSING, governor.check(dir.resolve("gone.txt").toString()));

        Path folder = Files.createDirectory(dir.resolve("folder.txt"));
        assertEquals(Eligibility.NOT_A_FILE, governor.check(folder.toString()));
    }

    @Test
    void testCustomPolicy() throws IOException {
        CacheConfig config = CacheConfig.builder()
                .allowedExtensions(List.of(".PNG"))
                .ignorePatterns(List.of("**/generated/**"))
                .maxFileSizeBytes(10)
                .build();
        ResourceGovernor custom = new ResourceGovernor(config, () -> false);

        assertEquals(Eligibility.ELIGIBLE, custom.checkName("/work/logo.png"));
        assertEquals(Eligibility.INVALID_EXTENSION, custom.checkName("/work/Main.java"));
        assertEquals(Eligibility.IGNORED, custom.checkName("/work/generated/logo.png"));
        assertEquals(Eligibility.OVERSIZED, custom.check(write("logo.png", 11)));
    }

    @Test
    void testSpareCapacity() {
        assertEquals(3, governor.spareCapacity(0));
        assertEquals(1, governor.spareCapacity(2));
        assertEquals(0, governor.spareCapacity(3));
        assertEquals(0, governor.spareCapacity(7));
        assertTrue(governor.hasCapacity(2));
        assertFalse(governor.hasCapacity(3));
    }

    @Test
    void testHostBusyPredicate() {
        assertTrue(new ResourceGovernor(CacheConfig.defaults(), () -> true).isHostBusy());
        assertFalse(governor.isHostBusy());

        ResourceGovernor broken = new ResourceGovernor(CacheConfig.defaults(), () -> {
            throw new IllegalStateException("host gone");
        });
        assertFalse(broken.isHostBusy());
    }
}
