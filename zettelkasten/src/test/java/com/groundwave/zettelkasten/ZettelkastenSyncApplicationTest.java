package com.groundwave.zettelkasten;

import com.groundwave.zettelkasten.app.ZettelkastenShellCommands;
import com.groundwave.zettelkasten.config.ZettelkastenConfig;
import com.groundwave.zettelkasten.domain.CacheRefreshWorker;
import com.groundwave.zettelkasten.domain.ZettelkastenCache;
import com.groundwave.zettelkasten.io.NoteSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "spring.shell.interactive.enabled=false",
    "groundwave.zk.zk-path=http://localhost:1/zk/index.org",
    "groundwave.zk.home-path=http://localhost:1/zk/home.org",
    "groundwave.zk.refresh.enabled=false"
})
class ZettelkastenSyncApplicationTest {

    @Autowired
    private ZettelkastenConfig config;

    @Autowired
    private NoteSource noteSource;

    @Autowired
    private ZettelkastenCache cache;

    @Autowired
    private CacheRefreshWorker refreshWorker;

    @Autowired
    private ZettelkastenShellCommands shellCommands;

    @Test
    void testContextWiresConfiguredSource() {
        assertEquals("http://localhost:1/zk/", config.getBaseUrl());
        assertEquals("index.org", noteSource.indexFilename());
        assertEquals("home.org", noteSource.homeFilename().orElseThrow());
        assertFalse(refreshWorker.isRunning());
        assertTrue(cache.getLastLinkBuildAt().isEmpty());
    }

    @Test
    void testStatusBeforeFirstRefresh() {
        String status = shellCommands.status();

        assertTrue(status.contains("Links:    never built"));
        assertTrue(status.contains("Background refresh: stopped"));
    }
}
