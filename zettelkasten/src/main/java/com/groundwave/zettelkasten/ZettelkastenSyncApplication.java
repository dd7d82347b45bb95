package com.groundwave.zettelkasten;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Groundwave zettelkasten sync service.
 *
 * Mirrors a WebDAV directory of Org-mode notes into in-memory link, journal and
 * timeline caches and renders notes to HTML. The WebDAV directory stays the
 * source of truth; nothing is ever written back.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ZettelkastenSyncApplication {

    public static void main(String[] args) {
        log.info("Starting Groundwave zettelkasten sync...");
        SpringApplication.run(ZettelkastenSyncApplication.class, args);
    }
}
