package com.groundwave.zettelkasten.config;

import com.groundwave.zettelkasten.io.NoteSource;
import com.groundwave.zettelkasten.io.WebDavClient;
import com.groundwave.zettelkasten.io.WebDavNoteSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the WebDAV-backed note source from {@link ZettelkastenProperties}.
 */
@Configuration
@Slf4j
public class ZettelkastenConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZettelkastenConfig zettelkastenConfig(ZettelkastenProperties properties) {
        ZettelkastenConfig config = ZettelkastenConfig.from(properties);
        log.info("Zettelkasten notes root {} (index {}, credentials {})",
            config.getBaseUrl(), config.getIndexFile(), config.hasCredentials() ? "set" : "none");
        return config;
    }

    @Bean
    public WebDavClient webDavClient(ZettelkastenConfig config) {
        return new WebDavClient(config);
    }

    @Bean
    public NoteSource noteSource(ZettelkastenConfig config, WebDavClient webDavClient) {
        return new WebDavNoteSource(config, webDavClient);
    }
}
