package com.groundwave.zettelkasten.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the WebDAV-backed zettelkasten.
 *
 * Bound from {@code groundwave.zk.*}; application.yml maps the
 * WEBDAV_* environment variables onto these keys.
 */
@ConfigurationProperties(prefix = "groundwave.zk")
@Data
public class ZettelkastenProperties {

    /**
     * Full URL of the index note, e.g. https://dav.example.com/org/index.org
     */
    private String zkPath;

    /**
     * Optional URL of an alternate home index note in the same directory as zkPath.
     */
    private String homePath;

    private String webdavUsername;
    private String webdavPassword;

    /**
     * Public base URL of this site. Links under it are not treated as external.
     */
    private String siteBaseUrl;

    private Duration requestTimeout = Duration.ofSeconds(3);

    private Refresh refresh = new Refresh();

    @Data
    public static class Refresh {
        private boolean enabled = true;
        private Duration startupDelay = Duration.ofSeconds(5);
        private Duration interval = Duration.ofMinutes(10);
        private Duration deadline = Duration.ofMinutes(15);
    }
}
