package com.openforge.taskmanager.config;

import com.openforge.taskmanager.auth.TokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Tokens: lifetime (the secret itself is never printed)
 *   - Runtime: Java version, server port, CORS origins
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource    dataSource;
    private final AppProperties appProperties;
    private final TokenService  tokenService;
    private final Environment   env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              {} v{}  -  Startup Summary
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    CORS Origins   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Tokens                                                  ║
                ║    Lifetime       : {} min
                ║    Rate limit     : {} req / {} s (not enforced)
                ╚══════════════════════════════════════════════════════════╝
                """,
                appProperties.name(), appProperties.version(),
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),
                appProperties.corsOrigins(),

                checkDatabase(),

                tokenService.lifetime().toMinutes(),
                appProperties.rateLimit().requests(), appProperties.rateLimit().windowSeconds()
        );
    }

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String checkDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductName()
                    + " " + conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  " + version + "  url=" + safeUrl;
        } catch (Exception e) {
            log.warn("[Startup] Database check failed", e);
            return "✘ FAILED - " + e.getMessage();
        }
    }
}
