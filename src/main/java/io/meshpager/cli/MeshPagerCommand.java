package io.meshpager.cli;

import io.meshpager.config.ConfigurationException;
import io.meshpager.config.MeshPagerConfig;
import io.meshpager.logging.LogMarkers;
import io.meshpager.logging.LoggingConfigurator;
import io.meshpager.model.ProcessedRecord;
import io.meshpager.runtime.MeshPagerRuntime;
import io.meshpager.storage.Database;
import io.meshpager.storage.DedupeStore;
import io.meshpager.storage.PersistenceException;
import io.meshpager.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "meshpager",
        mixinStandardHelpOptions = true,
        description = "Forwards Meshtastic text messages from MQTT to DAPNET pagers",
        subcommands = {
                MeshPagerCommand.RunCommand.class,
                MeshPagerCommand.CheckConfigCommand.class,
                MeshPagerCommand.InitDbCommand.class,
                MeshPagerCommand.RecordsCommand.class
        }
)
public final class MeshPagerCommand implements Runnable {
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_DATABASE_ERROR = 1;

    private static final Logger log = LoggerFactory.getLogger(MeshPagerCommand.class);

    @Option(names = {"--env-file"}, description = "dotenv file merged under the process environment", defaultValue = ".env")
    Path envFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | check-config | init-db | records");
    }

    MeshPagerConfig loadConfig() {
        if (Files.exists(envFile)) {
            log.info("Found {} file, loading configuration", envFile);
        } else {
            log.warn("No {} file found, using environment variables only", envFile);
        }
        return MeshPagerConfig.fromEnvironment(envFile);
    }

    static int configFailure(ConfigurationException e) {
        log.error(LogMarkers.CRITICAL, "Configuration validation failed: {}", e.getMessage());
        log.error(LogMarkers.CRITICAL, "Please check your .env file or environment variables");
        return EXIT_CONFIG_ERROR;
    }

    static int databaseFailure(MeshPagerConfig config, PersistenceException e) {
        log.error(LogMarkers.CRITICAL, "Database setup failed for {}, exiting: {}",
                config.databaseFile(), e.getMessage(), e);
        return EXIT_DATABASE_ERROR;
    }

    @Command(name = "run", description = "Subscribe to MQTT and forward text messages until stopped")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        MeshPagerCommand parent;

        @Override
        public Integer call() {
            MeshPagerConfig config;
            try {
                config = parent.loadConfig();
            } catch (ConfigurationException e) {
                return configFailure(e);
            }
            LoggingConfigurator.apply(config.logLevel(), config.logFile());
            log.info("Configuration summary: {}", Jsons.toJson(config.summary()));
            try {
                return new MeshPagerRuntime(config).run();
            } catch (PersistenceException e) {
                return databaseFailure(config, e);
            }
        }
    }

    @Command(name = "check-config", description = "Validate configuration and print a masked summary")
    static final class CheckConfigCommand implements Callable<Integer> {
        @ParentCommand
        MeshPagerCommand parent;

        @Override
        public Integer call() {
            try {
                MeshPagerConfig config = parent.loadConfig();
                System.out.println(Jsons.toPrettyJson(config.summary()));
                return 0;
            } catch (ConfigurationException e) {
                return configFailure(e);
            }
        }
    }

    @Command(name = "init-db", description = "Create the SQLite database and schema")
    static final class InitDbCommand implements Callable<Integer> {
        @ParentCommand
        MeshPagerCommand parent;

        @Override
        public Integer call() {
            MeshPagerConfig config;
            try {
                config = parent.loadConfig();
            } catch (ConfigurationException e) {
                return configFailure(e);
            }
            Database database = new Database(config.databaseFile());
            try {
                database.init();
            } catch (PersistenceException e) {
                return databaseFailure(config, e);
            }
            System.out.println("Initialized database at: " + database.dbFile());
            return 0;
        }
    }

    @Command(name = "records", description = "Show processed messages, newest first")
    static final class RecordsCommand implements Callable<Integer> {
        @ParentCommand
        MeshPagerCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum rows to print")
        int limit;

        @Option(names = {"--packet-id"}, description = "Show a single packet id")
        Long packetId;

        @Override
        public Integer call() {
            MeshPagerConfig config;
            try {
                config = parent.loadConfig();
            } catch (ConfigurationException e) {
                return configFailure(e);
            }
            try {
                Database database = new Database(config.databaseFile());
                database.init();
                DedupeStore store = new DedupeStore(database);
                if (packetId != null) {
                    Optional<ProcessedRecord> record = store.find(packetId);
                    if (record.isEmpty()) {
                        System.out.println("Packet not found: " + packetId);
                        return 2;
                    }
                    System.out.println(Jsons.toPrettyJson(record.get()));
                    return 0;
                }
                List<ProcessedRecord> rows = store.recent(limit);
                System.out.println(Jsons.toPrettyJson(rows));
                return 0;
            } catch (PersistenceException e) {
                return databaseFailure(config, e);
            }
        }
    }
}
