/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.server;

import java.io.IOException;
import java.io.PrintStream;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.PgRelayException;
import io.pgrelay.config.Configuration;
import io.pgrelay.config.InvalidConfigurationException;
import io.pgrelay.connector.postgresql.PostgresConnectorConfig;
import io.pgrelay.connector.postgresql.ReplicationStream;
import io.pgrelay.connector.postgresql.connection.PostgresConnection;
import io.pgrelay.pipeline.ChangeEventDispatcher;
import io.pgrelay.sink.ChangeEventSinks;
import io.pgrelay.sink.spi.ChangeEventSink;
import io.pgrelay.util.Clock;
import io.pgrelay.util.CommandLineOptions;

/**
 * Command line entry point of the relay.
 */
public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    public static void main(String[] args) {
        final int status = execute(args, System.out);
        // System.exit blocks while shutdown hooks run
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Run the relay with the given command line.
     *
     * @param args the command line
     * @param help where the usage is printed when help is requested
     * @return the process exit status
     */
    static int execute(String[] args, PrintStream help) {
        final CommandLineOptions options = CommandLineOptions.parse(args);
        if (RelayConfig.isHelpRequested(options)) {
            help.print(RelayConfig.usage());
            return EXIT_OK;
        }

        final Configuration config;
        try {
            config = RelayConfig.fromCommandLine(options);
            RelayConfig.validate(config);
        }
        catch (InvalidConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            LOGGER.error("Use --help to list the supported options");
            return EXIT_FAILURE;
        }
        catch (IOException e) {
            LOGGER.error("Unable to read the configuration file: {}", e.getMessage());
            return EXIT_FAILURE;
        }
        return run(config);
    }

    private static int run(Configuration config) {
        final PostgresConnectorConfig connectorConfig = new PostgresConnectorConfig(config);
        final List<ChangeEventSink> sinks;
        try {
            sinks = ChangeEventSinks.create(config);
        }
        catch (PgRelayException e) {
            LOGGER.error("Unable to create sinks", e);
            return EXIT_FAILURE;
        }

        final ChangeEventDispatcher dispatcher = new ChangeEventDispatcher(sinks);
        final PostgresConnection connection = new PostgresConnection(connectorConfig.connectionString());
        final ReplicationStream stream = new ReplicationStream(connection, connectorConfig);
        final RelayEngine engine = new RelayEngine(connection, stream, dispatcher, connectorConfig.createSlot(), Clock.system());

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(shutdownHook(engine, stopped));
        try {
            engine.run();
            return EXIT_OK;
        }
        catch (SQLException e) {
            LOGGER.error("Database error while streaming from slot '{}'", connectorConfig.slotName(), e);
            return EXIT_FAILURE;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while delivering changes", e);
            return EXIT_FAILURE;
        }
        catch (RuntimeException e) {
            LOGGER.error("Relay failed", e);
            return EXIT_FAILURE;
        }
        finally {
            try {
                dispatcher.close();
                stream.close();
            }
            catch (SQLException e) {
                LOGGER.warn("Failed to close the database connection", e);
            }
            finally {
                stopped.countDown();
            }
        }
    }

    /**
     * Create the hook that stops the engine on JVM shutdown and waits until the relay has released its resources.
     *
     * @param engine the engine to stop
     * @param stopped released once the relay has finished and closed its sinks and connection
     * @return the unstarted hook thread
     */
    static Thread shutdownHook(RelayEngine engine, CountDownLatch stopped) {
        return new Thread(() -> {
            LOGGER.info("Shutdown requested");
            engine.stop();
            try {
                stopped.await();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "pgrelay-shutdown");
    }
}
