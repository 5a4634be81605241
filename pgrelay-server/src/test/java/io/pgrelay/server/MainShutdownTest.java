/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class MainShutdownTest {

    @Test
    public void hookShouldStopEngineAndReturnOnceRelayHasStopped() throws Exception {
        RelayEngine engine = mock(RelayEngine.class);
        CountDownLatch stopped = new CountDownLatch(1);
        Thread hook = Main.shutdownHook(engine, stopped);

        hook.start();
        hook.join(200);
        assertThat(hook.isAlive()).isTrue();
        verify(engine).stop();

        stopped.countDown();
        hook.join(TimeUnit.SECONDS.toMillis(5));
        assertThat(hook.isAlive()).isFalse();
    }

    @Test
    public void hookShouldNotWaitWhenRelayAlreadyStopped() throws Exception {
        RelayEngine engine = mock(RelayEngine.class);
        CountDownLatch stopped = new CountDownLatch(1);
        stopped.countDown();

        Thread hook = Main.shutdownHook(engine, stopped);
        hook.start();
        hook.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(hook.isAlive()).isFalse();
        verify(engine).stop();
    }

    @Test
    public void relayProcessShouldExitOnShutdownSignal() throws Exception {
        String classPath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        Process process = new ProcessBuilder(java, "-cp", classPath, StubbedRelayLauncher.class.getName(),
                "-c", "jdbc:postgresql://localhost:5432/app", "-s", "relay_slot", "-p", "relay_pub", "--poll-interval-ms", "10")
                .redirectErrorStream(true)
                .start();
        try {
            List<String> output = new CopyOnWriteArrayList<>();
            CountDownLatch started = new CountDownLatch(1);
            Thread reader = new Thread(() -> {
                try (BufferedReader in = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = in.readLine()) != null) {
                        output.add(line);
                        if (line.contains("Starting relay")) {
                            started.countDown();
                        }
                    }
                }
                catch (IOException e) {
                    output.add("read failed: " + e.getMessage());
                }
            });
            reader.setDaemon(true);
            reader.start();

            assertThat(started.await(30, TimeUnit.SECONDS)).as("relay started: %s", output).isTrue();
            process.destroy();

            assertThat(process.waitFor(15, TimeUnit.SECONDS)).as("relay exited after shutdown signal: %s", output).isTrue();
            reader.join(TimeUnit.SECONDS.toMillis(5));
            assertThat(output).anyMatch(line -> line.contains("Shutdown requested"));
            assertThat(output).anyMatch(line -> line.contains("Relay stopped"));
        }
        finally {
            process.destroyForcibly();
        }
    }
}
