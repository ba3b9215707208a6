package com.example.shortsbot_backend.engine;

import com.example.shortsbot_backend.engine.Interfaces.ProcessRunner;
import com.example.shortsbot_backend.exception.ExternalToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools as local child processes, draining stdout and stderr on daemon threads.
 */
@Component
public class LocalProcessRunner implements ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalProcessRunner.class);
    private static final long DRAIN_JOIN_MS = 2_000L;

    @Override
    public ProcessResult run(MediaCommand command) {
        LOGGER.debug("LocalProcessRunner START label={} cmd={}", command.label(), String.join(" ", command.commandLine()));
        long startedAt = System.nanoTime();

        Process p;
        try {
            p = new ProcessBuilder(command.commandLine()).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new ExternalToolException(command.label(), e.getMessage(), e);
        }

        StringBuffer outBuf = new StringBuffer();
        StringBuffer errBuf = new StringBuffer();
        Thread tOut = drain(p.getInputStream(), outBuf, command.label() + "-out");
        Thread tErr = drain(p.getErrorStream(), errBuf, command.label() + "-err");

        boolean finished;
        try {
            finished = p.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExternalToolException(command.label(), "interrupted", e);
        }
        if (!finished) {
            p.destroyForcibly();
        }
        join(tOut);
        join(tErr);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        int exit = finished ? p.exitValue() : -1;
        LOGGER.debug("LocalProcessRunner END label={} exit={} timedOut={} elapsedMs={}",
                command.label(), exit, !finished, elapsed.toMillis());
        return new ProcessResult(exit, outBuf.toString(), errBuf.toString(), elapsed, !finished);
    }

    private static Thread drain(InputStream stream, StringBuffer sink, String name) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.trace("[{}] {}", name, line);
                    sink.append(line).append('\n');
                });
            } catch (IOException | UncheckedIOException e) {
                LOGGER.debug("LocalProcessRunner stream closed name={} cause={}", name, e.toString());
            }
        }, name);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static void join(Thread t) {
        try {
            t.join(DRAIN_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
