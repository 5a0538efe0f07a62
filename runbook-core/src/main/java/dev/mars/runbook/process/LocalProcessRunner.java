/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.runbook.process;

import dev.mars.runbook.core.exceptions.RunbookException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}. Standard error is
 * redirected into standard output so callers see a single merged stream.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class LocalProcessRunner implements ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(LocalProcessRunner.class);
    private static final int BUFFER_SIZE = 4096;

    private final ExecutorService executorService;
    private final AtomicInteger threadCounter = new AtomicInteger();

    public LocalProcessRunner() {
        this.executorService = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "runbook-process-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<ProcessResult> submit(ProcessRequest request, Consumer<String> chunkListener) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return run(request, chunkListener);
            } catch (RunbookException e) {
                throw new CompletionException(e);
            }
        }, executorService);
    }

    private ProcessResult run(ProcessRequest request, Consumer<String> chunkListener) throws RunbookException {
        ProcessBuilder builder = new ProcessBuilder(request.getCommandLine());
        builder.redirectErrorStream(true);
        request.getWorkingDirectory().ifPresent(dir -> builder.directory(dir.toFile()));
        builder.environment().putAll(request.getEnvironment());

        logger.debug("Starting process: {}", request.getCommandLine());
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new RunbookException("Failed to start process '" + request.getExecutable() + "': " + e.getMessage(), e);
        }

        Future<String> outputFuture = executorService.submit(() -> readOutput(process, chunkListener));
        try {
            if (request.getTimeout().isPresent()) {
                long timeoutMs = request.getTimeout().get().toMillis();
                if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    outputFuture.cancel(true);
                    throw new ProcessTimeoutException(request.getExecutable(), request.getTimeout().get());
                }
            } else {
                process.waitFor();
            }
            String output = outputFuture.get();
            int exitCode = process.exitValue();
            logger.debug("Process {} exited with code {}", request.getExecutable(), exitCode);
            return new ProcessResult(exitCode, output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RunbookException("Interrupted while waiting for process '" + request.getExecutable() + "'", e);
        } catch (ExecutionException e) {
            throw new RunbookException("Failed to read output of process '" + request.getExecutable() + "'", e.getCause());
        }
    }

    private String readOutput(Process process, Consumer<String> chunkListener) throws IOException {
        StringBuilder output = new StringBuilder();
        char[] buffer = new char[BUFFER_SIZE];
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, read);
                output.append(chunk);
                if (chunkListener != null) {
                    try {
                        chunkListener.accept(chunk);
                    } catch (RuntimeException e) {
                        logger.warn("Output chunk listener failed: {}", e.getMessage());
                    }
                }
            }
        }
        return output.toString();
    }

    @Override
    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
