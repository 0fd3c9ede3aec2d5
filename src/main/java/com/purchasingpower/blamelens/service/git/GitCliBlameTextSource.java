package com.purchasingpower.blamelens.service.git;

import com.purchasingpower.blamelens.configuration.AppProperties;
import com.purchasingpower.blamelens.configuration.AsyncConfig;
import com.purchasingpower.blamelens.exception.BlameCommandException;
import com.purchasingpower.blamelens.model.CallContext;
import com.purchasingpower.blamelens.model.ServiceType;
import com.purchasingpower.blamelens.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code git blame --porcelain -- <file>} in the file's directory.
 */
@Slf4j
@Component
public class GitCliBlameTextSource implements BlameTextSource {

    private final AppProperties props;
    private final Executor outputExecutor;

    public GitCliBlameTextSource(AppProperties props,
                                 @Qualifier(AsyncConfig.PROCESS_OUTPUT_EXECUTOR) Executor outputExecutor) {
        this.props = props;
        this.outputExecutor = outputExecutor;
    }

    @Override
    public String blame(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path directory = absolute.getParent();
        if (directory == null) {
            throw new BlameCommandException("No parent directory for " + absolute, "");
        }

        String git = props.getBlame().getGitExecutable();
        long timeoutSeconds = props.getBlame().getTimeoutSeconds();
        List<String> command = List.of(git, "blame", "--porcelain", "--", absolute.getFileName().toString());

        CallContext call = ExternalCallLogger.startCall(ServiceType.GIT, "Blame", log);
        call.logRequest(String.join(" ", command), "Directory", directory);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(directory.toFile())
                    .start();
        } catch (IOException e) {
            call.logError("Could not start " + git, e);
            throw new BlameCommandException("Could not start " + git + ": " + e.getMessage(), e);
        }

        // Drain both pipes while waiting, a large blame would otherwise fill the buffer and block
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), outputExecutor);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), outputExecutor);

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                call.logError("Timed out after " + timeoutSeconds + "s", null);
                throw new BlameCommandException("git blame timed out after " + timeoutSeconds + "s for " + absolute, "");
            }

            int exitCode = process.exitValue();
            String errors = stderr.join();
            if (exitCode != 0) {
                call.logError("Exit code " + exitCode + ": " + ExternalCallLogger.truncate(errors.trim(), 200), null);
                throw new BlameCommandException("git blame exited with code " + exitCode + " for " + absolute, errors);
            }

            String output = stdout.join();
            call.logResponse("Blame output", "Bytes", output.length());
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new BlameCommandException("Interrupted while running git blame for " + absolute, e);
        } catch (CompletionException e) {
            throw new BlameCommandException("Could not read git blame output for " + absolute, e.getCause());
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
