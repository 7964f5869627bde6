package com.mlld.sdk.types.options;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Configuration for {@link com.mlld.sdk.client.MlldClient}.
 * Use {@link #builder()} to create instances.
 *
 * <p>Running a development build through node:
 * <pre>{@code
 * ClientOptions options = ClientOptions.builder()
 *     .command("node")
 *     .commandArg("./dist/cli.cjs")
 *     .timeout(Duration.ofSeconds(60))
 *     .build();
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
public class ClientOptions {

    /**
     * Executable that starts the worker.
     */
    @Builder.Default
    private final String command = "mlld";

    /**
     * Arguments placed before {@code live --stdio}.
     */
    @Singular
    private final List<String> commandArgs;

    /**
     * Default timeout for every request; {@code null} waits indefinitely.
     */
    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(30);

    private final Path workingDir;

    @Singular("envVar")
    private final Map<String, String> env;

    /**
     * Receives every stderr line of the worker. Lines are logged at debug level when unset.
     */
    private final Consumer<String> stderr;

    @Builder.Default
    private final Duration stateUpdateRetryInterval = Duration.ofMillis(25);

    /**
     * How long a state update keeps retrying "request not found" when the request
     * has no timeout of its own.
     */
    @Builder.Default
    private final Duration stateUpdateDeadline = Duration.ofSeconds(2);
}
