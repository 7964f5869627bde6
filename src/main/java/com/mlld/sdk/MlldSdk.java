package com.mlld.sdk;

import com.mlld.sdk.client.AnalyzeHandle;
import com.mlld.sdk.client.ExecuteHandle;
import com.mlld.sdk.client.MlldClient;
import com.mlld.sdk.client.ProcessHandle;
import com.mlld.sdk.types.analysis.AnalyzeResult;
import com.mlld.sdk.types.options.ExecuteOptions;
import com.mlld.sdk.types.options.ProcessOptions;
import com.mlld.sdk.types.results.ExecuteResult;

/**
 * Main entry point for the mlld SDK.
 * <p>
 * Static shortcuts backed by a shared {@link MlldClient} with default options. The
 * client is created on first use and closed when the JVM shuts down.
 * <p>
 * Example:
 * <pre>{@code
 * String output = MlldSdk.process("/var @name = \"World\"\nHello, @name!");
 *
 * ExecuteResult result = MlldSdk.execute("./agent.mld", Map.of("text", "hello"),
 *     ExecuteOptions.builder().state(Map.of("count", 0)).build());
 * result.getStateWrites().forEach(System.out::println);
 * }</pre>
 */
public final class MlldSdk {

    private static volatile MlldClient defaultClient;

    private MlldSdk() {
    }

    /**
     * The shared client used by the static methods.
     */
    public static MlldClient defaultClient() {
        MlldClient client = defaultClient;
        if (client == null) {
            synchronized (MlldSdk.class) {
                client = defaultClient;
                if (client == null) {
                    client = new MlldClient();
                    Runtime.getRuntime().addShutdownHook(new Thread(client::close, "mlld-sdk-shutdown"));
                    defaultClient = client;
                }
            }
        }
        return client;
    }

    public static String process(String script) {
        return defaultClient().process(script);
    }

    public static String process(String script, ProcessOptions options) {
        return defaultClient().process(script, options);
    }

    public static ProcessHandle processAsync(String script, ProcessOptions options) {
        return defaultClient().processAsync(script, options);
    }

    public static ExecuteResult execute(String filepath, Object payload) {
        return defaultClient().execute(filepath, payload);
    }

    public static ExecuteResult execute(String filepath, Object payload, ExecuteOptions options) {
        return defaultClient().execute(filepath, payload, options);
    }

    public static ExecuteHandle executeAsync(String filepath, Object payload, ExecuteOptions options) {
        return defaultClient().executeAsync(filepath, payload, options);
    }

    public static AnalyzeResult analyze(String filepath) {
        return defaultClient().analyze(filepath);
    }

    public static AnalyzeHandle analyzeAsync(String filepath) {
        return defaultClient().analyzeAsync(filepath);
    }

    /**
     * Get SDK version.
     */
    public static String getVersion() {
        return "0.1.0";
    }
}
