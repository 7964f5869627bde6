package com.mlld.sdk.types.options;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.Map;

/**
 * Options for {@code process()}. Unset fields are left out of the request.
 */
@Getter
@Builder(toBuilder = true)
public class ProcessOptions {

    /**
     * Provides context for relative imports.
     */
    private final String filePath;

    /**
     * Data injected as {@code @payload}.
     */
    private final Object payload;

    /**
     * Data injected as {@code @state}.
     */
    private final Object state;

    @Singular
    private final Map<String, Object> dynamicModules;

    private final String dynamicModuleSource;
    private final ParseMode mode;
    private final Boolean allowAbsolutePaths;

    /**
     * Overrides the client default timeout.
     */
    private final Duration timeout;
}
