package com.mlld.sdk.types.options;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.Map;

/**
 * Options for {@code execute()}. Unset fields are left out of the request.
 */
@Getter
@Builder(toBuilder = true)
public class ExecuteOptions {

    private final Object state;

    @Singular
    private final Map<String, Object> dynamicModules;

    private final String dynamicModuleSource;
    private final ParseMode mode;
    private final Boolean allowAbsolutePaths;
    private final Duration timeout;
}
