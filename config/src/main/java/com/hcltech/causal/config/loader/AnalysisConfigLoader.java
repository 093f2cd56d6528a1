package com.hcltech.causal.config.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.hcltech.causal.common.IEnvGetter;
import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.config.AnalysisConfig;
import com.hcltech.causal.dag.adjust.EffectType;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.hcltech.causal.config.loader.BaseConfigLoader.base;

public interface AnalysisConfigLoader {

    ObjectMapper JSON = base(new ObjectMapper());
    ObjectReader CONFIG_READER = JSON.readerFor(AnalysisConfig.class);

    /** Shipped in this module; holds the documented defaults. */
    String DEFAULT_RESOURCE = "causal-analysis.json";

    String MAX_RESULTS = "CAUSAL_MAX_RESULTS";
    String PATH_LIMIT = "CAUSAL_PATH_LIMIT";
    String MAX_SET_SIZE = "CAUSAL_MAX_SET_SIZE";
    String TIMEOUT_MILLIS = "CAUSAL_TIMEOUT_MILLIS";
    String EFFECT = "CAUSAL_EFFECT";

    // -------- Parse from JSON --------

    static ErrorsOr<AnalysisConfig> fromJson(InputStream in) {
        try {
            AnalysisConfig config = CONFIG_READER.readValue(in);
            return validated(config);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to parse AnalysisConfig: {0}: {1}", e);
        }
    }

    static ErrorsOr<AnalysisConfig> fromJson(String json) {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to read AnalysisConfig JSON: {0}: {1}", e);
        }
    }

    // -------- Load from classpath --------

    static ErrorsOr<AnalysisConfig> fromClasspath(String resourcePath) {
        return fromClasspath(resourcePath, Thread.currentThread().getContextClassLoader());
    }

    /** Falls back to this interface's class loader when {@code cl} is null or cannot see the resource. */
    static ErrorsOr<AnalysisConfig> fromClasspath(String resourcePath, ClassLoader cl) {
        try {
            InputStream in = (cl == null) ? null : cl.getResourceAsStream(resourcePath);
            if (in == null) {
                ClassLoader fallback = AnalysisConfigLoader.class.getClassLoader();
                in = (fallback == null) ? null : fallback.getResourceAsStream(resourcePath);
            }
            if (in == null) {
                return ErrorsOr.error("Classpath resource not found: " + resourcePath);
            }
            try (InputStream autoClose = in) {
                return fromJson(autoClose).addPrefixIfError("analysis config '" + resourcePath + "': ");
            }
        } catch (Exception e) {
            return ErrorsOr.errors(List.of(
                    "Failed to load AnalysisConfig from classpath '" + resourcePath + "': "
                            + e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    // -------- Environment overrides --------

    /** The shipped defaults with the process environment applied on top. */
    static ErrorsOr<AnalysisConfig> load() {
        return load(DEFAULT_RESOURCE, IEnvGetter.env);
    }

    static ErrorsOr<AnalysisConfig> load(String resourcePath, IEnvGetter env) {
        return fromClasspath(resourcePath).flatMap(config -> withEnvironment(config, env));
    }

    /** Set variables replace the file's values; blank ones are ignored. The result is validated again. */
    static ErrorsOr<AnalysisConfig> withEnvironment(AnalysisConfig config, IEnvGetter env) {
        try {
            String effect = IEnvGetter.getStringOr(env, EFFECT, null);
            AnalysisConfig overridden = new AnalysisConfig(
                    IEnvGetter.getIntOr(env, MAX_RESULTS, config.maxResults()),
                    IEnvGetter.getIntOr(env, PATH_LIMIT, config.pathLimit()),
                    config.reportedPathLimit(),
                    IEnvGetter.getIntOr(env, MAX_SET_SIZE, config.maxSetSize()),
                    IEnvGetter.getLongOr(env, TIMEOUT_MILLIS, config.timeoutMillis()),
                    effect == null ? config.effect() : EffectType.parse(effect));
            return validated(overridden).addPrefixIfError("environment: ");
        } catch (IllegalStateException | IllegalArgumentException e) {
            return ErrorsOr.error("environment: " + e.getMessage());
        }
    }

    // -------- Validation: return list of error strings (empty = OK) --------

    private static ErrorsOr<AnalysisConfig> validated(AnalysisConfig config) {
        List<String> errs = validate(config);
        return errs.isEmpty() ? ErrorsOr.lift(config) : ErrorsOr.errors(errs);
    }

    private static List<String> validate(AnalysisConfig c) {
        List<String> errs = new ArrayList<>();
        if (c == null) {
            errs.add("AnalysisConfig is null");
            return errs;
        }
        if (c.maxResults() < 1) errs.add("AnalysisConfig.maxResults must be at least 1 but was " + c.maxResults());
        if (c.pathLimit() < 1) errs.add("AnalysisConfig.pathLimit must be at least 1 but was " + c.pathLimit());
        if (c.reportedPathLimit() < 1) {
            errs.add("AnalysisConfig.reportedPathLimit must be at least 1 but was " + c.reportedPathLimit());
        }
        if (c.maxSetSize() < 0) errs.add("AnalysisConfig.maxSetSize must not be negative but was " + c.maxSetSize());
        if (c.timeoutMillis() < 1) errs.add("AnalysisConfig.timeoutMillis must be positive but was " + c.timeoutMillis());
        return errs;
    }
}
