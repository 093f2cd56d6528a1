package com.hcltech.causal.dag.codec;

import com.hcltech.causal.common.codec.Codec;
import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.GraphDescription;
import com.hcltech.causal.dag.validation.StructuralValidator;
import com.hcltech.causal.dag.validation.ValidatedGraph;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a graph description and runs the structural validator over it. The format is chosen from the name:
 * {@code .json} is JSON, anything else is dagitty text.
 */
public interface GraphLoader {

    static ErrorsOr<ValidatedGraph> fromJson(String json) {
        return load(GraphCodecs.JSON, json);
    }

    static ErrorsOr<ValidatedGraph> fromDagitty(String text) {
        return load(GraphCodecs.DAGITTY, text);
    }

    static ErrorsOr<ValidatedGraph> fromFile(Path path) {
        return ErrorsOr.trying("{0}: {1}", () -> Files.readString(path, StandardCharsets.UTF_8))
                .addPrefixIfError("Failed to read graph file '" + path + "': ")
                .flatMap(text -> load(codecFor(path.getFileName().toString()), text)
                        .addPrefixIfError("graph '" + path + "': "));
    }

    static ErrorsOr<ValidatedGraph> fromClasspath(String resourcePath) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try {
            InputStream in = cl == null ? null : cl.getResourceAsStream(resourcePath);
            if (in == null) in = GraphLoader.class.getClassLoader().getResourceAsStream(resourcePath);
            if (in == null) return ErrorsOr.error("Classpath resource not found: " + resourcePath);
            try (InputStream autoClose = in) {
                String text = new String(autoClose.readAllBytes(), StandardCharsets.UTF_8);
                return load(codecFor(resourcePath), text).addPrefixIfError("graph '" + resourcePath + "': ");
            }
        } catch (Exception e) {
            return ErrorsOr.error("Failed to load graph from classpath '" + resourcePath + "': "
                    + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static Codec<GraphDescription, String> codecFor(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(".json") ? GraphCodecs.JSON : GraphCodecs.DAGITTY;
    }

    private static ErrorsOr<ValidatedGraph> load(Codec<GraphDescription, String> codec, String text) {
        return codec.decode(text).flatMap(StructuralValidator::validate);
    }
}
