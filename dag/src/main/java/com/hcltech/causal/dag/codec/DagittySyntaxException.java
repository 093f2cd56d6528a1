package com.hcltech.causal.dag.codec;

/** Thrown inside the dagitty parser; {@link DagittyCodec#decode} turns it into an error value. */
class DagittySyntaxException extends RuntimeException {
    DagittySyntaxException(String message) {
        super(message);
    }
}
