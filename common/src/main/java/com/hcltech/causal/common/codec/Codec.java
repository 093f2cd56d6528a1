package com.hcltech.causal.common.codec;

import com.hcltech.causal.common.errorsor.ErrorsOr;

/** Two-way conversion where either direction can fail with readable errors instead of an exception. */
public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);
}
