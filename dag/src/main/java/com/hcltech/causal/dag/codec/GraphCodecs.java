package com.hcltech.causal.dag.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hcltech.causal.common.codec.Codec;
import com.hcltech.causal.common.codec.JacksonTypedJsonCodec;
import com.hcltech.causal.dag.GraphDescription;
import com.hcltech.causal.dag.analysis.AnalysisReport;
import com.hcltech.causal.dag.validation.ValidationReport;

/** The text forms a graph and its reports are exchanged in. */
public interface GraphCodecs {

    Codec<GraphDescription, String> JSON = new JacksonTypedJsonCodec<>(GraphDescription.class);

    Codec<GraphDescription, String> DAGITTY = new DagittyCodec();

    /** Reports are written for people as well as programs, so they are indented. */
    Codec<AnalysisReport, String> REPORT_JSON =
            new JacksonTypedJsonCodec<>(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), AnalysisReport.class);

    Codec<ValidationReport, String> VALIDATION_JSON =
            new JacksonTypedJsonCodec<>(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT), ValidationReport.class);
}
