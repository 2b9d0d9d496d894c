/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.planner.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lexis.activation.api.exceptions.ReasonerException;
import com.lexis.activation.api.model.ReasonerRequest;
import com.lexis.activation.api.model.ReasonerResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSON codec for reasoner payloads.
 *
 * <p>Model answers are rarely clean JSON. Decoding tolerates, in order:
 * <ol>
 *   <li>Markdown code fences around the object</li>
 *   <li>prose before or after the object</li>
 *   <li>truncated output, by salvaging every complete {@code {"id": ..., "activate": ...}}
 *       entry; modules lost to truncation surface later as an incomplete response</li>
 * </ol>
 */
public final class ReasonerPayloadCodec {

    private static final Logger logger = Logger.getLogger(ReasonerPayloadCodec.class.getName());

    private static final Pattern FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```\\s*$");
    private static final Pattern OUTER_OBJECT = Pattern.compile("\\{[\\s\\S]*}");
    private static final Pattern VERDICT_ENTRY = Pattern.compile(
            "\\{\\s*\"id\"\\s*:\\s*\"([^\"]+)\"\\s*,\\s*\"activate\"\\s*:\\s*(true|false)"
                    + "(?:\\s*,\\s*\"reason\"\\s*:\\s*\"((?:[^\"\\\\]|\\\\.)*)\")?");

    private final ObjectMapper objectMapper;

    public ReasonerPayloadCodec() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true));
    }

    public ReasonerPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ReasonerRequest request) throws ReasonerException {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ReasonerException("Cannot encode reasoner request: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws ReasonerException if no verdict can be recovered from the text
     */
    public ReasonerResponse decode(String text) throws ReasonerException {
        if (text == null || text.isBlank()) {
            throw new ReasonerException("Reasoner answer is empty");
        }
        String content = FENCE.matcher(text.strip()).replaceAll("");
        Matcher object = OUTER_OBJECT.matcher(content);
        if (object.find()) {
            content = object.group();
        }

        try {
            return objectMapper.readValue(content, ReasonerResponse.class);
        } catch (JsonProcessingException e) {
            List<ReasonerResponse.ModuleVerdict> salvaged = salvage(content);
            if (salvaged.isEmpty()) {
                throw new ReasonerException("Unreadable reasoner answer: " + e.getOriginalMessage(), e);
            }
            logger.warning("Recovered " + salvaged.size() + " verdicts from a malformed reasoner answer");
            return new ReasonerResponse(salvaged, "salvaged");
        }
    }

    private static List<ReasonerResponse.ModuleVerdict> salvage(String content) {
        List<ReasonerResponse.ModuleVerdict> verdicts = new ArrayList<>();
        Matcher matcher = VERDICT_ENTRY.matcher(content);
        while (matcher.find()) {
            verdicts.add(new ReasonerResponse.ModuleVerdict(
                    matcher.group(1),
                    Boolean.parseBoolean(matcher.group(2)),
                    matcher.group(3)));
        }
        return verdicts;
    }
}
