////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovyast;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses annotator settings from a JSON object such as
 * <pre>
 * { "sourceId": 2, "declarationKinds": { "Foo": "contract" }, "logLevel": "DEBUG" }
 * </pre>
 * Absent keys keep their defaults and unknown keys are ignored.
 */
public final class AnnotatorOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(AnnotatorOptionsParser.class);

    static final String SOURCE_ID_OPTION = "sourceId";
    static final String DECLARATION_KINDS_OPTION = "declarationKinds";
    static final String LOG_LEVEL_OPTION = "logLevel";

    /**
     * Parse options and apply the log level, if one is given.
     *
     * @return the parsed options, or the defaults if the input is not a
     *         {@link JsonObject}
     * @throws IllegalArgumentException if an option has a value of the
     *                                  wrong shape
     */
    public static AnnotatorOptions parse(Object options) {
        if (!(options instanceof JsonObject)) {
            return AnnotatorOptions.defaults();
        }
        JsonObject opts = (JsonObject) options;
        String logLevel = parseLogLevelOption(opts);
        if (logLevel != null) {
            applyLogLevel(logLevel);
        }
        int sourceId = parseSourceIdOption(opts);
        Map<String, String> declarationKinds = parseDeclarationKindsOption(opts);
        AnnotatorOptions parsed = new AnnotatorOptions(sourceId, declarationKinds, logLevel);
        logger.debug("Parsed {}", parsed);
        return parsed;
    }

    /**
     * Parse options from JSON text.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or an
     *                                  option has a value of the wrong shape
     */
    public static AnnotatorOptions parse(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid annotator options: " + e.getMessage(), e);
        }
        return parse((Object) element);
    }

    private static String parseLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            return opts.get(LOG_LEVEL_OPTION).getAsString();
        }
        return null;
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Root logger is not backed by Logback, cannot set level to '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private static int parseSourceIdOption(JsonObject opts) {
        if (!opts.has(SOURCE_ID_OPTION) || opts.get(SOURCE_ID_OPTION).isJsonNull()) {
            return 0;
        }
        JsonElement element = opts.get(SOURCE_ID_OPTION);
        if (!element.isJsonPrimitive() || !((JsonPrimitive) element).isNumber()) {
            throw new IllegalArgumentException(SOURCE_ID_OPTION + " must be an integer, got: " + element);
        }
        BigDecimal value = element.getAsBigDecimal();
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(SOURCE_ID_OPTION + " must be an integer, got: " + value, e);
        }
    }

    private static Map<String, String> parseDeclarationKindsOption(JsonObject opts) {
        if (!opts.has(DECLARATION_KINDS_OPTION) || opts.get(DECLARATION_KINDS_OPTION).isJsonNull()) {
            return new LinkedHashMap<>();
        }
        JsonElement element = opts.get(DECLARATION_KINDS_OPTION);
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException(DECLARATION_KINDS_OPTION + " must be an object, got: " + element);
        }
        Map<String, String> kinds = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            JsonElement kind = entry.getValue();
            if (kind.isJsonPrimitive()) {
                kinds.put(entry.getKey(), kind.getAsString());
            } else {
                logger.warn("Ignoring declaration kind of '{}': expected a string, got {}", entry.getKey(), kind);
            }
        }
        return kinds;
    }

    private AnnotatorOptionsParser() {
        // utility class
    }
}
