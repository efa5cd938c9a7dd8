package com.mathide.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathide.exception.ParseFailureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * ResilientDecoder - turns model text that is supposed to be JSON into a {@link JsonNode}.
 *
 * Stage order (first success wins):
 *   DIRECT            decode as-is
 *   EXPRESSION_REPAIR {@link ExpressionRepair} then decode
 *   DOUBLE_ESCAPES    double every backslash that does not start a recognized escape
 *   STRIP_ESCAPES     delete every backslash that does not start a recognized escape
 *
 * When all four fail a {@link ParseFailureException} is thrown with one {@link StageFailure}
 * per stage and the original text. No other exception leaves {@link #decode(String)}.
 *
 * DIRECT runs first, so a single-escaped command whose letter is also a JSON escape
 * ({@code "\frac"}, {@code "\theta"}, {@code "\neq"}, {@code "\beta"}) decodes as a form feed,
 * tab, newline or backspace followed by the rest of the name. Callers that need those commands
 * intact must receive them double-escaped.
 *
 * Stateless and thread-safe; the shared ObjectMapper is only used for reading.
 */
public final class ResilientDecoder {

    private static final Logger log = LoggerFactory.getLogger(ResilientDecoder.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final int PREVIEW_LENGTH = 200;

    private ResilientDecoder() {}

    public static JsonNode decode(String text) {
        if (text == null) {
            throw new ParseFailureException("Nothing to decode",
                    List.of(new StageFailure(DecodeStage.DIRECT, "input is null")), null);
        }

        log.debug("[Decoder] Decoding: {}", preview(text));

        List<StageFailure> failures = new ArrayList<>(DecodeStage.values().length);

        for (DecodeStage stage : DecodeStage.values()) {
            try {
                String candidate = transformFor(stage).apply(text);
                JsonNode node = MAPPER.readTree(candidate);
                if (node == null || node.isMissingNode()) {
                    failures.add(new StageFailure(stage, "no JSON content"));
                    continue;
                }
                if (stage != DecodeStage.DIRECT) {
                    log.debug("[Decoder] Recovered at stage {}", stage);
                }
                return node;
            } catch (JsonProcessingException e) {
                failures.add(new StageFailure(stage, e.getOriginalMessage()));
                log.debug("[Decoder] Stage {} failed: {}", stage, e.getOriginalMessage());
            } catch (RuntimeException e) {
                failures.add(new StageFailure(stage, e.toString()));
                log.debug("[Decoder] Stage {} failed unexpectedly", stage, e);
            }
        }

        log.warn("[Decoder] All {} stages failed for: {}", failures.size(), preview(text));
        failures.forEach(f -> log.warn("[Decoder]   - {}", f));

        throw new ParseFailureException(
                "Could not decode model output after " + failures.size() + " attempts",
                failures, text);
    }

    private static UnaryOperator<String> transformFor(DecodeStage stage) {
        return switch (stage) {
            case DIRECT            -> UnaryOperator.identity();
            case EXPRESSION_REPAIR -> ExpressionRepair::repair;
            case DOUBLE_ESCAPES    -> s -> rewriteLoneEscapes(s, true);
            case STRIP_ESCAPES     -> s -> rewriteLoneEscapes(s, false);
        };
    }

    /**
     * Walks the text once. A backslash pair {@code \\} and a backslash followed by one of
     * {@code " \ / b f n r t} or {@code uXXXX} are recognized escapes and copied through.
     * Any other backslash is either doubled or dropped.
     */
    static String rewriteLoneEscapes(String text, boolean doubleThem) {
        if (text.indexOf('\\') < 0) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length() + 16);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\') {
                out.append(c);
                i++;
                continue;
            }

            int escapeLength = recognizedEscapeLength(text, i);
            if (escapeLength > 0) {
                out.append(text, i, i + escapeLength);
                i += escapeLength;
            } else {
                if (doubleThem) out.append("\\\\");
                i++;
            }
        }
        return out.toString();
    }

    private static int recognizedEscapeLength(String text, int backslash) {
        if (backslash + 1 >= text.length()) return 0;
        char next = text.charAt(backslash + 1);
        switch (next) {
            case '"': case '\\': case '/': case 'b': case 'f': case 'n': case 'r': case 't':
                return 2;
            case 'u':
                if (backslash + 6 <= text.length() && isHex(text, backslash + 2, backslash + 6)) {
                    return 6;
                }
                return 0;
            default:
                return 0;
        }
    }

    private static boolean isHex(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    private static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
