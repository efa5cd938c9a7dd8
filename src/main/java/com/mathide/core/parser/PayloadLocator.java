package com.mathide.core.parser;

import com.mathide.exception.PayloadNotFoundException;

/**
 * Locates the JSON payload inside a model reply that may carry prose or markdown fences
 * around it.
 *
 * The payload is the substring from the first opening bracket to the last matching closing
 * bracket of the requested shape. No balancing is attempted; whatever lies between the two
 * is handed to {@link ResilientDecoder}.
 */
public final class PayloadLocator {

    public enum Shape {
        ARRAY('[', ']'),
        OBJECT('{', '}');

        private final char open;
        private final char close;

        Shape(char open, char close) {
            this.open  = open;
            this.close = close;
        }
    }

    private PayloadLocator() {}

    /**
     * @param text  raw model reply
     * @param shape which bracket pair delimits the payload
     * @return the bracketed substring, brackets included
     * @throws PayloadNotFoundException if no bracket pair of that shape exists
     */
    public static String locate(String text, Shape shape) {
        if (text == null || text.isBlank()) {
            throw new PayloadNotFoundException("Empty model reply", text);
        }

        int start = text.indexOf(shape.open);
        int end   = text.lastIndexOf(shape.close);

        if (start < 0 || end < start) {
            throw new PayloadNotFoundException(
                    "No " + shape.name().toLowerCase() + " payload in model reply", text);
        }

        return text.substring(start, end + 1);
    }
}
