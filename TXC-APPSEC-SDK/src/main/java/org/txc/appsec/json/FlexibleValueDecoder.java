package org.txc.appsec.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes identifiers and names that the API sometimes sends as a string, sometimes as a number
 * and sometimes as an array of strings. Unrecognized kinds decode to {@link FlexibleValue#empty()}
 * rather than failing.
 */
public final class FlexibleValueDecoder {

    private FlexibleValueDecoder() {}

    public static FlexibleValue decode(JsonNode node) {
        if (node == null) {
            return FlexibleValue.empty();
        }
        if (node.isTextual()) {
            return FlexibleValue.text(node.textValue());
        }
        if (node.isNumber()) {
            return FlexibleValue.text(numberToText(node));
        }
        if (node.isArray()) {
            List<String> items = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    items.add(element.textValue());
                } else if (element.isNumber()) {
                    items.add(numberToText(element));
                }
            }
            return FlexibleValue.list(items);
        }
        return FlexibleValue.empty();
    }

    private static String numberToText(JsonNode number) {
        if (number.isIntegralNumber()) {
            return number.bigIntegerValue().toString();
        }
        return number.decimalValue().stripTrailingZeros().toPlainString();
    }
}
