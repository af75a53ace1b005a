package edu.nlpreaders.srl.reader;

import java.util.HashMap;
import java.util.Map;

/**
 * Restores the punctuation that treebank style corpora escape.
 */
public final class TokenNormalizer {

    static final Map<String, String> ESCAPES = new HashMap<String, String>();
    static {
        ESCAPES.put("-LRB-", "(");
        ESCAPES.put("-RRB-", ")");
        ESCAPES.put("-LSB-", "[");
        ESCAPES.put("-RSB-", "]");
        ESCAPES.put("-LCB-", "{");
        ESCAPES.put("-RCB-", "}");
        ESCAPES.put("``", "\"");
        ESCAPES.put("''", "\"");
    }

    private TokenNormalizer() {
    }

    public static String unescape(String token) {
        String value = ESCAPES.get(token);
        return value==null?token:value;
    }

    /**
     * Like {@link #unescape(String)}, a blank form (a lost double quote in
     * the United corpus) also becomes a double quote.
     */
    public static String unescapeBlank(String token) {
        if (token.trim().isEmpty())
            return "\"";
        return unescape(token);
    }
}
