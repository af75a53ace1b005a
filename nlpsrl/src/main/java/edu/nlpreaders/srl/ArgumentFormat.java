package edu.nlpreaders.srl;

/**
 * Output formats of {@link SrlSentence#getPredicateArguments(int, String)}.
 */
public enum ArgumentFormat {
    /** the argument objects of the predicate */
    SPAN("span"),
    /** one BIO tag per token of the sentence */
    BIO("bio");

    final String formatName;

    ArgumentFormat(String formatName) {
        this.formatName = formatName;
    }

    public static ArgumentFormat fromString(String format) {
        if (format!=null)
            for (ArgumentFormat f:values())
                if (f.formatName.equals(format))
                    return f;
        throw new IllegalArgumentException("Unknown format: "+format+". Available formats are: `span`, `bio`");
    }

    @Override
    public String toString() {
        return formatName;
    }
}
