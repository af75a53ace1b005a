package edu.nlpreaders.srl.reader;

import java.util.Properties;

import edu.nlpreaders.common.util.PropertyUtil;

/**
 * The corpus dialects, each with its property prefix and default file name pattern.
 */
public enum CorpusFormat {
    CONLL2009("conll2009", Conll2009Reader.DEFAULT_FILE_REGEX),
    CONLL2012("conll2012", Conll2012Reader.DEFAULT_FILE_REGEX),
    UNITED("united", UnitedSrlReader.DEFAULT_FILE_REGEX);

    final String key;
    final String defaultFileRegex;

    CorpusFormat(String key, String defaultFileRegex) {
        this.key = key;
        this.defaultFileRegex = defaultFileRegex;
    }

    public String getKey() {
        return key;
    }

    public String getDefaultFileRegex() {
        return defaultFileRegex;
    }

    public SrlReader newReader() {
        return newReader(new Properties());
    }

    /**
     * Creates a reader configured from props: <code>&lt;key&gt;.file-regex</code>
     * and, for the United format, <code>united.strict</code>.
     */
    public SrlReader newReader(Properties props) {
        Properties formatProps = PropertyUtil.filterProperties(props, key+'.');
        String fileRegex = formatProps.getProperty("file-regex", defaultFileRegex).trim();
        switch (this) {
        case CONLL2009:
            return new Conll2009Reader(fileRegex);
        case CONLL2012:
            return new Conll2012Reader(fileRegex);
        case UNITED:
            return new UnitedSrlReader(fileRegex, PropertyUtil.getBoolean(formatProps, "strict", false));
        default:
            throw new IllegalArgumentException("no reader for "+this);
        }
    }
}
