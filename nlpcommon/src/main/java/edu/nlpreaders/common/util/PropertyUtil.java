package edu.nlpreaders.common.util;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class PropertyUtil {

	/**
	 * Filters properties (does not inherit other properties)
	 * @see #filterProperties(Properties, String, boolean)
	 * @param in input properties object
	 * @param filter property names to filter
	 * @return filtered properties
	 */
	public static Properties filterProperties(Properties in, String filter)
	{
		return filterProperties(in, filter, false);
	}

	/**
	 * Filters properties. Takes the input properties and return a properties
	 * object that truncates the property names beginning w/ the filter. If
	 * inherit is specified, other properties are also returned intact,
	 * unless the property name conflict with a filtered property, then the
	 * value will be of the filtered property.
	 * @param in input properties object
	 * @param filter property names that begin w/ the filter are returned with the filter part truncated
	 * @param inherit whether to inherit properties that does not begin w/ the filter
	 * @return filtered properties
	 */
    public static Properties filterProperties(Properties in, String filter, boolean inherit)
    {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
            if (propName.startsWith(filter))
                out.setProperty(propName.substring(filter.length()), in.getProperty(propName));

        if (inherit)
            for (String propName:in.stringPropertyNames())
                if (!propName.startsWith(filter) && out.getProperty(propName)==null)
                    out.setProperty(propName, in.getProperty(propName));

        return out;
    }

    // match ${ENV_VAR_NAME}
    static final Pattern p = Pattern.compile("\\$\\{(\\w+)\\}");

    /**
     * Returns a new properties object that resolves environment variables
     * in the property values. Environment variables should be specified in
     * the ${ENV_VAR_NAME} form, unset variables resolve to an empty string.
     * @param in input properties object
     * @return filtered properties
     */
    public static Properties resolveEnvironmentVariables(Properties in)
    {
        Properties out = new Properties();

        for (String propName:in.stringPropertyNames())
        {
        	String value = in.getProperty(propName);
        	Matcher m = p.matcher(value);
        	StringBuffer sb = new StringBuffer();
        	while (m.find()) {
        		String envVarValue = System.getenv(m.group(1));
        		m.appendReplacement(sb, Matcher.quoteReplacement(envVarValue==null?"":envVarValue));
        	}
        	m.appendTail(sb);
        	out.setProperty(propName, sb.toString());
        }

        return out;
    }

    /**
     * Loads a properties file (UTF-8) on top of the given defaults.
     */
    public static Properties load(File file, Properties defaults) throws IOException
    {
        Properties props = new Properties();
        if (defaults!=null)
            props.putAll(defaults);
        try (InputStream in = new FileInputStream(file)) {
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return props;
    }

    /**
     * Loads a properties resource from the classpath, an absent resource gives empty properties.
     */
    public static Properties loadResource(Class<?> cls, String resource) throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = cls.getResourceAsStream(resource)) {
            if (in!=null)
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return props;
    }

    public static boolean getBoolean(Properties props, String name, boolean defaultValue)
    {
        String value = props.getProperty(name);
        return value==null?defaultValue:Boolean.parseBoolean(value.trim());
    }

    public static int getInt(Properties props, String name, int defaultValue)
    {
        String value = props.getProperty(name);
        if (value==null || value.trim().isEmpty())
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("property "+name+" is not an integer: "+value, e);
        }
    }

    public static String toString(Properties props)
    {
    	StringBuilder builder = new StringBuilder();

        String[] keys = props.stringPropertyNames().toArray(new String[0]);
        Arrays.sort(keys);
        for (String key:keys)
            builder.append(key+" = "+props.getProperty(key)+"\n");
        return builder.toString();
    }
}
