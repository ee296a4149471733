package net.tablegen.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }
    public PropertiesConfiguration(File path) {
        this(loadProperties(path));
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        try {
            ret.load(in);
        } finally {
            in.close();
        }
        return ret;
    }
    public static Properties loadProperties(File path) {
        try {
            return loadProperties(new FileInputStream(path));
        } catch (IOException exc) {
            throw new RuntimeException(exc);
        }
    }

    /**
     * Load the properties class path resource at the given (absolute) path.
     * A missing resource yields an empty configuration.
     */
    public static PropertiesConfiguration fromResource(String name) {
        InputStream in = PropertiesConfiguration.class.getResourceAsStream(
            name);
        if (in == null) return new PropertiesConfiguration(new Properties());
        try {
            return new PropertiesConfiguration(loadProperties(in));
        } catch (IOException exc) {
            throw new RuntimeException(exc);
        }
    }

}
