package net.tablegen.util.config;

public interface Configuration {

    Configuration DEFAULT = DynamicConfiguration.makeDefault();

    String get(String key);

}
