package org.querydump.cli;

import java.io.FileReader;
import java.io.IOException;
import java.util.Enumeration;
import java.util.Properties;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

@Log4j2
public class OptionsFile {

    private static final String SOURCE_CONNECTION_PREFIX = "source.connect.parameter.";
    private static final String SINK_CONNECTION_PREFIX = "sink.connect.parameter.";

    private final Properties properties;

    public OptionsFile(String optionsFilePath) throws IOException {
        this.properties = new Properties();
        loadProperties(optionsFilePath);
    }

    public Properties getProperties() {
        return properties;
    }

    private void loadProperties(String optionsFilePath) throws IOException {

        // open reader to read the properties file
        try (FileReader in = new FileReader(optionsFilePath)) {
            // load the properties from that reader
            this.properties.load(in);
            resolvePropertiesEnvVar();
        } catch (IOException e) {
            log.error("Could not read options file {}: {}", optionsFilePath, e.getMessage());
            throw e;
        }
    }

    public Properties getSourceConnectionParams() {
        return getPrefixedParams(SOURCE_CONNECTION_PREFIX);
    }

    public Properties getSinkConnectionParams() {
        return getPrefixedParams(SINK_CONNECTION_PREFIX);
    }

    private Properties getPrefixedParams(String prefix) {
        Set<Object> propertyKeys = this.properties.keySet();
        Properties connectProps = new Properties();

        for (Object propertyKey : propertyKeys) {
            String key = (String) propertyKey;

            if (key.startsWith(prefix)) {
                connectProps.setProperty(key.substring(prefix.length()), this.properties.getProperty(key));
            }
        }

        return connectProps;
    }

    private void resolvePropertiesEnvVar() {
        Enumeration<?> propertyNames = this.properties.propertyNames();
        while (propertyNames.hasMoreElements()) {
            String name = propertyNames.nextElement().toString();
            String value = this.properties.getProperty(name);

            if (value != null && !value.isEmpty())
                this.properties.setProperty(name, EnvironmentVariableEvaluator.resolveEnvVars(value));

        }
    }
}
