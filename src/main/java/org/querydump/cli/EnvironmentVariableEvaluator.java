package org.querydump.cli;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces ${NAME} references in option values with the value of the environment variable NAME.
 * Unknown variables are left untouched.
 */
public final class EnvironmentVariableEvaluator {

    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private EnvironmentVariableEvaluator() {
    }

    public static String resolveEnvVars(String value) {
        return resolveEnvVars(value, System.getenv());
    }

    static String resolveEnvVars(String value, Map<String, String> environment) {
        if (value == null) return null;

        Matcher matcher = ENV_VAR_PATTERN.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String envValue = environment.get(matcher.group(1));
            String replacement = envValue == null ? matcher.group(0) : envValue;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
