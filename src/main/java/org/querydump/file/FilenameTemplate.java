package org.querydump.file;

import org.querydump.exception.ConfigurationException;

/**
 * Object name pattern of the data files. Every {@code {}} is replaced by the zero-based file number.
 */
public final class FilenameTemplate {

    public static final String PLACEHOLDER = "{}";

    private final String template;

    private FilenameTemplate(String template) {
        this.template = template;
    }

    public static FilenameTemplate of(String template) throws ConfigurationException {
        if (template == null || template.isEmpty()) {
            throw new ConfigurationException("The sink filename template is not defined");
        }
        if (!template.contains(PLACEHOLDER)) {
            throw new ConfigurationException("The sink filename template '" + template
                    + "' must contain " + PLACEHOLDER + " to number the split files");
        }
        return new FilenameTemplate(template);
    }

    public String format(int fileNo) {
        return template.replace(PLACEHOLDER, String.valueOf(fileNo));
    }

    @Override
    public String toString() {
        return template;
    }
}
