package org.querydump.file;

public enum FileFormats {
    JSON("json"),
    CSV("csv");

    private final String type;

    FileFormats(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public String getMimeType() {
        return "application/" + type;
    }

    /**
     * @return the format whose type matches ignoring case, or null if there is none
     */
    public static FileFormats fromType(String type) {
        for (FileFormats format : values()) {
            if (format.type.equalsIgnoreCase(type)) {
                return format;
            }
        }
        return null;
    }
}
