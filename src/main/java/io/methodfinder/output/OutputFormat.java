package io.methodfinder.output;

/**
 * Report formats. Constant names are the values accepted on the command line and in config files.
 */
public enum OutputFormat {
    txt,
    json;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static OutputFormat parse(String value) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + value + " (expected txt or json)");
    }
}
