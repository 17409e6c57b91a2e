package com.flowmodel.config;

import java.util.Objects;

/**
 * Configuration loaded from environment variables for model creation.
 * <p>
 * Storage: FM_DEFAULT_FILE_SUFFIX names new storage units {@code <elementName><suffix>}.
 * Equations: FM_INTERNAL_PREFIX prefixes generated internal variables ({@code _L1}, {@code _L2}, ...).
 * Layout: FM_LAYOUT_DIR and FM_LAYOUT_FILE locate the layout defaults file.
 * FM_LEGACY_NUMERIC_TYPES accepts {@code int} and {@code real} as predefined names.
 */
public final class FlowModelConfig {

    private static final String ENV_DEFAULT_FILE_SUFFIX = "FM_DEFAULT_FILE_SUFFIX";
    private static final String ENV_INTERNAL_PREFIX = "FM_INTERNAL_PREFIX";
    private static final String ENV_LAYOUT_DIR = "FM_LAYOUT_DIR";
    private static final String ENV_LAYOUT_FILE = "FM_LAYOUT_FILE";
    private static final String ENV_LEGACY_NUMERIC_TYPES = "FM_LEGACY_NUMERIC_TYPES";

    private static final String DEFAULT_FILE_SUFFIX = ".xscade";
    private static final String DEFAULT_INTERNAL_PREFIX = "_L";
    private static final String DEFAULT_LAYOUT_DIR = "config";
    private static final String DEFAULT_LAYOUT_FILE = "layout-defaults.json";
    private static final boolean DEFAULT_LEGACY_NUMERIC_TYPES = true;

    private final String defaultFileSuffix;
    private final String internalPrefix;
    private final String layoutDir;
    private final String layoutFile;
    private final boolean legacyNumericTypes;

    private FlowModelConfig(Builder b) {
        this.defaultFileSuffix = b.defaultFileSuffix;
        this.internalPrefix = b.internalPrefix;
        this.layoutDir = b.layoutDir;
        this.layoutFile = b.layoutFile;
        this.legacyNumericTypes = b.legacyNumericTypes;
    }

    /** Suffix of storage units created for elements without owner. Default {@code .xscade}. */
    public String getDefaultFileSuffix() {
        return defaultFileSuffix;
    }

    /** Prefix of internal variables created for typed equation lefts. Default {@code _L}. */
    public String getInternalPrefix() {
        return internalPrefix;
    }

    public String getLayoutDir() {
        return layoutDir;
    }

    public String getLayoutFile() {
        return layoutFile;
    }

    /** Whether {@code int} and {@code real} are accepted as predefined type names. Default true. */
    public boolean isLegacyNumericTypes() {
        return legacyNumericTypes;
    }

    /** Storage unit path for an element that gets its own new unit. */
    public String unitPathFor(String elementName) {
        return elementName + defaultFileSuffix;
    }

    public static FlowModelConfig defaults() {
        return builder().build();
    }

    public static FlowModelConfig fromEnvironment() {
        return builder()
                .defaultFileSuffix(getEnv(ENV_DEFAULT_FILE_SUFFIX, DEFAULT_FILE_SUFFIX))
                .internalPrefix(getEnv(ENV_INTERNAL_PREFIX, DEFAULT_INTERNAL_PREFIX))
                .layoutDir(getEnv(ENV_LAYOUT_DIR, DEFAULT_LAYOUT_DIR))
                .layoutFile(getEnv(ENV_LAYOUT_FILE, DEFAULT_LAYOUT_FILE))
                .legacyNumericTypes(parseBoolean(System.getenv(ENV_LEGACY_NUMERIC_TYPES), DEFAULT_LEGACY_NUMERIC_TYPES))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String defaultFileSuffix = DEFAULT_FILE_SUFFIX;
        private String internalPrefix = DEFAULT_INTERNAL_PREFIX;
        private String layoutDir = DEFAULT_LAYOUT_DIR;
        private String layoutFile = DEFAULT_LAYOUT_FILE;
        private boolean legacyNumericTypes = DEFAULT_LEGACY_NUMERIC_TYPES;

        public Builder defaultFileSuffix(String defaultFileSuffix) {
            this.defaultFileSuffix = defaultFileSuffix != null ? defaultFileSuffix : DEFAULT_FILE_SUFFIX;
            return this;
        }

        public Builder internalPrefix(String internalPrefix) {
            this.internalPrefix = internalPrefix != null && !internalPrefix.isBlank() ? internalPrefix : DEFAULT_INTERNAL_PREFIX;
            return this;
        }

        public Builder layoutDir(String layoutDir) {
            this.layoutDir = layoutDir;
            return this;
        }

        public Builder layoutFile(String layoutFile) {
            this.layoutFile = Objects.requireNonNull(layoutFile, "layoutFile");
            return this;
        }

        public Builder legacyNumericTypes(boolean legacyNumericTypes) {
            this.legacyNumericTypes = legacyNumericTypes;
            return this;
        }

        public FlowModelConfig build() {
            return new FlowModelConfig(this);
        }
    }
}
