package com.compilebox.backend.model;

/**
 * A snippet as the services see it: NUL bytes removed and line endings
 * normalised to {@code \n}.
 */
public record SourceUnit(String text) {

    static final String DEFAULT_MODULE = "sample";

    public SourceUnit {
        text = sanitize(text);
    }

    public static SourceUnit of(String raw) {
        return new SourceUnit(raw);
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    public int length() {
        return text.length();
    }

    /**
     * The snippet as a compilable module: unchanged if it already declares a
     * module, otherwise prefixed with a module header and an import for each
     * standard facility the snippet mentions.
     */
    public String withModulePreamble() {
        if (text.strip().startsWith("модуль ")) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("модуль ").append(DEFAULT_MODULE).append("\n\n");
        if (text.contains("вывод")) {
            sb.append("импорт \"стд::вывод\"\n\n");
        }
        if (text.contains("ввод")) {
            sb.append("импорт \"стд::ввод\"\n\n");
        }
        if (text.contains("файл")) {
            sb.append("импорт \"стд::файл\"\n\n");
        }
        sb.append(text);
        return sb.toString();
    }

    private static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.replace("\0", "")
                .replace("\r\n", "\n")
                .replace("\r", "\n");
    }
}
