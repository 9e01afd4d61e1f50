package com.raditha.similarity.extraction;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Source languages the block extractor knows about, each with the patterns
 * that mark the start of a function and of a class. Patterns are matched
 * against the trimmed line.
 */
public enum Language {
    JAVASCRIPT(Patterns.SCRIPT_FUNCTION, Patterns.SCRIPT_CLASS),
    TYPESCRIPT(Patterns.SCRIPT_FUNCTION, Patterns.SCRIPT_CLASS),
    PYTHON(Pattern.compile("^(async\\s+)?def\\s+\\w+\\s*\\("), Pattern.compile("^class\\s+\\w+")),
    JAVA(Patterns.MANAGED_METHOD, Pattern.compile("^(public|private|protected)?\\s*(abstract\\s+|final\\s+)?class\\s+\\w+")),
    CSHARP(Patterns.MANAGED_METHOD, Pattern.compile("^(public|private|protected|internal)?\\s*(abstract\\s+|sealed\\s+|static\\s+)?class\\s+\\w+")),
    CPP(Patterns.NATIVE_FUNCTION, Pattern.compile("^(class|struct)\\s+\\w+")),
    C(Patterns.NATIVE_FUNCTION, Pattern.compile("^(typedef\\s+)?struct\\s+\\w+")),
    TEXT(null, null);

    private static final Map<String, Language> EXTENSIONS = Map.ofEntries(
            Map.entry("js", JAVASCRIPT),
            Map.entry("jsx", JAVASCRIPT),
            Map.entry("mjs", JAVASCRIPT),
            Map.entry("ts", TYPESCRIPT),
            Map.entry("tsx", TYPESCRIPT),
            Map.entry("py", PYTHON),
            Map.entry("java", JAVA),
            Map.entry("cs", CSHARP),
            Map.entry("cpp", CPP),
            Map.entry("cc", CPP),
            Map.entry("hpp", CPP),
            Map.entry("c", C),
            Map.entry("h", C));

    private final Pattern functionStart;
    private final Pattern classStart;

    Language(Pattern functionStart, Pattern classStart) {
        this.functionStart = functionStart;
        this.classStart = classStart;
    }

    /**
     * Detect the language from a file path's extension.
     * Unknown extensions map to {@link #TEXT}.
     */
    public static Language fromPath(String filePath) {
        if (filePath == null) {
            return TEXT;
        }
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        String name = filePath.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return TEXT;
        }
        return EXTENSIONS.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), TEXT);
    }

    public boolean isFunctionStart(String trimmedLine) {
        return matches(functionStart, trimmedLine);
    }

    public boolean isClassStart(String trimmedLine) {
        return matches(classStart, trimmedLine);
    }

    /**
     * True when the language has no start patterns and never yields blocks.
     */
    public boolean isPlainText() {
        return functionStart == null && classStart == null;
    }

    private static boolean matches(Pattern pattern, String line) {
        if (pattern == null || line == null) {
            return false;
        }
        return pattern.matcher(line).find();
    }

    /**
     * Shared pattern tables. Kept out of the enum body because enum constants
     * cannot reference their own static fields.
     */
    private static final class Patterns {
        // Lines that look like calls but start a statement, not a declaration.
        private static final String NOT_STATEMENT =
                "(?!(if|for|while|switch|catch|return|new|else|throw|await|typeof|do)\\b)";

        static final Pattern SCRIPT_FUNCTION = Pattern.compile(
                "^(export\\s+(default\\s+)?)?(async\\s+)?"
                        + "(function\\s*\\*?\\s*\\w+"
                        + "|(const|let|var)\\s+\\w+\\s*=.*=>"
                        + "|" + NOT_STATEMENT + "\\w+\\s*\\([^)]*\\)\\s*\\{)");

        static final Pattern SCRIPT_CLASS = Pattern.compile(
                "^(export\\s+(default\\s+)?)?(abstract\\s+)?class\\s+\\w+");

        static final Pattern MANAGED_METHOD = Pattern.compile(
                "^" + NOT_STATEMENT + "(public|private|protected|internal)?\\s*(static)?\\s*"
                        + NOT_STATEMENT + "[\\w<>\\[\\],]+\\s+\\w+\\s*\\(");

        static final Pattern NATIVE_FUNCTION = Pattern.compile(
                "^" + NOT_STATEMENT + "(static\\s+|inline\\s+|virtual\\s+|extern\\s+)*"
                        + "[\\w:<>]+[\\s*&]+[\\w:~]+\\s*\\([^;]*$");

        private Patterns() {
        }
    }
}
