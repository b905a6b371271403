package com.example.channeluploader.tree;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks folder and file names before they enter a tree. Each method returns the
 * reason a name is rejected, or empty when the name is acceptable.
 */
public final class NameValidator {
    static final int MAX_NAME_LENGTH = 255;

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile("<script", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+\\s*=", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.\\.[\\\\/]"),
            Pattern.compile("__proto__", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\$\\{.*}")
    );
    private static final Pattern FORBIDDEN_FOLDER_CHARS = Pattern.compile("[<>:\"|?*\\x00-\\x1f]");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f]");

    private NameValidator() {
    }

    public static Optional<String> validateFolderName(String name) {
        Optional<String> common = validateCommon(name, "Folder");
        if (common.isPresent()) {
            return common;
        }
        String trimmed = name.strip();
        for (Pattern pattern : DANGEROUS_PATTERNS) {
            if (pattern.matcher(trimmed).find()) {
                return Optional.of("Potentially dangerous characters detected");
            }
        }
        if (FORBIDDEN_FOLDER_CHARS.matcher(trimmed).find()) {
            return Optional.of("Invalid characters in folder name");
        }
        return Optional.empty();
    }

    public static Optional<String> validateFileName(String name) {
        Optional<String> common = validateCommon(name, "File");
        if (common.isPresent()) {
            return common;
        }
        if (CONTROL_CHARS.matcher(name).find()) {
            return Optional.of("Control characters not allowed");
        }
        return Optional.empty();
    }

    private static Optional<String> validateCommon(String name, String kind) {
        if (name == null || name.isBlank()) {
            return Optional.of(kind + " name is empty");
        }
        String trimmed = name.strip();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            return Optional.of(kind + " name too long (" + trimmed.length() + " > " + MAX_NAME_LENGTH + " chars)");
        }
        // Checked before the pattern list so "../" reports as traversal.
        if (trimmed.contains("..") || trimmed.contains("/") || trimmed.contains("\\")) {
            return Optional.of("Path traversal characters not allowed");
        }
        return Optional.empty();
    }
}
