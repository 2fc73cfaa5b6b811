package com.orgscope.backend.modules.hierarchy.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.orgscope.backend.global.error.ErrorKind;
import com.orgscope.backend.global.error.ProblemException;

/**
 * Arithmetic over materialized paths: dot-joined node codes from the root down to a node.
 * <p>
 * Paths are compared as strings; a path {@code a} is an ancestor of {@code p} only when {@code p}
 * starts with {@code a + "."}, so {@code org.en} is never treated as an ancestor of {@code org.eng}.
 */
public final class MaterializedPath {

    public static final String SEPARATOR = ".";
    public static final int MAX_CODE_LENGTH = 50;

    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");
    public static final char LIKE_ESCAPE = '!';

    private MaterializedPath() {
    }

    public static String derive(String parentPath, String code) {
        validateCode(code);
        if (parentPath == null || parentPath.isEmpty()) {
            return code;
        }
        requireValid(parentPath);
        return parentPath + SEPARATOR + code;
    }

    public static int level(String path) {
        requireValid(path);
        return segments(path).size() - 1;
    }

    public static Optional<String> parentOf(String path) {
        requireValid(path);
        int idx = path.lastIndexOf(SEPARATOR);
        return idx < 0 ? Optional.empty() : Optional.of(path.substring(0, idx));
    }

    public static String codeOf(String path) {
        requireValid(path);
        int idx = path.lastIndexOf(SEPARATOR);
        return idx < 0 ? path : path.substring(idx + 1);
    }

    public static boolean isAncestor(String ancestorPath, String path) {
        if (ancestorPath == null || path == null || ancestorPath.isEmpty() || path.isEmpty()) {
            return false;
        }
        return path.startsWith(ancestorPath + SEPARATOR);
    }

    public static boolean isDescendant(String path, String ancestorPath) {
        return isAncestor(ancestorPath, path);
    }

    public static boolean isSelfOrDescendant(String path, String ancestorPath) {
        return path != null && (path.equals(ancestorPath) || isAncestor(ancestorPath, path));
    }

    /**
     * Strict ancestors of {@code path}, root first.
     */
    public static List<String> ancestorPaths(String path) {
        List<String> segments = segments(requireValid(path));
        List<String> ancestors = new ArrayList<>(segments.size() - 1);
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < segments.size() - 1; i++) {
            if (i > 0) {
                current.append(SEPARATOR);
            }
            current.append(segments.get(i));
            ancestors.add(current.toString());
        }
        return ancestors;
    }

    /**
     * Replaces the {@code oldPrefix} of a self-or-descendant path by {@code newPrefix}, keeping its suffix.
     */
    public static String rebase(String path, String oldPrefix, String newPrefix) {
        if (!isSelfOrDescendant(path, oldPrefix)) {
            throw new IllegalArgumentException("'%s' is not within '%s'".formatted(path, oldPrefix));
        }
        return newPrefix + path.substring(oldPrefix.length());
    }

    /**
     * SQL {@code LIKE} pattern matching strict descendants of {@code path}, escaped with {@link #LIKE_ESCAPE}.
     */
    public static String descendantPattern(String path) {
        requireValid(path);
        StringBuilder sb = new StringBuilder(path.length() + 3);
        for (char c : path.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.append(SEPARATOR).append('%').toString();
    }

    public static boolean isValidCode(String code) {
        return code != null
                && !code.isEmpty()
                && code.length() <= MAX_CODE_LENGTH
                && CODE_PATTERN.matcher(code).matches();
    }

    public static void validateCode(String code) {
        if (code == null || code.isBlank()) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_CODE", "node code must not be blank");
        }
        if (code.length() > MAX_CODE_LENGTH) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_CODE",
                    "node code must be at most %d characters".formatted(MAX_CODE_LENGTH));
        }
        if (!CODE_PATTERN.matcher(code).matches()) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_CODE",
                    "node code '%s' may only contain letters, digits and underscores".formatted(code));
        }
    }

    public static boolean isValid(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        for (String segment : path.split(Pattern.quote(SEPARATOR), -1)) {
            if (!isValidCode(segment)) {
                return false;
            }
        }
        return true;
    }

    public static String requireValid(String path) {
        if (!isValid(path)) {
            throw new ProblemException(ErrorKind.VALIDATION, "INVALID_PATH",
                    "'%s' is not a valid hierarchy path".formatted(path));
        }
        return path;
    }

    private static List<String> segments(String path) {
        return List.of(path.split(Pattern.quote(SEPARATOR), -1));
    }
}
