package com.purchasingpower.codegraph.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives dotted module and package paths from repository-relative file paths.
 *
 * <pre>
 * pkg/base.py                        -> module pkg.base,  package pkg
 * pkg/__init__.py                    -> module pkg,       package pkg
 * src/main/java/com/acme/Foo.java    -> module com.acme.Foo, package com.acme
 * </pre>
 */
public final class ModulePaths {

    private static final List<String> JAVA_SOURCE_ROOTS = List.of("src/main/java/", "src/test/java/");
    private static final String INIT_MODULE = "__init__";

    private ModulePaths() {
    }

    public static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    public static String moduleOf(String relativePath) {
        return String.join(".", moduleSegments(relativePath));
    }

    public static String packageOf(String relativePath) {
        List<String> segments = moduleSegments(relativePath);
        if (isInitFile(relativePath)) {
            return String.join(".", segments);
        }
        if (segments.size() <= 1) {
            return "";
        }
        return String.join(".", segments.subList(0, segments.size() - 1));
    }

    /**
     * Every dotted prefix of a package, outermost first: a.b.c -> [a, a.b, a.b.c].
     */
    public static List<String> packagePrefixes(String packageName) {
        List<String> prefixes = new ArrayList<>();
        if (packageName == null || packageName.isBlank()) {
            return prefixes;
        }
        String[] parts = packageName.split("\\.");
        StringBuilder current = new StringBuilder();
        for (String part : parts) {
            if (current.length() > 0) {
                current.append('.');
            }
            current.append(part);
            prefixes.add(current.toString());
        }
        return prefixes;
    }

    /**
     * Parent of a dotted package, or null for a top-level package.
     */
    public static String parentPackage(String packageName) {
        int idx = packageName.lastIndexOf('.');
        return idx < 0 ? null : packageName.substring(0, idx);
    }

    private static boolean isInitFile(String relativePath) {
        String normalized = normalize(relativePath);
        return normalized.endsWith("/" + INIT_MODULE + ".py") || normalized.equals(INIT_MODULE + ".py");
    }

    private static List<String> moduleSegments(String relativePath) {
        String normalized = normalize(relativePath);
        for (String root : JAVA_SOURCE_ROOTS) {
            int idx = normalized.indexOf(root);
            if (idx >= 0) {
                normalized = normalized.substring(idx + root.length());
                break;
            }
        }
        int dot = normalized.lastIndexOf('.');
        int slash = normalized.lastIndexOf('/');
        if (dot > slash) {
            normalized = normalized.substring(0, dot);
        }
        List<String> segments = new ArrayList<>(Arrays.asList(normalized.split("/")));
        segments.removeIf(String::isEmpty);
        if (!segments.isEmpty() && segments.get(segments.size() - 1).equals(INIT_MODULE)) {
            segments.remove(segments.size() - 1);
        }
        return segments;
    }
}
