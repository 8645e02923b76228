package org.arcx.naming;

import java.util.Locale;

/**
 * Minimal English singularization for table names ({@code employees -> employee}).
 */
public final class Inflector {

    private Inflector() {}

    public static String singularize(String tableName) {
        if (tableName == null || tableName.isBlank()) return tableName;
        String name = tableName.trim();
        // 스키마 접두어 제거 (hr.employees -> employees)
        int dot = name.lastIndexOf('.');
        if (dot >= 0) name = name.substring(dot + 1);

        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ies") && name.length() > 3) {
            return name.substring(0, name.length() - 3) + (Character.isUpperCase(name.charAt(name.length() - 1)) ? "Y" : "y");
        }
        if (lower.endsWith("sses") || lower.endsWith("xes") || lower.endsWith("ches") || lower.endsWith("shes")) {
            return name.substring(0, name.length() - 2);
        }
        if (lower.endsWith("ss") || lower.endsWith("us") || lower.endsWith("is")) {
            return name;
        }
        if (lower.endsWith("s") && name.length() > 1) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }
}
