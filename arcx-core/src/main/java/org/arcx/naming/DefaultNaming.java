package org.arcx.naming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class DefaultNaming implements Naming {
    // 1자 접두어 + '_' + 8자리 해시 + 최대 접미사(_bi, _bu, _fn) 가 항상 들어가야 한다
    static final int MIN_LENGTH = 16;
    private static final int HASH_PART = 9;

    private final int maxLength;

    public DefaultNaming(int maxNameLength) {
        if (maxNameLength < MIN_LENGTH) {
            throw new IllegalArgumentException("maxNameLength must be at least " + MIN_LENGTH + ", got " + maxNameLength);
        }
        this.maxLength = maxNameLength;
    }

    @Override
    public String fkName(String table, String column, String referencedTable) {
        String base = "fk_" + norm(table) + "__" + norm(column) + "__" + norm(referencedTable);
        return clampWithHash(base);
    }

    @Override
    public String ixName(String table, String column) {
        return clampWithHash("ix_" + norm(table) + "__" + norm(column));
    }

    @Override
    public String triggerName(String table, String role) {
        return clampWithHash("trg_" + norm(table) + "__" + norm(role));
    }

    @Override
    public String prefixed(String prefix, String column) {
        // user supplied prefixes keep their case
        return clampWithHash(prefix + column);
    }

    @Override
    public String withSuffix(String name, String suffix) {
        String combined = name + suffix;
        if (combined.length() <= maxLength) return combined;
        int keep = maxLength - suffix.length() - HASH_PART;
        if (keep < 1) {
            throw new IllegalArgumentException("Suffix '" + suffix + "' does not fit in " + maxLength + " characters");
        }
        String hash = computeStableHash(combined);
        return name.substring(0, Math.min(keep, name.length())) + "_" + hash + suffix;
    }

    @Override
    public int maxLength() {
        return maxLength;
    }

    /**
     * Normalization rules:
     *  - null -> "null"
     *  - Disallowed characters ([^A-Za-z0-9_]) -> '_'
     *  - Consecutive '_' -> single '_'
     *  - Convert to lowercase
     *  - If the result is an empty string or all '_', it becomes 'x'
     */
    private String norm(String s) {
        if (s == null) return "null";
        String x = s.replaceAll("[^A-Za-z0-9_]", "_");
        x = x.replaceAll("_+", "_");
        x = x.toLowerCase();
        if (x.isEmpty() || x.chars().allMatch(ch -> ch == '_')) {
            return "x";
        }
        return x;
    }

    // If the length limit is exceeded, truncate to the form: [prefix] + '_' + [hex(hash)].
    private String clampWithHash(String name) {
        if (name.length() <= maxLength) return name;
        String hash = computeStableHash(name);
        int keep = maxLength - HASH_PART;
        return name.substring(0, keep) + "_" + hash;
    }

    /**
     * First 4 bytes of SHA-256 as 8 hex characters.
     */
    private String computeStableHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return String.format("%02x%02x%02x%02x", hash[0], hash[1], hash[2], hash[3]);
        } catch (NoSuchAlgorithmException e) {
            return Integer.toHexString(input.hashCode());
        }
    }
}
