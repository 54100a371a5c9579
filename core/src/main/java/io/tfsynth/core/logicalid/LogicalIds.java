package io.tfsynth.core.logicalid;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives the stable identifiers that elements are keyed by in a synthesized document.
 *
 * <p>
 * For a path with at least two components after the root, the id is a readable part built from
 * the path plus an 8-character hash of the full path:
 *
 * <pre>
 * ["app", "stack", "resource"]          -> stack_resource_B9C9345B
 * ["app", "stack", "Default", "resource"] -> stack_resource_B9C9345B
 * ["app", "stack"]                      -> stack
 * </pre>
 *
 * The readable part drops {@code Default} and {@code Resource} components and adjacent
 * duplicates, keeps only {@code [A-Za-z0-9_-]} and is capped at {@value #MAX_HUMAN_LENGTH}
 * characters. A single component longer than {@value #MAX_ID_LENGTH} characters gets the hashed
 * form too. The hash covers the unsanitized components, so paths that sanitize alike still
 * get distinct ids.
 */
public final class LogicalIds {

    static final int MAX_HUMAN_LENGTH = 240;
    static final int MAX_ID_LENGTH = 255;
    static final int HASH_LENGTH = 8;

    private static final String HIDDEN_ID = "Default";
    private static final String HIDDEN_FROM_HUMAN_ID = "Resource";
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");

    private LogicalIds() {}

    /** Logical id for the node at {@code path}. Deterministic; never null. */
    public static String generateLogicalId(List<String> path) {
        if (path.isEmpty()) {
            return "";
        }
        if (path.size() == 1) {
            return sanitize(path.get(0));
        }
        List<String> components = new ArrayList<>();
        for (String component : path.subList(1, path.size())) {
            if (!HIDDEN_ID.equals(component)) {
                components.add(component);
            }
        }
        if (components.isEmpty()) {
            return "";
        }
        if (components.size() == 1) {
            String candidate = sanitize(components.get(0));
            if (candidate.length() <= MAX_ID_LENGTH) {
                return candidate;
            }
        }
        return humanPart(components) + "_" + hash(components);
    }

    /** Terraform address of an element: {@code type.id}. */
    public static String generateFqn(String type, String logicalId) {
        return type + "." + logicalId;
    }

    static String sanitize(String component) {
        return UNSAFE.matcher(component).replaceAll("");
    }

    private static String humanPart(List<String> components) {
        List<String> parts = new ArrayList<>();
        for (String component : removeDupes(components)) {
            if (!HIDDEN_FROM_HUMAN_ID.equals(component)) {
                parts.add(sanitize(component));
            }
        }
        String human = String.join("_", parts);
        return human.length() > MAX_HUMAN_LENGTH ? human.substring(0, MAX_HUMAN_LENGTH) : human;
    }

    // "Bucket" under "MyBucket" adds nothing to the readable part
    private static List<String> removeDupes(List<String> components) {
        List<String> result = new ArrayList<>();
        for (String component : components) {
            if (result.isEmpty() || !result.get(result.size() - 1).endsWith(component)) {
                result.add(component);
            }
        }
        return result;
    }

    private static String hash(List<String> components) {
        byte[] digest = md5().digest(String.join("/", components).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest, 0, HASH_LENGTH / 2).toUpperCase(Locale.ROOT);
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // MD5 is required by the Java platform.
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
