package com.zzf.toolhost.mcp.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves {@code ${VAR}} and {@code $VAR} placeholders against an environment lookup.
 * Unresolved variables are replaced with the empty string.
 */
public final class EnvTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private EnvTemplates() {
    }

    public static String resolve(String template, Function<String, String> env) {
        if (template == null || template.indexOf('$') < 0) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String value = env.apply(name);
            m.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        m.appendTail(out);
        return out.toString();
    }

    public static Map<String, String> resolveValues(Map<String, String> values, Function<String, String> env) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            String value = entry.getValue();
            out.put(entry.getKey(), value == null ? "" : resolve(value, env));
        }
        return Collections.unmodifiableMap(out);
    }

    public static List<String> resolveAll(List<String> values, Function<String, String> env) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        return values.stream().map(v -> v == null ? "" : resolve(v, env)).collect(Collectors.toUnmodifiableList());
    }
}
