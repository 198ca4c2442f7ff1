package com.zzf.toolhost.mcp.gate;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 工具名 -> 访问类别. Lookup is by normalized name, then by the part after the last
 * server prefix separator ({@code server.tool}, {@code server__tool}).
 */
@Slf4j
public final class ToolClassificationTable {

    private static final Map<String, ToolAccessClass> BUILT_IN;

    static {
        Map<String, ToolAccessClass> defaults = new HashMap<>();
        for (String name : new String[]{"read_file", "list_files", "grep", "glob", "search_files",
                "read_multiple_files", "list_directory", "get_file_info", "search"}) {
            defaults.put(name, ToolAccessClass.READ);
        }
        for (String name : new String[]{"edit_file", "write_file", "create_file", "delete_file",
                "replace_in_file", "delete_snippet_from_file", "apply_patch", "move_file",
                "create_directory", "multiedit"}) {
            defaults.put(name, ToolAccessClass.WRITE);
        }
        for (String name : new String[]{"agent_run_shell_command", "run_shell_command", "run_command",
                "bash", "shell", "execute_command", "run_terminal_command"}) {
            defaults.put(name, ToolAccessClass.EXECUTE);
        }
        BUILT_IN = Collections.unmodifiableMap(defaults);
    }

    private final Map<String, ToolAccessClass> table;
    private final ToolAccessClass defaultClass;

    public ToolClassificationTable() {
        this(Collections.emptyMap(), ToolAccessClass.READ);
    }

    /**
     * @param overrides entries replacing or extending the built-in table
     * @param defaultClass class for names found nowhere
     */
    public ToolClassificationTable(Map<String, ToolAccessClass> overrides, ToolAccessClass defaultClass) {
        Map<String, ToolAccessClass> merged = new HashMap<>(BUILT_IN);
        if (overrides != null) {
            overrides.forEach((name, cls) -> {
                if (name != null && cls != null) {
                    merged.put(normalize(name), cls);
                }
            });
        }
        this.table = Collections.unmodifiableMap(merged);
        this.defaultClass = defaultClass == null ? ToolAccessClass.READ : defaultClass;
    }

    public ToolAccessClass classify(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            return defaultClass;
        }
        String normalized = normalize(toolName);
        ToolAccessClass direct = table.get(normalized);
        if (direct != null) {
            return direct;
        }
        String bare = stripServerPrefix(normalized);
        if (!bare.equals(normalized)) {
            ToolAccessClass prefixed = table.get(bare);
            if (prefixed != null) {
                return prefixed;
            }
        }
        return defaultClass;
    }

    public Map<String, ToolAccessClass> entries() {
        return table;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static String stripServerPrefix(String name) {
        int dunder = name.lastIndexOf("__");
        if (dunder >= 0 && dunder + 2 < name.length()) {
            return name.substring(dunder + 2);
        }
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && dot + 1 < name.length()) {
            return name.substring(dot + 1);
        }
        return name;
    }
}
