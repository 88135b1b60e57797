package com.jzon.cursor;

import com.jzon.json.JsonType;

import java.util.regex.Pattern;

/**
 * Reads cursors written in a jq-like syntax, the same one {@link JsonCursor#toString()} produces:
 * <pre>
 *   .                                  identity
 *   .name  ."any name"                 field
 *   .[1]  [1]                          element
 *   objects arrays strings numbers booleans nulls    type filter
 *   .a.b[1] | arrays | .[0]            steps chained directly or with pipes
 * </pre>
 */
public class CursorParser {
    private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$-]*");

    public JsonCursor parse(String cursorString) {
        if (cursorString == null || cursorString.isBlank()) {
            return JsonCursor.identity();
        }

        String trimmed = cursorString.trim();

        int pipeIndex = findTopLevelPipe(trimmed);
        if (pipeIndex != -1) {
            JsonCursor left = parse(trimmed.substring(0, pipeIndex));
            JsonCursor right = parse(trimmed.substring(pipeIndex + 1));
            return left.andThen(right);
        }

        if (trimmed.equals(".")) {
            return JsonCursor.identity();
        }

        if (trimmed.startsWith(".") || trimmed.startsWith("[")) {
            return parsePath(trimmed);
        }

        try {
            return JsonCursor.filter(JsonType.fromFilterName(trimmed));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported cursor: " + cursorString, e);
        }
    }

    private JsonCursor parsePath(String path) {
        JsonCursor cursor = JsonCursor.identity();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '[') {
                int close = path.indexOf(']', i);
                if (close == -1) {
                    throw new IllegalArgumentException("Unclosed '[' in: " + path);
                }
                cursor = cursor.downElement(parseIndex(path.substring(i + 1, close)));
                i = close + 1;
            } else if (c == '.') {
                i++;
                if (i >= path.length() || path.charAt(i) == '[') {
                    continue;
                }
                if (path.charAt(i) == '"') {
                    StringBuilder name = new StringBuilder();
                    i = readQuoted(path, i + 1, name);
                    cursor = cursor.downField(name.toString());
                } else {
                    int start = i;
                    while (i < path.length() && path.charAt(i) != '.' && path.charAt(i) != '[') {
                        i++;
                    }
                    cursor = cursor.downField(path.substring(start, i));
                }
            } else {
                throw new IllegalArgumentException("Unexpected '" + c + "' at " + i + " in: " + path);
            }
        }
        return cursor;
    }

    private int parseIndex(String indexStr) {
        try {
            return Integer.parseInt(indexStr.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array index: " + indexStr);
        }
    }

    /**
     * @return the position just past the closing quote
     */
    private int readQuoted(String path, int from, StringBuilder out) {
        int i = from;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '\\' && i + 1 < path.length()) {
                out.append(path.charAt(i + 1));
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        throw new IllegalArgumentException("Unterminated field name in: " + path);
    }

    /**
     * Find the index of a pipe character that's not inside a quoted field name
     */
    private int findTopLevelPipe(String cursor) {
        boolean quoted = false;
        for (int i = 0; i < cursor.length(); i++) {
            char c = cursor.charAt(i);
            if (c == '\\' && quoted) {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == '|' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    static String renderField(String name) {
        if (SIMPLE_NAME.matcher(name).matches()) {
            return "." + name;
        }
        return ".\"" + name.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
