package fr.lapetina.veebot.domain.error;

import java.net.URI;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders an {@link ErrorKind} as a structured debug dump: the variant name followed by
 * the fields listed by {@link ErrorKind#debugFields()}. Nested errors and throwable causes
 * are expanded recursively.
 *
 * <p>The compact form is a single line meant for log events. The pretty form is indented
 * and meant for a code block in a chat message. Formatting never throws.
 */
public final class ErrorKindFormatter {

    private static final int MAX_DEPTH = 8;
    private static final String INDENT = "    ";
    private static final String UNAVAILABLE = "<unavailable>";

    private ErrorKindFormatter() {
    }

    public static String compact(ErrorKind kind) {
        return debug(kind, false);
    }

    public static String pretty(ErrorKind kind) {
        return debug(kind, true);
    }

    public static String debug(ErrorKind kind, boolean pretty) {
        StringBuilder out = new StringBuilder();
        new Writer(out, pretty).value(kind, 0);
        return out.toString();
    }

    private static final class Writer {

        private final StringBuilder out;
        private final boolean pretty;

        Writer(StringBuilder out, boolean pretty) {
            this.out = out;
            this.pretty = pretty;
        }

        void value(Object value, int depth) {
            if (value == null) {
                out.append("None");
            } else if (depth > MAX_DEPTH) {
                out.append("..");
            } else if (value instanceof CharSequence || value instanceof URI) {
                quote(value.toString());
            } else if (value instanceof Number || value instanceof Boolean || value instanceof Enum<?>) {
                out.append(value);
            } else if (value instanceof VeebotException error) {
                struct("VeebotException", List.of(
                        field("id", error.id()),
                        field("kind", error.kind())
                ), depth);
            } else if (value instanceof Throwable throwable) {
                throwable(throwable, depth);
            } else if (value instanceof ErrorKind kind) {
                kind(kind, depth);
            } else if (value instanceof IndexRange range) {
                struct("IndexRange", List.of(
                        field("start", range.start()),
                        field("end", range.end())
                ), depth);
            } else {
                quote(safeToString(value));
            }
        }

        private void kind(ErrorKind kind, int depth) {
            List<Map.Entry<String, Object>> fields = new ArrayList<>();
            try {
                for (ErrorKind.DebugField debugField : kind.debugFields()) {
                    fields.add(field(debugField.name(), debugField.value()));
                }
            } catch (RuntimeException e) {
                fields.add(field("fields", new Unavailable()));
            }
            struct(kind.getClass().getSimpleName(), fields, depth);
        }

        private void throwable(Throwable throwable, int depth) {
            List<Map.Entry<String, Object>> fields = new ArrayList<>();
            String message;
            try {
                message = throwable.getMessage();
            } catch (RuntimeException e) {
                message = UNAVAILABLE;
            }
            if (message != null) {
                fields.add(field("message", message));
            }
            Throwable cause = throwable.getCause();
            if (cause != null && cause != throwable) {
                fields.add(field("cause", cause));
            }
            String name = throwable.getClass().getSimpleName();
            struct(name.isEmpty() ? throwable.getClass().getName() : name, fields, depth);
        }

        private void struct(String name, List<Map.Entry<String, Object>> fields, int depth) {
            out.append(name);
            if (fields.isEmpty()) {
                return;
            }
            if (!pretty) {
                out.append(" { ");
                for (int i = 0; i < fields.size(); i++) {
                    if (i > 0) {
                        out.append(", ");
                    }
                    entry(fields.get(i), depth);
                }
                out.append(" }");
                return;
            }
            out.append(" {\n");
            for (Map.Entry<String, Object> field : fields) {
                indent(depth + 1);
                entry(field, depth);
                out.append(",\n");
            }
            indent(depth);
            out.append('}');
        }

        private void entry(Map.Entry<String, Object> field, int depth) {
            out.append(field.getKey()).append(": ");
            if (field.getValue() instanceof Unavailable) {
                out.append(UNAVAILABLE);
            } else {
                value(field.getValue(), depth + 1);
            }
        }

        private void indent(int depth) {
            out.append(INDENT.repeat(depth));
        }

        private void quote(String text) {
            out.append('"');
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    default -> {
                        if (c < 0x20 || c == 0x7f) {
                            out.append(String.format("\\u{%x}", (int) c));
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
            out.append('"');
        }

        private static String safeToString(Object value) {
            try {
                return String.valueOf(value);
            } catch (RuntimeException e) {
                return UNAVAILABLE;
            }
        }

        private static Map.Entry<String, Object> field(String name, Object value) {
            return new AbstractMap.SimpleImmutableEntry<>(name, value);
        }
    }

    /** Marker for a field whose value could not be read. */
    private static final class Unavailable {
    }
}
