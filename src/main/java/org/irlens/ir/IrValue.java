package org.irlens.ir;

import java.util.Objects;

/**
 * Small, typed value system carried by {@link IrNode.Leaf} nodes. Each variant knows its
 * kind name (used for kind mismatches) and its literal spelling in rendered text.
 */
public sealed interface IrValue permits IrValue.Int64, IrValue.Float64, IrValue.Str, IrValue.Bool, IrValue.Handle {

    /**
     * @return The name of this value's kind, e.g. {@code int} or {@code str}.
     */
    String kindName();

    /**
     * @return The literal form of this value as it appears in rendered text.
     */
    String literal();

    /**
     * Represents a 64-bit integer value.
     * @param value The long value.
     */
    record Int64(long value) implements IrValue {
        @Override
        public String kindName() {
            return "int";
        }

        @Override
        public String literal() {
            return Long.toString(value);
        }
    }

    /**
     * Represents a double precision floating point value.
     * @param value The double value.
     */
    record Float64(double value) implements IrValue {
        @Override
        public String kindName() {
            return "float";
        }

        @Override
        public String literal() {
            if (Double.isNaN(value)) return "T.float64(\"nan\")";
            if (Double.isInfinite(value)) return value > 0 ? "T.float64(\"inf\")" : "T.float64(\"-inf\")";
            return Double.toString(value);
        }
    }

    /**
     * Represents a string value.
     * @param value The string value.
     */
    record Str(String value) implements IrValue {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String kindName() {
            return "str";
        }

        @Override
        public String literal() {
            StringBuilder sb = new StringBuilder("\"");
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\t' -> sb.append("\\t");
                    case '\r' -> sb.append("\\r");
                    default -> {
                        if (c < 0x20 || c == 0x7f) {
                            sb.append(String.format("\\x%02x", (int) c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
            return sb.append('"').toString();
        }
    }

    /**
     * Represents a boolean value.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements IrValue {
        @Override
        public String kindName() {
            return "bool";
        }

        @Override
        public String literal() {
            return value ? "True" : "False";
        }
    }

    /**
     * Represents an opaque handle. Two handles are equal when both type tag and id match.
     * @param type A free-form type tag, e.g. {@code "stream"}.
     * @param id The handle's numeric identity.
     */
    record Handle(String type, long id) implements IrValue {
        public Handle {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String kindName() {
            return "handle";
        }

        @Override
        public String literal() {
            return "T.handle(\"" + type + "\", " + id + ")";
        }
    }
}
