package taskapp.persistence.query;

import java.util.List;

/**
 * A resolved filter clause: one field, one operator, converted operand values.
 *
 * @param <T> domain aggregate type
 */
public record FilterCondition<T>(QueryField<T> field, Operator operator, List<Object> values) {

    public FilterCondition {
        values = List.copyOf(values);
    }

    /**
     * Supported comparison operators. On collection fields, equality means membership.
     */
    public enum Operator {
        EQ("$eq"),
        NE("$ne"),
        IN("$in"),
        NIN("$nin");

        private final String token;

        Operator(final String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        /**
         * @return {@code true} for the operators that take a list operand
         */
        public boolean takesList() {
            return this == IN || this == NIN;
        }

        /**
         * @return {@code true} for the operators that exclude matches of their operands
         */
        public boolean negated() {
            return this == NE || this == NIN;
        }

        static Operator fromToken(final String token) {
            for (Operator operator : values()) {
                if (operator.token.equals(token)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unsupported filter operator: " + token);
        }
    }
}
