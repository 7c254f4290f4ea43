package com.marketruns.common.table;

/**
 * Address of one wide-format column: {@code {segment}.{period}.{scope}.{field}}.
 *
 * @param segment segment (app) name, e.g. {@code chat_noavg}
 * @param period  column period index, 1-based and counted across the whole segment
 * @param scope   {@code player} or {@code group}
 * @param field   field name, e.g. {@code sold}
 */
public record ColumnKey(String segment, int period, Scope scope, String field) {

    public enum Scope {
        PLAYER("player"),
        GROUP("group");

        private final String prefix;

        Scope(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }

        public static Scope fromPrefix(String prefix) {
            for (Scope s : values()) {
                if (s.prefix.equals(prefix)) return s;
            }
            return null;
        }
    }

    public static ColumnKey player(String segment, int period, String field) {
        return new ColumnKey(segment, period, Scope.PLAYER, field);
    }

    public static ColumnKey group(String segment, int period, String field) {
        return new ColumnKey(segment, period, Scope.GROUP, field);
    }

    public String header() {
        return segment + "." + period + "." + scope.prefix() + "." + field;
    }
}
