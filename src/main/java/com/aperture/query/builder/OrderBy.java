package com.aperture.query.builder;

import java.util.Locale;
import java.util.Objects;

public class OrderBy {

    public enum Direction {
        ASC,
        DESC;

        public static Direction fromString(String value) {
            return value != null && value.trim().toUpperCase(Locale.ROOT).startsWith("DESC") ? DESC : ASC;
        }
    }

    private final String column;
    private final Direction direction;

    public OrderBy(String column, Direction direction) {
        this.column = Objects.requireNonNull(column, "column");
        this.direction = direction != null ? direction : Direction.ASC;
    }

    public static OrderBy asc(String column) {
        return new OrderBy(column, Direction.ASC);
    }

    public static OrderBy desc(String column) {
        return new OrderBy(column, Direction.DESC);
    }

    public String getColumn() {
        return column;
    }

    public Direction getDirection() {
        return direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderBy orderBy = (OrderBy) o;
        return column.equals(orderBy.column) && direction == orderBy.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, direction);
    }

    @Override
    public String toString() {
        return column + " " + direction;
    }
}
