package com.aperture.schema;

import java.sql.Types;

/**
 * Bind-parameter type tags of the columnar store.
 */
public enum DbType {
    STRING("String", Types.VARCHAR),
    INT64("Int64", Types.BIGINT),
    UINT32("UInt32", Types.BIGINT),
    FLOAT64("Float64", Types.DOUBLE),
    BOOL("Bool", Types.BOOLEAN),
    UUID("UUID", Types.VARCHAR),
    DATETIME64("DateTime64", Types.VARCHAR),
    ARRAY_STRING("Array(String)", Types.ARRAY),
    ARRAY_UUID("Array(UUID)", Types.ARRAY);

    private final String clickHouseName;
    private final int sqlType;

    DbType(String clickHouseName, int sqlType) {
        this.clickHouseName = clickHouseName;
        this.sqlType = sqlType;
    }

    public String getClickHouseName() {
        return clickHouseName;
    }

    /**
     * JDBC type code used when the value is bound through the driver.
     */
    public int getSqlType() {
        return sqlType;
    }

    public boolean isIntegral() {
        return this == INT64 || this == UINT32;
    }
}
