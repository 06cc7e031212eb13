package org.querydump.manager;

public enum JdbcDrivers {
    MYSQL("com.mysql.cj.jdbc.Driver", "jdbc:mysql:"),
    SQLITE("org.sqlite.JDBC", "jdbc:sqlite:");

    private final String driverClass;
    private final String schemePrefix;

    JdbcDrivers(String driverClass, String schemePrefix) {
        this.driverClass = driverClass;
        this.schemePrefix = schemePrefix;
    }

    public String getDriverClass() {
        return driverClass;
    }

    public String getSchemePrefix() {
        return schemePrefix;
    }
}
