package org.querydump.manager;

import lombok.extern.log4j.Log4j2;
import org.querydump.cli.ToolOptions;

@Log4j2
public class ManagerFactory {

    /**
     * Instantiate a ConnManager that can connect to the database named by the source connect string.
     *
     * @param options the user-provided arguments
     * @return the manager for the source database
     */
    public ConnManager accept(ToolOptions options) {
        String connectString = options.getSourceConnect();
        if (connectString == null || connectString.isEmpty()) {
            throw new IllegalArgumentException("The source connect string is not defined");
        }

        if (connectString.startsWith(JdbcDrivers.MYSQL.getSchemePrefix())) {
            log.info("return MySQLManager");
            return new MySQLManager(options);
        } else {
            log.info("return StandardJDBCManager");
            return new StandardJDBCManager(options);
        }
    }
}
