package org.querydump.manager;

import org.querydump.cli.ToolOptions;

import java.util.Properties;

/**
 * Generic JDBC manager for databases without specialized implementations.
 * Used as fallback when no database-specific manager is available.
 * The driver class may be given in 'source.connect.parameter.driver'; otherwise it is
 * looked up from the connect string, falling back to JDBC 4 driver auto-loading.
 */
public class StandardJDBCManager extends SqlManager {

   public StandardJDBCManager (ToolOptions opts) {
      super(opts);
   }

   @Override
   public String getDriverClass () {
      Properties params = this.options.getSourceConnectionParams();
      String driverClassName = params == null ? null : params.getProperty("driver");
      if (driverClassName != null && !driverClassName.isEmpty()) {
         return driverClassName;
      }
      for (JdbcDrivers driver : JdbcDrivers.values()) {
         if (this.options.getSourceConnect().startsWith(driver.getSchemePrefix())) {
            return driver.getDriverClass();
         }
      }
      return null;
   }
}
