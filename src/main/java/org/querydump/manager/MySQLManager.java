package org.querydump.manager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.querydump.cli.ToolOptions;

import java.util.Properties;

public class MySQLManager extends SqlManager {

   private static final Logger LOG = LogManager.getLogger(MySQLManager.class.getName());
   private static final String YEAR_IS_DATE_TYPE = "yearIsDateType";

   public MySQLManager (ToolOptions opts) {
      super(opts);
   }

   @Override
   public String getDriverClass () {
      return JdbcDrivers.MYSQL.getDriverClass();
   }

   /**
    * Connector/J buffers the whole result set unless the fetch size is Integer.MIN_VALUE,
    * which switches it to row-by-row streaming.
    */
   @Override
   protected Integer getFetchSize () {
      LOG.debug("Streaming MySQL result set row by row");
      return Integer.MIN_VALUE;
   }

   /**
    * YEAR columns are read as SMALLINT numbers instead of dates, unless the user sets yearIsDateType.
    */
   @Override
   protected Properties getSourceConnectionParams () {
      Properties params = new Properties();
      Properties userParams = super.getSourceConnectionParams();
      if (userParams != null) {
         params.putAll(userParams);
      }
      if (!params.containsKey(YEAR_IS_DATE_TYPE)) {
         params.setProperty(YEAR_IS_DATE_TYPE, "false");
      }
      return params;
   }
}
