package com.example.resilientdatasource.core.diagnostics;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/** Opens a single unpooled connection. */
@FunctionalInterface
public interface ConnectionOpener {

  ConnectionOpener DRIVER_MANAGER = DriverManager::getConnection;

  Connection open(final String jdbcUrl, final Properties properties) throws SQLException;
}
