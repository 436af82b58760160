package br.com.maike.ledger.testutil;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.sqlite.SQLiteDataSource;

/**
 * File-backed SQLite database initialized from classpath scripts under {@code db/}.
 */
public final class SqliteDatabase {
  private final SQLiteDataSource dataSource;
  private final String url;

  private SqliteDatabase(Path file) {
    this.url = "jdbc:sqlite:" + file.toAbsolutePath();
    this.dataSource = new SQLiteDataSource();
    this.dataSource.setUrl(url);
  }

  /**
   * Creates the database file and runs the given scripts in order.
   *
   * @param file database file, usually inside a {@code @TempDir}
   * @param scripts classpath resource names such as {@code db/ledger-sqlite.sql}
   * @return initialized database
   */
  public static SqliteDatabase create(Path file, String... scripts) {
    SqliteDatabase database = new SqliteDatabase(file);
    for (String script : scripts) {
      database.runScript(script);
    }
    return database;
  }

  public DataSource dataSource() {
    return dataSource;
  }

  public String url() {
    return url;
  }

  /** Executes one statement outside the code under test. */
  public void execute(String sql) {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (SQLException ex) {
      throw new IllegalStateException("statement failed: " + sql, ex);
    }
  }

  private void runScript(String resource) {
    String text;
    try (InputStream in = SqliteDatabase.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("missing test resource " + resource);
      }
      text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    for (String statement : text.split(";")) {
      String sql = stripComments(statement).trim();
      if (!sql.isEmpty()) {
        execute(sql);
      }
    }
  }

  private static String stripComments(String statement) {
    StringBuilder kept = new StringBuilder();
    for (String line : statement.split("\n")) {
      if (!line.trim().startsWith("--")) {
        kept.append(line).append('\n');
      }
    }
    return kept.toString();
  }
}
