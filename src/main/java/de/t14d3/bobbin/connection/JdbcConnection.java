package de.t14d3.bobbin.connection;

import de.t14d3.bobbin.exceptions.OrmException;
import de.t14d3.bobbin.query.Dialect;
import de.t14d3.bobbin.query.Grammar;
import de.t14d3.bobbin.query.Processor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link DatabaseConnection} over a single JDBC connection.
 * <p>
 * Executes parameterized statements, maps result sets to column-to-value rows and
 * reads generated keys for inserts. The dialect, and with it the grammar, is detected
 * from the driver's product name.
 */
public class JdbcConnection implements DatabaseConnection {
    private static final Logger log = LoggerFactory.getLogger(JdbcConnection.class);

    private final Connection connection;
    private final Grammar grammar;
    private final Processor processor;
    private String name;

    public JdbcConnection(Connection connection) {
        this(connection, detectDialect(connection));
    }

    public JdbcConnection(Connection connection, Dialect dialect) {
        this.connection = connection;
        this.grammar = new Grammar(dialect);
        this.processor = new Processor();
    }

    /**
     * Open a connection for the given JDBC URL.
     */
    public static JdbcConnection open(String jdbcUrl) {
        try {
            return new JdbcConnection(DriverManager.getConnection(jdbcUrl), Dialect.detectFromUrl(jdbcUrl));
        } catch (SQLException e) {
            throw new OrmException("Failed to open database connection for " + jdbcUrl, e);
        }
    }

    private static Dialect detectDialect(Connection connection) {
        try {
            return Dialect.detectFromProductName(connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            log.warn("Could not read database metadata, falling back to the generic dialect", e);
            return Dialect.GENERIC;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(String name) {
        this.name = name;
    }

    @Override
    public Grammar getQueryGrammar() {
        return grammar;
    }

    @Override
    public Processor getPostProcessor() {
        return processor;
    }

    public Connection getJdbcConnection() {
        return connection;
    }

    @Override
    public List<Map<String, Object>> select(String sql, List<Object> bindings) {
        log.debug("select: {} {}", sql, bindings);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, bindings);
            try (ResultSet rs = stmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int count = meta.getColumnCount();
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= count; i++) {
                        row.put(meta.getColumnLabel(i), rs.getObject(i));
                    }
                    rows.add(row);
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new OrmException("Failed to execute SELECT: " + sql + " params=" + bindings, e);
        }
    }

    @Override
    public boolean insert(String sql, List<Object> bindings) {
        return update(sql, bindings) > 0;
    }

    @Override
    public Object insertGetId(String sql, List<Object> bindings) {
        log.debug("insert: {} {}", sql, bindings);
        try (PreparedStatement stmt = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            setParameters(stmt, bindings);
            stmt.executeUpdate();

            try (ResultSet rs = stmt.getGeneratedKeys()) {
                if (rs.next()) {
                    return rs.getObject(1);
                }
            }
            return null;
        } catch (SQLException e) {
            throw new OrmException("Failed to execute INSERT: " + sql + " params=" + bindings, e);
        }
    }

    @Override
    public int update(String sql, List<Object> bindings) {
        log.debug("update: {} {}", sql, bindings);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, bindings);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new OrmException("Failed to execute statement: " + sql + " params=" + bindings, e);
        }
    }

    @Override
    public int delete(String sql, List<Object> bindings) {
        return update(sql, bindings);
    }

    @Override
    public void statement(String sql, List<Object> bindings) {
        log.debug("statement: {} {}", sql, bindings);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            setParameters(stmt, bindings);
            stmt.execute();
        } catch (SQLException e) {
            throw new OrmException("Failed to execute SQL: " + sql + " params=" + bindings, e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection {}", name, e);
        }
    }

    /**
     * Bind parameters with simple type handling.
     */
    static void setParameters(PreparedStatement stmt, List<Object> params) throws SQLException {
        if (params == null || params.isEmpty()) return;

        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int idx = i + 1;

            if (p == null) {
                stmt.setNull(idx, Types.NULL);
            } else if (p instanceof String s) {
                stmt.setString(idx, s);
            } else if (p instanceof Integer integer) {
                stmt.setInt(idx, integer);
            } else if (p instanceof Long l) {
                stmt.setLong(idx, l);
            } else if (p instanceof Boolean b) {
                stmt.setBoolean(idx, b);
            } else if (p instanceof Double d) {
                stmt.setDouble(idx, d);
            } else if (p instanceof java.sql.Date date) {
                stmt.setDate(idx, date);
            } else if (p instanceof Time time) {
                stmt.setTime(idx, time);
            } else if (p instanceof Timestamp timestamp) {
                stmt.setTimestamp(idx, timestamp);
            } else if (p instanceof Date date) {
                stmt.setTimestamp(idx, new Timestamp(date.getTime()));
            } else if (p instanceof LocalDate localDate) {
                stmt.setDate(idx, java.sql.Date.valueOf(localDate));
            } else if (p instanceof LocalDateTime localDateTime) {
                stmt.setTimestamp(idx, Timestamp.valueOf(localDateTime));
            } else if (p instanceof UUID uuid) {
                stmt.setString(idx, uuid.toString());
            } else if (p instanceof Enum<?> anEnum) {
                stmt.setString(idx, anEnum.name());
            } else {
                // fallback - let JDBC try to handle it
                stmt.setObject(idx, p);
            }
        }
    }

    @Override
    public String toString() {
        return "JdbcConnection{name=" + name + ", grammar=" + grammar + "}";
    }
}
