package os.db.lock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

class QueryRunner {

    public void execute(Connection connection, String... sqlStatements) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String sqlStatement : sqlStatements) {
                statement.execute(sqlStatement);
            }
        }
    }

    public <T> T selectOne(Connection connection, String sql, RowMapper<T> rowMapper, Object... params) throws SQLException {
        List<T> selection = selectAll(connection, sql, rowMapper, params);

        if (selection.isEmpty()) {
            return null;
        }

        if (selection.size() > 1) {
            throw new SQLException(String.format("Expected at most one row from '%s' but got %d", sql, selection.size()));
        }

        return selection.get(0);
    }

    public <T> List<T> selectAll(Connection connection, String sql, RowMapper<T> rowMapper, Object... params) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            int cnt = 0;

            if (params != null) {
                for (Object param : params) {
                    ps.setObject(++cnt, param);
                }
            }

            try (ResultSet rs = ps.executeQuery()) {
                List<T> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(rowMapper.map(rs));
                }
                return result;
            }
        }
    }

    public interface RowMapper<R> {
        R map(ResultSet rs) throws SQLException;
    }

}
