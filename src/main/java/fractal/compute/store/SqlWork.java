package fractal.compute.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work executed against a transactional connection.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection conn) throws SQLException;
}
