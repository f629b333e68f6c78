package dk.cloudcreate.eventcore.eventstore.postgresql;

import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.TestDatabase;
import org.jdbi.v3.core.Jdbi;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

@Testcontainers
class PostgresqlEventStoreIT extends AbstractPostgresqlEventStoreTest {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = TestDatabase.createPostgreSQLContainer();

    @Override
    protected Jdbi createJdbi() {
        return TestDatabase.createJdbi(postgreSQLContainer);
    }
}
