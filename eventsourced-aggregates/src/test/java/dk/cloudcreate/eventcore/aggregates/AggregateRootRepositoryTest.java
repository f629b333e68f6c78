package dk.cloudcreate.eventcore.aggregates;

import dk.cloudcreate.eventcore.eventstore.postgresql.test_data.TestDatabase;
import org.jdbi.v3.core.Jdbi;

class AggregateRootRepositoryTest extends AbstractAggregateRootRepositoryTest {
    @Override
    protected Jdbi createJdbi() {
        return TestDatabase.createH2Jdbi();
    }
}
