package dk.cloudcreate.eventledger.eventstore.postgresql;

import dk.cloudcreate.eventledger.eventstore.persistence.CommittedDomainEvent;
import dk.cloudcreate.eventledger.eventstore.types.GlobalPosition;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;

final class CommittedDomainEventRowMapper implements RowMapper<CommittedDomainEvent> {
    static final CommittedDomainEventRowMapper INSTANCE = new CommittedDomainEventRowMapper();

    private CommittedDomainEventRowMapper() {
    }

    @Override
    public CommittedDomainEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return new CommittedDomainEvent(rs.getString("aggregate_id"),
                                        rs.getLong("aggregate_sequence_number"),
                                        GlobalPosition.of(rs.getLong("global_sequence_number")),
                                        rs.getString("data"),
                                        rs.getString("metadata"));
    }
}
