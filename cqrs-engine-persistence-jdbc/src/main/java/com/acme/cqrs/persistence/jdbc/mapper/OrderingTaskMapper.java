package com.acme.cqrs.persistence.jdbc.mapper;

import static com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper.toInstant;
import static com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper.toTimestamp;

import com.acme.cqrs.ordering.OrderingState;
import com.acme.cqrs.ordering.OrderingTask;
import com.acme.cqrs.ordering.PipelineSignal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Maps between OrderingTask and rows of {@code ordering_task}.
 */
public class OrderingTaskMapper {

    public static final String COLUMNS = """
            pk, sk, version, state, callback_token, signal_type, signal_payload, error, deadline,
            created_at, updated_at
            """;

    private OrderingTaskMapper() {
    }

    public static OrderingTask map(ResultSet rs) throws SQLException {
        String signal = rs.getString("signal_type");
        return new OrderingTask(
                rs.getString("pk"),
                rs.getString("sk"),
                rs.getInt("version"),
                OrderingState.valueOf(rs.getString("state")),
                rs.getString("callback_token"),
                signal == null ? null : PipelineSignal.valueOf(signal),
                rs.getString("signal_payload"),
                rs.getString("error"),
                toInstant(rs.getTimestamp("deadline")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")));
    }

    /** Binds every column of {@link #COLUMNS}, in order, starting at parameter 1. */
    public static void bindInsert(PreparedStatement ps, OrderingTask task) throws SQLException {
        ps.setString(1, task.partitionKey());
        ps.setString(2, task.sortKey());
        ps.setInt(3, task.version());
        ps.setString(4, task.state().name());
        ps.setString(5, task.callbackToken());
        ps.setString(6, task.signal() == null ? null : task.signal().name());
        ps.setString(7, task.signalPayload());
        ps.setString(8, task.error());
        ps.setTimestamp(9, toTimestamp(task.deadline()));
        ps.setTimestamp(10, toTimestamp(task.createdAt()));
        ps.setTimestamp(11, toTimestamp(task.updatedAt()));
    }
}
