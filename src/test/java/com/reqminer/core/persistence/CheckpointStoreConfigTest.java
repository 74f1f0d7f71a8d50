package com.reqminer.core.persistence;

import com.reqminer.core.config.MiningProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CheckpointStoreConfigTest {

    private final CheckpointStoreConfig config = new CheckpointStoreConfig();

    @Test
    @DisplayName("uses the in-memory store without a DataSource")
    @SuppressWarnings("unchecked")
    void inMemoryByDefault() throws Exception {
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);

        var store = config.checkpointStore(provider, new SnapshotCodec(), new MiningProperties());

        assertInstanceOf(SaverCheckpointStore.class, store);
    }

    @Test
    @DisplayName("uses a JDBC store and ensures its table when a DataSource exists")
    @SuppressWarnings("unchecked")
    void jdbcWithDataSource() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        ObjectProvider<DataSource> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(dataSource);

        var store = config.checkpointStore(provider, new SnapshotCodec(), new MiningProperties());

        assertInstanceOf(JdbcCheckpointStore.class, store);
        assertEquals("jdbc table mining_checkpoints", store.describe());
        verify(statement).execute();
    }
}
