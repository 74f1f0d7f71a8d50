package com.reqminer.core.persistence;

import com.reqminer.core.config.MiningProperties;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * When a {@link DataSource} is available a {@link JdbcCheckpointStore} is created
 * and its table ensured. Otherwise snapshots go to a LangGraph4j in-memory saver,
 * which is suitable for development and testing but not durable across restarts.
 */
@Configuration
public class CheckpointStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreConfig.class);

    @Bean
    public SnapshotCodec snapshotCodec() {
        return new SnapshotCodec();
    }

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<DataSource> dataSource,
                                           SnapshotCodec codec,
                                           MiningProperties properties) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC checkpoint store (table {})", properties.getCheckpointTable());
            var store = new JdbcCheckpointStore(ds, codec, properties.getCheckpointTable());
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory checkpoint store (sessions will not survive restarts)");
        return new SaverCheckpointStore(new MemorySaver(), codec);
    }
}
