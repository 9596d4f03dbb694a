package com.maslen.favsync.config;

import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.service.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Refuses to start without a reachable task database. Hibernate manages the schema
 * via ddl-auto.
 */
@Slf4j
@Configuration
public class DatabaseInitializationConfig {

    private final DataSource dataSource;
    private final TaskStore taskStore;

    public DatabaseInitializationConfig(DataSource dataSource, TaskStore taskStore) {
        this.dataSource = dataSource;
        this.taskStore = taskStore;
    }

    @EventListener(ContextRefreshedEvent.class)
    public void initializeDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            log.info("Database connection established successfully ({})",
                    connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            log.error("Database connection failed: {}", e.getMessage());
            throw new IllegalStateException("Task database is not reachable", e);
        }
        Map<TaskStatus, Long> stats = taskStore.stats();
        log.info("Task table ready: {}", stats);
    }
}
