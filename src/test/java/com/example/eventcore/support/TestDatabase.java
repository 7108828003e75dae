package com.example.eventcore.support;

import java.util.UUID;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import com.example.eventcore.infra.event.codec.EventJsonCodec;

import tools.jackson.databind.json.JsonMapper;

/**
 * 不啟動 Spring 的測試用 H2 資料庫，每個實例使用獨立的 in-memory schema
 */
public final class TestDatabase {

	private final DriverManagerDataSource dataSource;
	private final JdbcTemplate jdbcTemplate;
	private final DataSourceTransactionManager transactionManager;
	private final EventJsonCodec codec = new EventJsonCodec(JsonMapper.builder().build());

	private TestDatabase(String name) {
		this.dataSource = new DriverManagerDataSource(
				"jdbc:h2:mem:" + name + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
				"sa", "");
		this.dataSource.setDriverClassName("org.h2.Driver");
		new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
		this.jdbcTemplate = new JdbcTemplate(dataSource);
		this.transactionManager = new DataSourceTransactionManager(dataSource);
	}

	public static TestDatabase create() {
		return new TestDatabase("test-" + UUID.randomUUID());
	}

	public JdbcTemplate jdbcTemplate() {
		return jdbcTemplate;
	}

	public DataSourceTransactionManager transactionManager() {
		return transactionManager;
	}

	public EventJsonCodec codec() {
		return codec;
	}

	public void shutdown() {
		jdbcTemplate.execute("SHUTDOWN");
	}
}
