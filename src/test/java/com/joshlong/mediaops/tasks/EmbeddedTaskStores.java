package com.joshlong.mediaops.tasks;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;

/**
 * task stores backed by a fresh in-memory H2 database migrated with the production script.
 */
abstract class EmbeddedTaskStores {

	static EmbeddedDatabase database() {
		return new EmbeddedDatabaseBuilder() //
			.setType(EmbeddedDatabaseType.H2) //
			.generateUniqueName(true) //
			.addScript("db/migration/V1__tasks.sql") //
			.build();
	}

	static JdbcTaskStore taskStore(EmbeddedDatabase database, Clock clock) {
		return new JdbcTaskStore(JdbcClient.create(database), clock);
	}

}
