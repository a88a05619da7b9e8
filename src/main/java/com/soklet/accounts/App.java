/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.soklet.accounts;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.pyranid.Database;
import com.soklet.ShutdownTrigger;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the entire system in a single reusable type.
 */
@ThreadSafe
public class App {
	public static void main(String[] args) throws Exception {
		String environment = System.getenv("ACCOUNTS_ENVIRONMENT");

		if (environment == null)
			throw new IllegalArgumentException("You must specify the ACCOUNTS_ENVIRONMENT environment variable");

		App app = new App(new Configuration(environment));
		app.startServer();
	}

	@Nonnull
	private final Configuration configuration;
	@Nonnull
	private final Injector injector;
	@Nonnull
	private final Logger logger;

	public App(@Nonnull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a different AccountStore
		Module module = new AppModule(configuration);

		if (testingModules != null && testingModules.length > 0)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);

		initializeDatabase();
	}

	public void startServer() throws InterruptedException {
		SokletConfig config = getInjector().getInstance(SokletConfig.class);

		try (Soklet soklet = Soklet.fromConfig(config)) {
			soklet.start();

			if (getConfiguration().getStopOnKeypress()) {
				getLogger().debug("Press [enter] to exit");
				soklet.awaitShutdown(ShutdownTrigger.ENTER_KEY);
			} else {
				soklet.awaitShutdown();
			}
		}
	}

	// The schema lives with the app; there is no migration tooling
	private void initializeDatabase() {
		Database database = getInjector().getInstance(Database.class);

		database.query("CREATE SEQUENCE account_seq AS BIGINT START WITH 1").execute();

		database.query("""
				CREATE TABLE account (
					account_id BIGINT PRIMARY KEY,
					name VARCHAR(64) NOT NULL,
					email VARCHAR(64) NOT NULL,
					address VARCHAR(256) NOT NULL,
					phone_number VARCHAR(32) NOT NULL,
					date_joined DATE NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL
				)
				""").execute();

		getLogger().debug("Initialized account schema");
	}

	@Nonnull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@Nonnull
	public Injector getInjector() {
		return this.injector;
	}

	@Nonnull
	private Logger getLogger() {
		return this.logger;
	}
}
