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

package com.soklet.accounts.resource;

import com.google.inject.Inject;
import com.lokalized.Strings;
import com.soklet.accounts.annotation.SuppressRequestLogging;
import com.soklet.annotation.GET;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Service discovery and liveness.
 */
@ThreadSafe
public class IndexResource {
	@Nonnull
	private final Strings strings;

	@Inject
	public IndexResource(@Nonnull Strings strings) {
		requireNonNull(strings);
		this.strings = strings;
	}

	@Nonnull
	@GET("/")
	public IndexResponse index() {
		return new IndexResponse(getStrings().get("Account REST API Service"), "1.0", "/accounts");
	}

	@Nonnull
	@SuppressRequestLogging
	@GET("/health")
	public HealthResponse health() {
		return new HealthResponse("OK");
	}

	public record IndexResponse(@Nonnull String name,
															@Nonnull String version,
															@Nonnull String url) {
		public IndexResponse {
			requireNonNull(name);
			requireNonNull(version);
			requireNonNull(url);
		}
	}

	public record HealthResponse(@Nonnull String status) {
		public HealthResponse {
			requireNonNull(status);
		}
	}

	@Nonnull
	private Strings getStrings() {
		return this.strings;
	}
}
