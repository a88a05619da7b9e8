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

package com.soklet.accounts.model.api.response;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an exception that bubbled out of the system.
 * <p>
 * Serialized as {@code {"status": 400, "error": "Bad Request", "message": "...", "generalErrors": [], "fieldErrors": {}}}.
 */
@ThreadSafe
public class ErrorResponse {
	@Nonnull
	private final Integer status;
	@Nonnull
	private final String error;
	@Nonnull
	private final String message;
	@Nonnull
	private final List<String> generalErrors;
	@Nonnull
	private final Map<String, List<String>> fieldErrors;

	@Nonnull
	public static Builder withStatus(@Nonnull Integer status,
																	 @Nonnull String error) {
		requireNonNull(status);
		requireNonNull(error);

		return new Builder(status, error);
	}

	private ErrorResponse(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.status = requireNonNull(builder.status);
		this.error = requireNonNull(builder.error);
		this.message = builder.message == null ? builder.error : builder.message;
		this.generalErrors = builder.generalErrors == null ? List.of() : Collections.unmodifiableList(builder.generalErrors);
		this.fieldErrors = builder.fieldErrors == null ? Map.of() : Collections.unmodifiableMap(builder.fieldErrors);
	}

	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final Integer status;
		@Nonnull
		private final String error;
		@Nullable
		private String message;
		@Nullable
		private List<String> generalErrors;
		@Nullable
		private Map<String, List<String>> fieldErrors;

		private Builder(@Nonnull Integer status,
										@Nonnull String error) {
			requireNonNull(status);
			requireNonNull(error);

			this.status = status;
			this.error = error;
		}

		@Nonnull
		public Builder message(@Nullable String message) {
			this.message = message;
			return this;
		}

		@Nonnull
		public Builder generalErrors(@Nullable List<String> generalErrors) {
			this.generalErrors = generalErrors;
			return this;
		}

		@Nonnull
		public Builder fieldErrors(@Nullable Map<String, List<String>> fieldErrors) {
			this.fieldErrors = fieldErrors;
			return this;
		}

		@Nonnull
		public ErrorResponse build() {
			return new ErrorResponse(this);
		}
	}

	@Nonnull
	public Integer getStatus() {
		return this.status;
	}

	@Nonnull
	public String getError() {
		return this.error;
	}

	@Nonnull
	public String getMessage() {
		return this.message;
	}

	@Nonnull
	public List<String> getGeneralErrors() {
		return this.generalErrors;
	}

	@Nonnull
	public Map<String, List<String>> getFieldErrors() {
		return this.fieldErrors;
	}
}
