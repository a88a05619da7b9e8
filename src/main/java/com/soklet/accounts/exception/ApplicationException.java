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

package com.soklet.accounts.exception;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An application-specific exception which carries an HTTP status code along with general and field-specific
 * error messages, so it can be serialized for client consumption.
 * <p>
 * Field errors are keyed by the name of the field as it appears on the wire, e.g. {@code phone_number}.
 */
@NotThreadSafe
public class ApplicationException extends RuntimeException {
	@Nonnull
	private final Integer statusCode;
	@Nonnull
	private final List<String> generalErrors;
	@Nonnull
	private final Map<String, List<String>> fieldErrors;

	@Nonnull
	public static Builder withStatusCodeAndErrors(@Nonnull Integer statusCode,
																								@Nullable ErrorCollector errorCollector) {
		requireNonNull(statusCode);

		Builder builder = new Builder(statusCode);

		if (errorCollector != null) {
			builder.generalErrors(errorCollector.getGeneralErrors());
			builder.fieldErrors(errorCollector.getFieldErrors());
		}

		return builder;
	}

	@Nonnull
	public static Builder withStatusCodeAndGeneralError(@Nonnull Integer statusCode,
																											@Nonnull String generalError) {
		requireNonNull(statusCode);
		requireNonNull(generalError);

		return new Builder(statusCode).generalError(generalError);
	}

	private ApplicationException(@Nonnull String message,
															 @Nonnull Builder builder) {
		super(requireNonNull(message));
		requireNonNull(builder);

		this.statusCode = builder.statusCode;
		this.generalErrors = builder.generalErrors == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.generalErrors));
		this.fieldErrors = builder.fieldErrors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldErrors));
	}

	@NotThreadSafe
	public static class ErrorCollector {
		@Nonnull
		private final List<String> generalErrors;
		@Nonnull
		private final Map<String, List<String>> fieldErrors;

		public ErrorCollector() {
			this.generalErrors = new ArrayList<>();
			this.fieldErrors = new LinkedHashMap<>();
		}

		public void addGeneralError(@Nonnull String generalError) {
			requireNonNull(generalError);
			this.generalErrors.add(generalError);
		}

		public void addFieldError(@Nonnull String field,
															@Nonnull String error) {
			requireNonNull(field);
			requireNonNull(error);

			List<String> errors = this.fieldErrors.computeIfAbsent(field, ignored -> new ArrayList<>(4));

			if (!errors.contains(error))
				errors.add(error);
		}

		@Nonnull
		public Boolean hasErrors() {
			return this.generalErrors.size() > 0 || this.fieldErrors.size() > 0;
		}

		@Nonnull
		public Boolean hasFieldError(@Nonnull String field) {
			requireNonNull(field);
			return this.fieldErrors.containsKey(field);
		}

		@Nonnull
		public List<String> getGeneralErrors() {
			return Collections.unmodifiableList(this.generalErrors);
		}

		@Nonnull
		public Map<String, List<String>> getFieldErrors() {
			return Collections.unmodifiableMap(this.fieldErrors);
		}
	}

	@NotThreadSafe
	public static class Builder {
		@Nonnull
		private final Integer statusCode;
		@Nullable
		private List<String> generalErrors;
		@Nullable
		private Map<String, List<String>> fieldErrors;

		private Builder(@Nonnull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@Nonnull
		private Builder generalError(@Nullable String generalError) {
			this.generalErrors = generalError == null ? null : List.of(generalError);
			return this;
		}

		@Nonnull
		private Builder generalErrors(@Nullable List<String> generalErrors) {
			this.generalErrors = generalErrors;
			return this;
		}

		@Nonnull
		private Builder fieldErrors(@Nullable Map<String, List<String>> fieldErrors) {
			this.fieldErrors = fieldErrors;
			return this;
		}

		@Nonnull
		public ApplicationException build() {
			// Create an exception message by combining fields
			List<String> messageComponents = new ArrayList<>(3);
			messageComponents.add(format("Status %d", this.statusCode));

			if (this.generalErrors != null && this.generalErrors.size() > 0)
				messageComponents.add(format("General Errors: %s", this.generalErrors));

			if (this.fieldErrors != null && this.fieldErrors.size() > 0)
				messageComponents.add(format("Field Errors: %s", this.fieldErrors));

			String message = messageComponents.stream().collect(Collectors.joining(", "));

			return new ApplicationException(message, this);
		}
	}

	@Nonnull
	public Integer getStatusCode() {
		return this.statusCode;
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
