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

import com.soklet.Request;
import org.slf4j.MDC;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of context: which request/time zone/locale/etc. is applied to the current thread of execution?
 * <p>
 * Contexts nest; running a context binds it for the duration of the call and restores whatever was bound before.
 */
@ThreadSafe
public final class CurrentContext {
	@Nonnull
	private static final ThreadLocal<CurrentContext> CURRENT_CONTEXT_HOLDER;

	static {
		CURRENT_CONTEXT_HOLDER = new ThreadLocal<>();
	}

	@Nonnull
	public static CurrentContext get() {
		CurrentContext currentContext = CURRENT_CONTEXT_HOLDER.get();

		if (currentContext == null)
			throw new IllegalStateException(format("No %s is bound to the current scope", CurrentContext.class.getSimpleName()));

		return currentContext;
	}

	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Locale locale;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private Request request;

		private Builder() {}

		@Nonnull
		public Builder locale(@Nullable Locale locale) {
			this.locale = locale;
			return this;
		}

		@Nonnull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@Nonnull
		public Builder request(@Nullable Request request) {
			this.request = request;
			return this;
		}

		@Nonnull
		public CurrentContext build() {
			return new CurrentContext(this);
		}
	}

	@Nonnull
	public static Builder with(@Nullable Locale locale,
														 @Nullable ZoneId timeZone) {
		return new Builder().locale(locale).timeZone(timeZone);
	}

	@Nonnull
	public static Builder withRequest(@Nullable Request request) {
		return new Builder().request(request);
	}

	@Nonnull
	private final Locale locale;
	@Nonnull
	private final ZoneId timeZone;
	@Nullable
	private final Request request;

	private CurrentContext(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.timeZone = builder.timeZone == null ? Configuration.getDefaultTimeZone() : builder.timeZone;
		this.locale = builder.locale == null ? Configuration.getDefaultLocale() : builder.locale;
		this.request = builder.request;
	}

	public void run(@Nonnull Runnable runnable) {
		requireNonNull(runnable);
		run(() -> {
			runnable.run();
			return null;
		});
	}

	@Nullable
	public <T> T run(@Nonnull Supplier<T> supplier) {
		requireNonNull(supplier);

		// Capture the previous binding and MDC value to restore them later
		CurrentContext previousCurrentContext = CURRENT_CONTEXT_HOLDER.get();
		String previousMdc = MDC.get("CURRENT_CONTEXT");

		CURRENT_CONTEXT_HOLDER.set(this);

		try {
			// Apply new logging context
			MDC.put("CURRENT_CONTEXT", determineLoggingDescription());
			return supplier.get();
		} finally {
			if (previousCurrentContext != null)
				CURRENT_CONTEXT_HOLDER.set(previousCurrentContext);
			else
				CURRENT_CONTEXT_HOLDER.remove();

			// Restore previous logging context (or clear if we were at the root)
			if (previousMdc != null)
				MDC.put("CURRENT_CONTEXT", previousMdc);
			else
				MDC.remove("CURRENT_CONTEXT");
		}
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", format("%s{", CurrentContext.class.getSimpleName()), "}");

		joiner.add(format("locale=%s", getLocale().toLanguageTag()));
		joiner.add(format("timeZone=%s", getTimeZone().getId()));

		getRequest().ifPresent(request -> joiner.add(format("request=%s %s", request.getHttpMethod().name(), request.getRawPath())));

		return joiner.toString();
	}

	@Nonnull
	public Optional<Request> getRequest() {
		return Optional.ofNullable(this.request);
	}

	@Nonnull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@Nonnull
	public Locale getLocale() {
		return this.locale;
	}

	@Nonnull
	private String determineLoggingDescription() {
		Request request = this.getRequest().orElse(null);
		return request == null ? "background thread" : request.getId().toString();
	}
}
