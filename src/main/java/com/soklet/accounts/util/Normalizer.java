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

package com.soklet.accounts.util;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utilities for normalizing user-supplied input.
 */
@ThreadSafe
public final class Normalizer {
	@Nonnull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@Nonnull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^[\\p{Z}\\s]+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("[\\p{Z}\\s]+$");
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 */
	@Nonnull
	public static Optional<String> trimAggressively(@Nullable String string) {
		if (string == null)
			return Optional.empty();

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return Optional.of(string);

		string = TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		return Optional.of(string);
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		String trimmed = trimAggressively(string).orElse(null);
		return trimmed == null || trimmed.length() == 0 ? null : trimmed;
	}

	@Nonnull
	public static Boolean isBlank(@Nullable String string) {
		return trimAggressivelyToNull(string) == null;
	}

	private Normalizer() {
		// Non-instantiable
	}
}
