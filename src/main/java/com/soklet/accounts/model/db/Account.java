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

package com.soklet.accounts.model.db;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.time.LocalDate;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code account} table in the database.
 */
public record Account(
		@Nonnull Long accountId,
		@Nonnull String name,
		@Nonnull String email,
		@Nonnull String address,
		@Nonnull String phoneNumber,
		@Nonnull LocalDate dateJoined,
		@Nonnull Instant createdAt
) {
	public Account {
		requireNonNull(accountId);
		requireNonNull(name);
		requireNonNull(email);
		requireNonNull(address);
		requireNonNull(phoneNumber);
		requireNonNull(dateJoined);
		requireNonNull(createdAt);
	}
}
