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

package com.soklet.accounts.model.api.request;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.LocalDate;

import static java.util.Objects.requireNonNull;

/**
 * A validated account payload, as accepted by create and update operations.
 * <p>
 * {@code accountId} is whatever the client sent (if anything); {@code dateJoined} is empty when the client omitted it.
 */
public record AccountRequest(
		@Nullable Long accountId,
		@Nonnull String name,
		@Nonnull String email,
		@Nonnull String address,
		@Nonnull String phoneNumber,
		@Nullable LocalDate dateJoined
) {
	public AccountRequest {
		requireNonNull(name);
		requireNonNull(email);
		requireNonNull(address);
		requireNonNull(phoneNumber);
	}

	@Nonnull
	public AccountRequest withAccountId(@Nullable Long accountId) {
		return new AccountRequest(accountId, name, email, address, phoneNumber, dateJoined);
	}

	@Nonnull
	public AccountRequest withDateJoined(@Nullable LocalDate dateJoined) {
		return new AccountRequest(accountId, name, email, address, phoneNumber, dateJoined);
	}
}
