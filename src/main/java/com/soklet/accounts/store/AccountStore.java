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

package com.soklet.accounts.store;

import com.soklet.accounts.model.api.request.AccountRequest;
import com.soklet.accounts.model.db.Account;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link Account} records, keyed by integer ID.
 * <p>
 * Unknown IDs are reported as absence ({@link Optional#empty()} or {@code false}), never by throwing.
 * Implementations must be threadsafe.
 */
public interface AccountStore {
	/**
	 * Persists a new record, ignoring any ID carried by the request.
	 *
	 * @param request the validated payload, whose {@code dateJoined} has already been resolved
	 * @return the stored record, including its newly-assigned ID
	 */
	@Nonnull
	Account insert(@Nonnull AccountRequest request);

	@Nonnull
	Optional<Account> fetchById(@Nonnull Long accountId);

	/**
	 * @return every record, in insertion order
	 */
	@Nonnull
	List<Account> fetchAll();

	/**
	 * Overwrites every mutable field of the record identified by {@code accountId}.
	 * The request's own {@code accountId} is not consulted.
	 */
	@Nonnull
	Optional<Account> update(@Nonnull Long accountId,
													 @Nonnull AccountRequest request);

	/**
	 * @return {@code true} if a record was deleted, {@code false} if none existed
	 */
	@Nonnull
	Boolean delete(@Nonnull Long accountId);
}
