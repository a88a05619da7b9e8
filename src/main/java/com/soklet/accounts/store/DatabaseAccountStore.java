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

import com.google.inject.Inject;
import com.pyranid.Database;
import com.soklet.accounts.model.api.request.AccountRequest;
import com.soklet.accounts.model.db.Account;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * {@link AccountStore} backed by the relational {@code account} table.
 * <p>
 * IDs come from the {@code account_seq} sequence, so ordering by ID is insertion order.
 */
@ThreadSafe
public class DatabaseAccountStore implements AccountStore {
	@Nonnull
	private final Database database;

	@Inject
	public DatabaseAccountStore(@Nonnull Database database) {
		requireNonNull(database);
		this.database = database;
	}

	@Nonnull
	@Override
	public Account insert(@Nonnull AccountRequest request) {
		requireNonNull(request);
		LocalDate dateJoined = requireNonNull(request.dateJoined(), "Date joined must be resolved before insert");

		Long accountId = getDatabase().query("CALL NEXT VALUE FOR account_seq")
				.fetchObject(Long.class)
				.get();

		getDatabase().query("""
						INSERT INTO account (
							account_id,
							name,
							email,
							address,
							phone_number,
							date_joined
						) VALUES (:accountId, :name, :email, :address, :phoneNumber, :dateJoined)
						""")
				.bind("accountId", accountId)
				.bind("name", request.name())
				.bind("email", request.email())
				.bind("address", request.address())
				.bind("phoneNumber", request.phoneNumber())
				.bind("dateJoined", dateJoined)
				.execute();

		return fetchById(accountId).get();
	}

	@Nonnull
	@Override
	public Optional<Account> fetchById(@Nonnull Long accountId) {
		requireNonNull(accountId);

		return getDatabase().query("""
						SELECT *
						FROM account
						WHERE account_id=:accountId
						""")
				.bind("accountId", accountId)
				.fetchObject(Account.class);
	}

	@Nonnull
	@Override
	public List<Account> fetchAll() {
		return getDatabase().query("""
						SELECT *
						FROM account
						ORDER BY account_id
						""")
				.fetchList(Account.class);
	}

	@Nonnull
	@Override
	public Optional<Account> update(@Nonnull Long accountId,
																	@Nonnull AccountRequest request) {
		requireNonNull(accountId);
		requireNonNull(request);
		LocalDate dateJoined = requireNonNull(request.dateJoined(), "Date joined must be resolved before update");

		long updatedRowCount = getDatabase().query("""
						UPDATE account
						SET name=:name, email=:email, address=:address, phone_number=:phoneNumber, date_joined=:dateJoined
						WHERE account_id=:accountId
						""")
				.bind("name", request.name())
				.bind("email", request.email())
				.bind("address", request.address())
				.bind("phoneNumber", request.phoneNumber())
				.bind("dateJoined", dateJoined)
				.bind("accountId", accountId)
				.execute();

		if (updatedRowCount == 0)
			return Optional.empty();

		return fetchById(accountId);
	}

	@Nonnull
	@Override
	public Boolean delete(@Nonnull Long accountId) {
		requireNonNull(accountId);

		return getDatabase().query("DELETE FROM account WHERE account_id=:accountId")
				.bind("accountId", accountId)
				.execute() > 0;
	}

	@Nonnull
	private Database getDatabase() {
		return this.database;
	}
}
