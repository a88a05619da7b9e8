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

package com.soklet.accounts.service;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.soklet.accounts.CurrentContext;
import com.soklet.accounts.model.api.request.AccountRequest;
import com.soklet.accounts.model.db.Account;
import com.soklet.accounts.store.AccountStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Business logic for accounts.
 * <p>
 * Callers are expected to have validated requests already; this layer resolves defaults and talks to the {@link AccountStore}.
 */
@ThreadSafe
public class AccountService {
	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;
	@Nonnull
	private final AccountStore accountStore;
	@Nonnull
	private final Logger logger;

	@Inject
	public AccountService(@Nonnull Provider<CurrentContext> currentContextProvider,
												@Nonnull AccountStore accountStore) {
		requireNonNull(currentContextProvider);
		requireNonNull(accountStore);

		this.currentContextProvider = currentContextProvider;
		this.accountStore = accountStore;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public List<Account> findAccounts() {
		return getAccountStore().fetchAll();
	}

	@Nonnull
	public Optional<Account> findAccountById(@Nullable Long accountId) {
		if (accountId == null)
			return Optional.empty();

		return getAccountStore().fetchById(accountId);
	}

	@Nonnull
	public Account createAccount(@Nonnull AccountRequest request) {
		requireNonNull(request);

		// IDs are always issued by the store
		request = resolveDateJoined(request).withAccountId(null);

		Account account = getAccountStore().insert(request);

		getLogger().info("Created account ID {} for '{}', joined {}", account.accountId(), account.name(), account.dateJoined());

		return account;
	}

	@Nonnull
	public Optional<Account> updateAccount(@Nonnull Long accountId,
																				 @Nonnull AccountRequest request) {
		requireNonNull(accountId);
		requireNonNull(request);

		request = resolveDateJoined(request).withAccountId(accountId);

		Optional<Account> account = getAccountStore().update(accountId, request);

		if (account.isPresent())
			getLogger().info("Updated account ID {}", accountId);
		else
			getLogger().debug("Account ID {} disappeared before it could be updated", accountId);

		return account;
	}

	@Nonnull
	public Boolean deleteAccount(@Nonnull Long accountId) {
		requireNonNull(accountId);

		boolean deleted = getAccountStore().delete(accountId);

		if (deleted)
			getLogger().info("Deleted account ID {}", accountId);

		return deleted;
	}

	// A missing join date means "today" in whatever time zone the caller is in
	@Nonnull
	private AccountRequest resolveDateJoined(@Nonnull AccountRequest request) {
		requireNonNull(request);

		if (request.dateJoined() != null)
			return request;

		return request.withDateJoined(LocalDate.now(getCurrentContext().getTimeZone()));
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}

	@Nonnull
	private AccountStore getAccountStore() {
		return this.accountStore;
	}

	@Nonnull
	private Logger getLogger() {
		return this.logger;
	}
}
