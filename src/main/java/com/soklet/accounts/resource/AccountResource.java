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
import com.soklet.Response;
import com.soklet.accounts.exception.NotFoundException;
import com.soklet.accounts.model.api.request.AccountRequest;
import com.soklet.accounts.model.api.response.AccountResponse;
import com.soklet.accounts.model.db.Account;
import com.soklet.accounts.service.AccountService;
import com.soklet.accounts.util.AccountValidator;
import com.soklet.accounts.util.AccountValidator.AccountValidationResult;
import com.soklet.annotation.DELETE;
import com.soklet.annotation.GET;
import com.soklet.annotation.POST;
import com.soklet.annotation.PUT;
import com.soklet.annotation.PathParameter;
import com.soklet.annotation.RequestBody;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contains Account-related Resource Methods.
 * <p>
 * Request bodies arrive as raw JSON so that {@link AccountValidator} can report every problem at once,
 * and so that body/path ID checks can happen before the existence check on update.
 * Content type has already been verified by the time any of these methods run.
 */
@ThreadSafe
public class AccountResource {
	@Nonnull
	private final AccountService accountService;
	@Nonnull
	private final AccountValidator accountValidator;

	@Inject
	public AccountResource(@Nonnull AccountService accountService,
												 @Nonnull AccountValidator accountValidator) {
		requireNonNull(accountService);
		requireNonNull(accountValidator);

		this.accountService = accountService;
		this.accountValidator = accountValidator;
	}

	@Nonnull
	@POST("/accounts")
	public Response createAccount(@Nullable @RequestBody(optional = true) String requestBody) {
		// A missing body is reported by validation like any other problem
		AccountRequest request = getAccountValidator().requireValid(getAccountValidator().validate(requestBody));
		Account account = getAccountService().createAccount(request);

		return Response.withStatusCode(201)
				.headers(Map.of("Location", Set.of(format("/accounts/%d", account.accountId()))))
				.body(new AccountResponse(account))
				.build();
	}

	@Nonnull
	@GET("/accounts")
	public List<AccountResponse> findAccounts() {
		return getAccountService().findAccounts().stream()
				.map(account -> new AccountResponse(account))
				.collect(Collectors.toList());
	}

	@Nonnull
	@GET("/accounts/{accountId}")
	public AccountResponse findAccount(@Nonnull @PathParameter Long accountId) {
		requireNonNull(accountId);

		Account account = getAccountService().findAccountById(accountId).orElse(null);

		if (account == null)
			throw new NotFoundException(format("No account with ID %d", accountId));

		return new AccountResponse(account);
	}

	@Nonnull
	@PUT("/accounts/{accountId}")
	public AccountResponse updateAccount(@Nonnull @PathParameter Long accountId,
																			 @Nullable @RequestBody(optional = true) String requestBody) {
		requireNonNull(accountId);

		AccountValidationResult validationResult = getAccountValidator().validate(requestBody);

		// A body ID naming some other account is a client error, whether or not this one exists
		getAccountValidator().requireConsistentAccountId(accountId, validationResult);

		if (getAccountService().findAccountById(accountId).isEmpty())
			throw new NotFoundException(format("No account with ID %d", accountId));

		AccountRequest request = getAccountValidator().requireValid(validationResult);

		// Could have been deleted out from under us
		Account account = getAccountService().updateAccount(accountId, request).orElse(null);

		if (account == null)
			throw new NotFoundException(format("No account with ID %d", accountId));

		return new AccountResponse(account);
	}

	@DELETE("/accounts/{accountId}")
	public void deleteAccount(@Nonnull @PathParameter Long accountId) {
		requireNonNull(accountId);

		Account account = getAccountService().findAccountById(accountId).orElse(null);

		if (account == null)
			throw new NotFoundException(format("No account with ID %d", accountId));

		getAccountService().deleteAccount(accountId);
	}

	@Nonnull
	private AccountService getAccountService() {
		return this.accountService;
	}

	@Nonnull
	private AccountValidator getAccountValidator() {
		return this.accountValidator;
	}
}
