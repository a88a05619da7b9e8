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

import com.google.gson.annotations.SerializedName;
import com.soklet.accounts.model.db.Account;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.time.LocalDate;

import static java.util.Objects.requireNonNull;

/**
 * Public-facing representation of an {@link Account}.
 */
@ThreadSafe
public class AccountResponse {
	@Nonnull
	@SerializedName("id")
	private final Long accountId;
	@Nonnull
	private final String name;
	@Nonnull
	private final String email;
	@Nonnull
	private final String address;
	@Nonnull
	@SerializedName("phone_number")
	private final String phoneNumber;
	@Nonnull
	@SerializedName("date_joined")
	private final LocalDate dateJoined;

	public AccountResponse(@Nonnull Account account) {
		requireNonNull(account);

		this.accountId = account.accountId();
		this.name = account.name();
		this.email = account.email();
		this.address = account.address();
		this.phoneNumber = account.phoneNumber();
		this.dateJoined = account.dateJoined();
	}

	@Nonnull
	public Long getAccountId() {
		return this.accountId;
	}

	@Nonnull
	public String getName() {
		return this.name;
	}

	@Nonnull
	public String getEmail() {
		return this.email;
	}

	@Nonnull
	public String getAddress() {
		return this.address;
	}

	@Nonnull
	public String getPhoneNumber() {
		return this.phoneNumber;
	}

	@Nonnull
	public LocalDate getDateJoined() {
		return this.dateJoined;
	}
}
