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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.inject.Inject;
import com.lokalized.Strings;
import com.soklet.accounts.exception.ApplicationException;
import com.soklet.accounts.exception.ApplicationException.ErrorCollector;
import com.soklet.accounts.model.api.request.AccountRequest;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static com.soklet.accounts.util.Normalizer.isBlank;
import static java.util.Objects.requireNonNull;

/**
 * Decodes raw JSON request bodies into {@link AccountRequest} instances.
 * <p>
 * Decoding never throws for bad input: it yields an {@link AccountValidationResult} which is either
 * {@link AccountValidationResult.Valid} or {@link AccountValidationResult.Invalid}, the latter carrying every problem found.
 * Callers decide which problems to surface and when.
 */
@ThreadSafe
public class AccountValidator {
	@Nonnull
	public static final String ID_FIELD;
	@Nonnull
	public static final String NAME_FIELD;
	@Nonnull
	public static final String EMAIL_FIELD;
	@Nonnull
	public static final String ADDRESS_FIELD;
	@Nonnull
	public static final String PHONE_NUMBER_FIELD;
	@Nonnull
	public static final String DATE_JOINED_FIELD;
	@Nonnull
	private static final Map<String, Integer> MAXIMUM_LENGTHS_BY_TEXT_FIELD;

	static {
		ID_FIELD = "id";
		NAME_FIELD = "name";
		EMAIL_FIELD = "email";
		ADDRESS_FIELD = "address";
		PHONE_NUMBER_FIELD = "phone_number";
		DATE_JOINED_FIELD = "date_joined";

		// Matches the column widths of the account table
		Map<String, Integer> maximumLengthsByTextField = new LinkedHashMap<>();
		maximumLengthsByTextField.put(NAME_FIELD, 64);
		maximumLengthsByTextField.put(EMAIL_FIELD, 64);
		maximumLengthsByTextField.put(ADDRESS_FIELD, 256);
		maximumLengthsByTextField.put(PHONE_NUMBER_FIELD, 32);

		MAXIMUM_LENGTHS_BY_TEXT_FIELD = Collections.unmodifiableMap(maximumLengthsByTextField);
	}

	@Nonnull
	private final Strings strings;
	@Nonnull
	private final Gson gson;

	@Inject
	public AccountValidator(@Nonnull Strings strings,
													@Nonnull Gson gson) {
		requireNonNull(strings);
		requireNonNull(gson);

		this.strings = strings;
		this.gson = gson;
	}

	public sealed interface AccountValidationResult {
		/**
		 * The body decoded cleanly.
		 */
		record Valid(@Nonnull AccountRequest accountRequest) implements AccountValidationResult {
			public Valid {
				requireNonNull(accountRequest);
			}
		}

		/**
		 * The body had problems. {@code accountId} is the body's ID if that much could be decoded.
		 */
		record Invalid(@Nullable Long accountId,
									 @Nonnull ErrorCollector errorCollector) implements AccountValidationResult {
			public Invalid {
				requireNonNull(errorCollector);
			}
		}
	}

	@Nonnull
	public AccountValidationResult validate(@Nullable String requestBody) {
		ErrorCollector errorCollector = new ErrorCollector();

		if (isBlank(requestBody)) {
			errorCollector.addGeneralError(getStrings().get("A request body is required."));
			return new AccountValidationResult.Invalid(null, errorCollector);
		}

		JsonObject jsonObject = parseJsonObject(requestBody);

		if (jsonObject == null) {
			errorCollector.addGeneralError(getStrings().get("The request body must be a JSON object."));
			return new AccountValidationResult.Invalid(null, errorCollector);
		}

		Long accountId = extractAccountId(jsonObject, errorCollector);
		String name = extractText(jsonObject, NAME_FIELD, errorCollector);
		String email = extractText(jsonObject, EMAIL_FIELD, errorCollector);
		String address = extractText(jsonObject, ADDRESS_FIELD, errorCollector);
		String phoneNumber = extractText(jsonObject, PHONE_NUMBER_FIELD, errorCollector);
		LocalDate dateJoined = extractDateJoined(jsonObject, errorCollector);

		if (name != null && isBlank(name))
			errorCollector.addFieldError(NAME_FIELD, getStrings().get("Name cannot be blank."));

		if (errorCollector.hasErrors())
			return new AccountValidationResult.Invalid(accountId, errorCollector);

		return new AccountValidationResult.Valid(new AccountRequest(accountId, name, email, address, phoneNumber, dateJoined));
	}

	/**
	 * Returns the decoded request, or throws a 400 {@link ApplicationException} describing every problem.
	 */
	@Nonnull
	public AccountRequest requireValid(@Nonnull AccountValidationResult validationResult) {
		requireNonNull(validationResult);

		if (validationResult instanceof AccountValidationResult.Invalid invalid)
			throw ApplicationException.withStatusCodeAndErrors(400, invalid.errorCollector()).build();

		return ((AccountValidationResult.Valid) validationResult).accountRequest();
	}

	/**
	 * Throws a 400 {@link ApplicationException} if the body's ID is malformed or names a different account than {@code accountId}.
	 * A body without an ID is consistent with any account.
	 */
	public void requireConsistentAccountId(@Nonnull Long accountId,
																				 @Nonnull AccountValidationResult validationResult) {
		requireNonNull(accountId);
		requireNonNull(validationResult);

		Long bodyAccountId;

		if (validationResult instanceof AccountValidationResult.Invalid invalid) {
			if (invalid.errorCollector().hasFieldError(ID_FIELD))
				throw ApplicationException.withStatusCodeAndErrors(400, invalid.errorCollector()).build();

			bodyAccountId = invalid.accountId();
		} else {
			bodyAccountId = ((AccountValidationResult.Valid) validationResult).accountRequest().accountId();
		}

		if (bodyAccountId != null && !Objects.equals(bodyAccountId, accountId)) {
			ErrorCollector errorCollector = new ErrorCollector();
			errorCollector.addFieldError(ID_FIELD, getStrings().get("The ID {{bodyAccountId}} in the request body does not match the ID {{accountId}} in the URL.",
					Map.of(
							"bodyAccountId", bodyAccountId,
							"accountId", accountId
					)));

			throw ApplicationException.withStatusCodeAndErrors(400, errorCollector).build();
		}
	}

	@Nullable
	private JsonObject parseJsonObject(@Nonnull String requestBody) {
		requireNonNull(requestBody);

		// Lenient syntax such as single quotes or trailing values counts as malformed
		JsonReader jsonReader = new JsonReader(new StringReader(requestBody));
		jsonReader.setStrictness(Strictness.STRICT);

		try {
			JsonElement jsonElement = getGson().getAdapter(JsonElement.class).read(jsonReader);

			if (jsonReader.peek() != JsonToken.END_DOCUMENT)
				return null;

			return jsonElement.isJsonObject() ? jsonElement.getAsJsonObject() : null;
		} catch (IOException | JsonParseException | IllegalStateException e) {
			// Malformed JSON is reported the same way as well-formed JSON that isn't an object
			return null;
		}
	}

	@Nullable
	private Long extractAccountId(@Nonnull JsonObject jsonObject,
																@Nonnull ErrorCollector errorCollector) {
		requireNonNull(jsonObject);
		requireNonNull(errorCollector);

		JsonElement jsonElement = jsonObject.get(ID_FIELD);

		// Clients may omit the ID entirely
		if (jsonElement == null || jsonElement.isJsonNull())
			return null;

		if (jsonElement.isJsonPrimitive() && jsonElement.getAsJsonPrimitive().isNumber()) {
			try {
				return jsonElement.getAsBigDecimal().longValueExact();
			} catch (ArithmeticException | NumberFormatException e) {
				// Fractional or out of range; falls through to the error below
			}
		}

		errorCollector.addFieldError(ID_FIELD, getStrings().get("ID must be an integer."));
		return null;
	}

	@Nullable
	private String extractText(@Nonnull JsonObject jsonObject,
														 @Nonnull String field,
														 @Nonnull ErrorCollector errorCollector) {
		requireNonNull(jsonObject);
		requireNonNull(field);
		requireNonNull(errorCollector);

		JsonElement jsonElement = jsonObject.get(field);

		if (jsonElement == null || jsonElement.isJsonNull()) {
			errorCollector.addFieldError(field, getStrings().get("The '{{field}}' field is required.", Map.of("field", field)));
			return null;
		}

		if (!isString(jsonElement)) {
			errorCollector.addFieldError(field, getStrings().get("The '{{field}}' field must be a string.", Map.of("field", field)));
			return null;
		}

		String value = jsonElement.getAsString();
		int maximumLength = MAXIMUM_LENGTHS_BY_TEXT_FIELD.get(field);

		if (value.length() > maximumLength) {
			errorCollector.addFieldError(field, getStrings().get("The '{{field}}' field cannot be longer than {{maximumLength}} characters.",
					Map.of(
							"field", field,
							"maximumLength", maximumLength
					)));
			return null;
		}

		return value;
	}

	@Nullable
	private LocalDate extractDateJoined(@Nonnull JsonObject jsonObject,
																			@Nonnull ErrorCollector errorCollector) {
		requireNonNull(jsonObject);
		requireNonNull(errorCollector);

		JsonElement jsonElement = jsonObject.get(DATE_JOINED_FIELD);

		// Optional; the service picks a default
		if (jsonElement == null || jsonElement.isJsonNull())
			return null;

		if (isString(jsonElement)) {
			try {
				return LocalDate.parse(jsonElement.getAsString());
			} catch (DateTimeParseException e) {
				// Falls through to the error below
			}
		}

		errorCollector.addFieldError(DATE_JOINED_FIELD, getStrings().get("The '{{field}}' field must be a date in YYYY-MM-DD format.",
				Map.of("field", DATE_JOINED_FIELD)));

		return null;
	}

	@Nonnull
	private Boolean isString(@Nonnull JsonElement jsonElement) {
		requireNonNull(jsonElement);

		if (!jsonElement.isJsonPrimitive())
			return false;

		JsonPrimitive jsonPrimitive = jsonElement.getAsJsonPrimitive();
		return jsonPrimitive.isString();
	}

	@Nonnull
	private Strings getStrings() {
		return this.strings;
	}

	@Nonnull
	private Gson getGson() {
		return this.gson;
	}
}
