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

import com.soklet.accounts.App;
import com.soklet.accounts.Configuration;
import com.soklet.accounts.CurrentContext;
import com.soklet.accounts.exception.ApplicationException;
import com.soklet.accounts.model.api.request.AccountRequest;
import com.soklet.accounts.util.AccountValidator.AccountValidationResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

@ThreadSafe
public class AccountValidatorTests {
	@Test
	public void testValidBody() {
		runWithValidator(accountValidator -> {
			AccountValidationResult result = accountValidator.validate("""
					{
					  "id": 7,
					  "name": "Ada Lovelace",
					  "email": "ada@example.com",
					  "address": "London",
					  "phone_number": "555-0100",
					  "date_joined": "1843-07-01",
					  "favorite_color": "green"
					}
					""");

			Assertions.assertTrue(result instanceof AccountValidationResult.Valid, "Body should be valid");

			AccountRequest request = ((AccountValidationResult.Valid) result).accountRequest();

			Assertions.assertEquals(7L, request.accountId().longValue(), "ID doesn't match");
			Assertions.assertEquals("Ada Lovelace", request.name(), "Name doesn't match");
			Assertions.assertEquals("555-0100", request.phoneNumber(), "Phone number doesn't match");
			Assertions.assertEquals(LocalDate.of(1843, 7, 1), request.dateJoined(), "Date joined doesn't match");
		});
	}

	@Test
	public void testOptionalFieldsMayBeNull() {
		runWithValidator(accountValidator -> {
			AccountRequest request = accountValidator.requireValid(accountValidator.validate("""
					{"id": null, "name": "Ada", "email": "a@b.c", "address": "X", "phone_number": "1", "date_joined": null}
					"""));

			Assertions.assertNull(request.accountId(), "ID should be absent");
			Assertions.assertNull(request.dateJoined(), "Date joined should be absent so it can be defaulted");
		});
	}

	@Test
	public void testInvalidBodiesCollectEveryProblem() {
		runWithValidator(accountValidator -> {
			AccountValidationResult result = accountValidator.validate("""
					{"id": 1.5, "name": "", "email": null, "address": ["X"], "phone_number": "%s", "date_joined": "07/01/1843"}
					""".formatted("9".repeat(33)));

			Assertions.assertTrue(result instanceof AccountValidationResult.Invalid, "Body should be invalid");

			AccountValidationResult.Invalid invalid = (AccountValidationResult.Invalid) result;

			Assertions.assertEquals(Set.of("id", "name", "email", "address", "phone_number", "date_joined"),
					invalid.errorCollector().getFieldErrors().keySet(), "Wrong fields reported");

			ApplicationException applicationException = Assertions.assertThrows(ApplicationException.class,
					() -> accountValidator.requireValid(result));

			Assertions.assertEquals(400, applicationException.getStatusCode().intValue(), "Bad status code");
		});
	}

	@Test
	public void testNonObjectBodies() {
		runWithValidator(accountValidator -> {
			for (String requestBody : new String[]{"", "   ", "null", "42", "\"text\"", "[]", "{\"name\":"}) {
				AccountValidationResult result = accountValidator.validate(requestBody);

				Assertions.assertTrue(result instanceof AccountValidationResult.Invalid, "Body should be invalid: " + requestBody);
				Assertions.assertFalse(((AccountValidationResult.Invalid) result).errorCollector().getGeneralErrors().isEmpty(),
						"Expected a general error for: " + requestBody);
			}
		});
	}

	@Test
	public void testLenientJsonIsRejected() {
		runWithValidator(accountValidator -> {
			String validBody = "{\"name\": \"Ada\", \"email\": \"a@b.c\", \"address\": \"X\", \"phone_number\": \"1\"}";

			Assertions.assertTrue(accountValidator.validate(validBody) instanceof AccountValidationResult.Valid, "Strict JSON should pass");

			for (String requestBody : new String[]{
					"{name: \"Ada\", email: \"a@b.c\", address: \"X\", phone_number: \"1\"}",
					"{'name': 'Ada', 'email': 'a@b.c', 'address': 'X', 'phone_number': '1'}",
					"{\"name\": \"Ada\", \"email\": \"a@b.c\", \"address\": \"X\", \"phone_number\": \"1\", \"id\": NaN}",
					"/* comment */ " + validBody,
					validBody + " []",
					validBody + validBody
			}) {
				AccountValidationResult result = accountValidator.validate(requestBody);

				Assertions.assertTrue(result instanceof AccountValidationResult.Invalid, "Body should be invalid: " + requestBody);
				Assertions.assertFalse(((AccountValidationResult.Invalid) result).errorCollector().getGeneralErrors().isEmpty(),
						"Expected a general error for: " + requestBody);
			}
		});
	}

	@Test
	public void testLengthLimits() {
		runWithValidator(accountValidator -> {
			String atLimit = """
					{"name": "%s", "email": "%s", "address": "%s", "phone_number": "%s"}
					""".formatted("n".repeat(64), "e".repeat(64), "a".repeat(256), "p".repeat(32));

			Assertions.assertTrue(accountValidator.validate(atLimit) instanceof AccountValidationResult.Valid, "Values at the limit should pass");

			String overLimit = """
					{"name": "%s", "email": "%s", "address": "%s", "phone_number": "%s"}
					""".formatted("n".repeat(65), "e".repeat(65), "a".repeat(257), "p".repeat(33));

			AccountValidationResult result = accountValidator.validate(overLimit);

			Assertions.assertTrue(result instanceof AccountValidationResult.Invalid, "Values over the limit should fail");
			Assertions.assertEquals(Set.of("name", "email", "address", "phone_number"),
					((AccountValidationResult.Invalid) result).errorCollector().getFieldErrors().keySet(), "Wrong fields reported");
		});
	}

	@Test
	public void testConsistentAccountId() {
		runWithValidator(accountValidator -> {
			// No body ID is consistent with anything, even if the rest of the body is bad
			Assertions.assertDoesNotThrow(() -> accountValidator.requireConsistentAccountId(5L, accountValidator.validate("{}")));

			// Matching ID
			Assertions.assertDoesNotThrow(() -> accountValidator.requireConsistentAccountId(5L, accountValidator.validate("""
					{"id": 5, "name": "Ada", "email": "a@b.c", "address": "X", "phone_number": "1"}
					""")));

			// Mismatch is reported even when other fields are also bad
			ApplicationException applicationException = Assertions.assertThrows(ApplicationException.class,
					() -> accountValidator.requireConsistentAccountId(5L, accountValidator.validate("{\"id\": 6}")));

			Assertions.assertEquals(400, applicationException.getStatusCode().intValue(), "Bad status code");
			Assertions.assertEquals(Set.of("id"), applicationException.getFieldErrors().keySet(), "Only the ID should be reported");

			// Non-integer ID
			applicationException = Assertions.assertThrows(ApplicationException.class,
					() -> accountValidator.requireConsistentAccountId(5L, accountValidator.validate("{\"id\": \"5\"}")));

			Assertions.assertTrue(applicationException.getFieldErrors().containsKey("id"), "ID error missing");

			// Outside the 64-bit range
			applicationException = Assertions.assertThrows(ApplicationException.class,
					() -> accountValidator.requireConsistentAccountId(5L, accountValidator.validate("{\"id\": 99999999999999999999}")));

			Assertions.assertTrue(applicationException.getFieldErrors().containsKey("id"), "ID error missing");
		});
	}

	private void runWithValidator(@Nonnull Consumer<AccountValidator> accountValidatorConsumer) {
		requireNonNull(accountValidatorConsumer);

		App app = new App(new Configuration("local"));
		AccountValidator accountValidator = app.getInjector().getInstance(AccountValidator.class);

		// Localized messages need a context to pick a locale
		CurrentContext.with(Locale.forLanguageTag("en-US"), ZoneId.of("UTC")).build().run(() -> {
			accountValidatorConsumer.accept(accountValidator);
		});
	}
}
