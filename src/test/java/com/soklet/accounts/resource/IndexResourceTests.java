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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.soklet.HttpMethod;
import com.soklet.MarshaledResponse;
import com.soklet.Request;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import com.soklet.accounts.App;
import com.soklet.accounts.Configuration;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Set;

@ThreadSafe
public class IndexResourceTests {
	@Test
	public void testIndex() {
		App app = new App(new Configuration("local"));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			MarshaledResponse marshaledResponse = simulator.performRequest(Request.withPath(HttpMethod.GET, "/").build()).getMarshaledResponse();

			Assertions.assertEquals(200, marshaledResponse.getStatusCode().intValue(), "Bad status code");
			Assertions.assertEquals(Set.of("application/json;charset=UTF-8"), marshaledResponse.getHeaders().get("Content-Type"), "Bad content type");

			JsonObject index = gson.fromJson(new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8), JsonObject.class);

			Assertions.assertEquals("Account REST API Service", index.get("name").getAsString(), "Name doesn't match");
			Assertions.assertEquals("1.0", index.get("version").getAsString(), "Version doesn't match");
			Assertions.assertEquals("/accounts", index.get("url").getAsString(), "URL doesn't match");
		}));
	}

	@Test
	public void testHealth() {
		App app = new App(new Configuration("local"));
		Gson gson = app.getInjector().getInstance(Gson.class);
		SokletConfig config = app.getInjector().getInstance(SokletConfig.class);

		Soklet.runSimulator(config, (simulator -> {
			MarshaledResponse marshaledResponse = simulator.performRequest(Request.withPath(HttpMethod.GET, "/health").build()).getMarshaledResponse();

			Assertions.assertEquals(200, marshaledResponse.getStatusCode().intValue(), "Bad status code");

			JsonObject health = gson.fromJson(new String(marshaledResponse.getBody().get(), StandardCharsets.UTF_8), JsonObject.class);
			Assertions.assertEquals("OK", health.get("status").getAsString(), "Health status doesn't match");
		}));
	}
}
