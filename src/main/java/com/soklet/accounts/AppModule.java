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

package com.soklet.accounts;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.lokalized.LocaleMatcher;
import com.lokalized.LocalizedStringLoader;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.InstanceProvider;
import com.pyranid.StatementContext;
import com.pyranid.StatementLog;
import com.pyranid.StatementLogger;
import com.soklet.CorsAuthorizer;
import com.soklet.HttpMethod;
import com.soklet.LifecycleObserver;
import com.soklet.LogEvent;
import com.soklet.MarshaledResponse;
import com.soklet.Request;
import com.soklet.RequestBodyMarshaler;
import com.soklet.RequestInterceptor;
import com.soklet.ResourceMethod;
import com.soklet.Response;
import com.soklet.ResponseMarshaler;
import com.soklet.Server;
import com.soklet.ServerType;
import com.soklet.Soklet;
import com.soklet.SokletConfig;
import com.soklet.accounts.annotation.SuppressRequestLogging;
import com.soklet.accounts.exception.ApplicationException;
import com.soklet.accounts.exception.NotFoundException;
import com.soklet.accounts.model.api.response.ErrorResponse;
import com.soklet.accounts.store.AccountStore;
import com.soklet.accounts.store.DatabaseAccountStore;
import com.soklet.annotation.RequestBody;
import com.soklet.exception.BadRequestException;
import org.hsqldb.jdbc.JDBCDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Guice wiring for the whole application.
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@Nonnull
	private static final String JSON_CONTENT_TYPE;
	@Nonnull
	private static final Map<Integer, String> REASON_PHRASES_BY_STATUS_CODE;

	static {
		JSON_CONTENT_TYPE = "application/json;charset=UTF-8";
		REASON_PHRASES_BY_STATUS_CODE = Map.of(
				400, "Bad Request",
				404, "Not Found",
				405, "Method Not Allowed",
				415, "Unsupported Media Type",
				500, "Internal Server Error"
		);
	}

	@Nonnull
	private final Configuration configuration;

	public AppModule(@Nonnull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@Nonnull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	@Nonnull
	@Provides
	@Singleton
	public SokletConfig provideSokletConfig(@Nonnull Injector injector,
																					@Nonnull Configuration configuration,
																					@Nonnull Database database,
																					@Nonnull Strings strings,
																					@Nonnull Gson gson) {
		requireNonNull(injector);
		requireNonNull(configuration);
		requireNonNull(database);
		requireNonNull(strings);
		requireNonNull(gson);

		return SokletConfig.withServer(Server.withPort(configuration.getPort()).build())
				.lifecycleObserver(new LifecycleObserver() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.accounts.LifecycleObserver");

					@Override
					public void didStartRequestHandling(@Nonnull ServerType serverType,
																							@Nonnull Request request,
																							@Nullable ResourceMethod resourceMethod) {
						if (shouldPerformRequestLogging(request, resourceMethod))
							logger.debug("Received {} {}", request.getHttpMethod(), request.getRawPathAndQuery());
					}

					@Override
					public void didFinishRequestHandling(@Nonnull ServerType serverType,
																							 @Nonnull Request request,
																							 @Nullable ResourceMethod resourceMethod,
																							 @Nonnull MarshaledResponse marshaledResponse,
																							 @Nonnull Duration processingDuration,
																							 @Nonnull List<Throwable> throwables) {
						if (shouldPerformRequestLogging(request, resourceMethod))
							logger.debug(format("Finished processing %s %s (HTTP %d) in %.2fms", request.getHttpMethod(),
									request.getRawPathAndQuery(), marshaledResponse.getStatusCode(), processingDuration.toNanos() / 1000000.0));
					}

					@Nonnull
					private Boolean shouldPerformRequestLogging(@Nonnull Request request,
																											@Nullable ResourceMethod resourceMethod) {
						requireNonNull(request);

						// Special OPTIONS * requests are generally health checks and should not be logged
						if (request.getHttpMethod() == HttpMethod.OPTIONS && request.getPath().equals("*"))
							return false;

						// 404s and 405s have no resource method; log them
						if (resourceMethod == null)
							return true;

						return !resourceMethod.getMethod().isAnnotationPresent(SuppressRequestLogging.class);
					}

					@Override
					public void willStartSoklet(@Nonnull Soklet soklet) {
						logger.debug("Accounts app starting in {} environment...", configuration.getEnvironment());
					}

					@Override
					public void willStopSoklet(@Nonnull Soklet soklet) {
						logger.debug("Accounts app stopping...");
					}

					@Override
					public void didStopSoklet(@Nonnull Soklet soklet) {
						logger.debug("Accounts app stopped.");
					}

					@Override
					public void didStartServer(@Nonnull Server server) {
						logger.debug("Server started on port {}", configuration.getPort());
					}

					@Override
					public void didReceiveLogEvent(@Nonnull LogEvent logEvent) {
						requireNonNull(logEvent);
						logger.warn(logEvent.getMessage(), logEvent.getThrowable().orElse(null));
					}
				})
				.requestInterceptor(new RequestInterceptor() {
					@Override
					public void wrapRequest(@Nonnull ServerType serverType,
																	@Nonnull Request request,
																	@Nonnull Consumer<Request> requestProcessor) {
						requireNonNull(request);
						requireNonNull(requestProcessor);

						// Ensure a "current context" scope exists for all request-handling code, including error handlers
						CurrentContext.withRequest(request)
								.locale(resolveLocale(request))
								.timeZone(resolveTimeZone(request))
								.build().run(() -> {
									requestProcessor.accept(request);
								});
					}

					@Override
					public void interceptRequest(@Nonnull ServerType serverType,
																			 @Nonnull Request request,
																			 @Nullable ResourceMethod resourceMethod,
																			 @Nonnull Function<Request, MarshaledResponse> responseGenerator,
																			 @Nonnull Consumer<MarshaledResponse> responseWriter) {
						requireNonNull(request);
						requireNonNull(responseGenerator);
						requireNonNull(responseWriter);

						// Reject non-JSON payloads before the body is looked at or any data is touched
						if (resourceMethod != null && acceptsRequestBody(resourceMethod) && !hasJsonContentType(request))
							throw ApplicationException.withStatusCodeAndGeneralError(415,
									strings.get("Request content type must be 'application/json'.")).build();

						// Wrap the resource method execution (not including the writing of bytes over the wire) in a database transaction.
						// If an exception occurs during this process, the transaction will roll back.
						MarshaledResponse marshaledResponse = database.transaction(() ->
								Optional.of(responseGenerator.apply(request))
						).get();

						responseWriter.accept(marshaledResponse);
					}

					@Nonnull
					private Boolean acceptsRequestBody(@Nonnull ResourceMethod resourceMethod) {
						requireNonNull(resourceMethod);

						return Arrays.stream(resourceMethod.getMethod().getParameters())
								.anyMatch(parameter -> parameter.isAnnotationPresent(RequestBody.class));
					}

					@Nonnull
					private Boolean hasJsonContentType(@Nonnull Request request) {
						requireNonNull(request);

						String contentType = request.getHeader("Content-Type").orElse(null);

						if (contentType == null)
							return false;

						// Parameters like "; charset=UTF-8" don't matter
						int parameterIndex = contentType.indexOf(';');
						String mediaType = parameterIndex == -1 ? contentType : contentType.substring(0, parameterIndex);

						return mediaType.trim().toLowerCase(Locale.ROOT).equals("application/json");
					}

					@Nonnull
					private Locale resolveLocale(@Nonnull Request request) {
						requireNonNull(request);

						return request.getLocales().stream()
								.findFirst()
								.orElse(Configuration.getDefaultLocale());
					}

					@Nonnull
					private ZoneId resolveTimeZone(@Nonnull Request request) {
						requireNonNull(request);

						// Allow clients to specify a Time-Zone header which indicates preferred timezone
						String timeZoneHeader = request.getHeader("Time-Zone").orElse(null);

						if (timeZoneHeader != null) {
							try {
								return ZoneId.of(timeZoneHeader.trim());
							} catch (DateTimeException ignored) {
								// Illegal timezone specified; use the configured one
							}
						}

						return configuration.getTimeZone();
					}
				})
				.requestBodyMarshaler(new RequestBodyMarshaler() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.accounts.RequestBodyMarshaler");

					@Nullable
					@Override
					public Optional<Object> marshalRequestBody(@Nonnull Request request,
																										 @Nonnull ResourceMethod resourceMethod,
																										 @Nonnull Parameter parameter,
																										 @Nonnull Type requestBodyType) {
						requireNonNull(request);
						requireNonNull(requestBodyType);

						String requestBodyAsString = request.getBodyAsString().orElse(null);

						if (requestBodyAsString == null)
							return Optional.empty();

						if (logger.isDebugEnabled())
							logger.debug("Request body:\n{}", requestBodyAsString);

						// Resource methods that want to do their own decoding ask for the raw JSON
						if (requestBodyType == String.class)
							return Optional.of(requestBodyAsString);

						return Optional.of(gson.fromJson(requestBodyAsString, requestBodyType));
					}
				})
				.responseMarshaler(ResponseMarshaler.builder()
						.resourceMethodHandler((@Nonnull Request request,
																		@Nonnull Response response,
																		@Nonnull ResourceMethod resourceMethod) -> {
							// Use Gson to turn response objects into JSON to go over the wire
							Object bodyObject = response.getBody().orElse(null);
							byte[] body = bodyObject == null ? null : gson.toJson(bodyObject).getBytes(StandardCharsets.UTF_8);

							// Only responses that carry a body get a content type
							Map<String, Set<String>> headers = new HashMap<>(response.getHeaders());

							if (body != null)
								headers.put("Content-Type", Set.of(JSON_CONTENT_TYPE));

							return MarshaledResponse.withStatusCode(response.getStatusCode())
									.headers(headers)
									.cookies(response.getCookies())
									.body(body)
									.build();
						})
						.notFoundHandler((@Nonnull Request request) -> {
							ErrorResponse errorResponse = ErrorResponse.withStatus(404, reasonPhraseForStatusCode(404))
									.message(strings.get("The resource you requested was not found."))
									.build();

							return MarshaledResponse.withStatusCode(404)
									.headers(Map.of("Content-Type", Set.of(JSON_CONTENT_TYPE)))
									.body(gson.toJson(errorResponse).getBytes(StandardCharsets.UTF_8))
									.build();
						})
						.methodNotAllowedHandler((@Nonnull Request request,
																			@Nonnull Set<HttpMethod> allowedHttpMethods) -> {
							String allowedHttpMethodsDescription = allowedHttpMethods.stream()
									.map(HttpMethod::name)
									.sorted()
									.collect(Collectors.joining(", "));

							ErrorResponse errorResponse = ErrorResponse.withStatus(405, reasonPhraseForStatusCode(405))
									.message(strings.get("{{httpMethod}} is not supported for this resource. Supported methods: {{allowedHttpMethods}}.",
											Map.of(
													"httpMethod", request.getHttpMethod().name(),
													"allowedHttpMethods", allowedHttpMethodsDescription
											)))
									.build();

							Map<String, Set<String>> headers = new HashMap<>();
							headers.put("Content-Type", Set.of(JSON_CONTENT_TYPE));
							headers.put("Allow", Set.of(allowedHttpMethodsDescription));

							return MarshaledResponse.withStatusCode(405)
									.headers(headers)
									.body(gson.toJson(errorResponse).getBytes(StandardCharsets.UTF_8))
									.build();
						})
						.throwableHandler((@Nonnull Request request,
															 @Nonnull Throwable throwable,
															 @Nullable ResourceMethod resourceMethod) -> {
							// Collect error information for display to client
							int statusCode;
							List<String> generalErrors = new ArrayList<>();
							Map<String, List<String>> fieldErrors = new LinkedHashMap<>();

							// Unwrap CompletionExceptions
							if (throwable instanceof CompletionException) {
								Throwable cause = throwable.getCause();
								if (cause != null)
									throwable = cause;
							}

							if (throwable instanceof BadRequestException) {
								statusCode = 400;
								generalErrors.add(strings.get("Your request was improperly formatted."));
							} else if (throwable instanceof NotFoundException) {
								statusCode = 404;
								generalErrors.add(strings.get("The resource you requested was not found."));
							} else if (throwable instanceof ApplicationException applicationException) {
								statusCode = applicationException.getStatusCode();
								generalErrors.addAll(applicationException.getGeneralErrors());
								fieldErrors.putAll(applicationException.getFieldErrors());
							} else {
								statusCode = 500;
								generalErrors.add(strings.get("An unexpected error occurred."));
								LoggerFactory.getLogger("com.soklet.accounts.ThrowableHandler")
										.error(format("Unexpected error while processing %s %s", request.getHttpMethod(), request.getRawPathAndQuery()), throwable);
							}

							// Combine all the error messages into one field for easy access by clients
							Set<String> fieldErrorsSummary = new LinkedHashSet<>();

							for (List<String> fieldErrorValues : fieldErrors.values())
								fieldErrorsSummary.addAll(fieldErrorValues);

							String message = format("%s %s",
									String.join(" ", generalErrors),
									String.join(" ", fieldErrorsSummary)
							).trim();

							// Ensure there is always a message
							if (message.length() == 0)
								message = strings.get("An unexpected error occurred.");

							ErrorResponse errorResponse = ErrorResponse.withStatus(statusCode, reasonPhraseForStatusCode(statusCode))
									.message(message)
									.generalErrors(generalErrors)
									.fieldErrors(fieldErrors)
									.build();

							return MarshaledResponse.withStatusCode(statusCode)
									.headers(Map.of("Content-Type", Set.of(JSON_CONTENT_TYPE)))
									.body(gson.toJson(errorResponse).getBytes(StandardCharsets.UTF_8))
									.build();
						}).build()
				)
				// Permit CORS for only the specified origins
				.corsAuthorizer(CorsAuthorizer.fromWhitelistedOrigins(configuration.getCorsWhitelistedOrigins()))
				// Use Google Guice when Soklet needs to vend instances
				.instanceProvider(injector::getInstance)
				.build();
	}

	// What context is bound to the current execution scope?
	@Nonnull
	@Provides
	public CurrentContext provideCurrentContext() {
		return CurrentContext.get();
	}

	// Provides a way to talk to a relational database
	@Nonnull
	@Provides
	@Singleton
	public Database provideDatabase(@Nonnull Injector injector) {
		requireNonNull(injector);

		// Each App instance gets its own isolated in-memory database so tests can run in parallel in the same JVM
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", UUID.randomUUID()));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return Database.withDataSource(dataSource)
				// Use Google Guice when Pyranid needs to vend instances
				.instanceProvider(new InstanceProvider() {
					@Override
					@Nonnull
					public <T> T provide(@Nonnull StatementContext<T> statementContext,
															 @Nonnull Class<T> instanceType) {
						return injector.getInstance(instanceType);
					}
				})
				.statementLogger(new StatementLogger() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.soklet.accounts.StatementLogger");

					@Override
					public void log(@Nonnull StatementLog statementLog) {
						if (logger.isTraceEnabled())
							logger.trace("SQL took {}ms:\n{}\nParameters: {}", format("%.2f", statementLog.getTotalDuration().toNanos() / 1000000.0),
									statementLog.getStatementContext().getStatement().getSql().stripIndent().trim(),
									statementLog.getStatementContext().getParameters());
					}
				})
				.build();
	}

	// Provides context-aware localization
	@Nonnull
	@Provides
	@Singleton
	public Strings provideStrings(@Nonnull Provider<CurrentContext> currentContextProvider) {
		requireNonNull(currentContextProvider);

		return Strings.withFallbackLocale(Locale.forLanguageTag("en-US"))
				.localizedStringSupplier(() -> LocalizedStringLoader.loadFromFilesystem(Paths.get("strings")))
				.localeSupplier((LocaleMatcher localeMatcher) -> {
					// Using the current context's preferred locale as a hint, pick the best-matching strings file
					Locale locale = currentContextProvider.get().getLocale();
					return localeMatcher.bestMatchFor(locale);
				})
				.build();
	}

	// Dates go over the wire as ISO-8601 "yyyy-MM-dd"
	@Nonnull
	@Provides
	@Singleton
	public Gson provideGson() {
		GsonBuilder gsonBuilder = new GsonBuilder()
				.setPrettyPrinting()
				.disableHtmlEscaping()
				.registerTypeAdapter(LocalDate.class, new TypeAdapter<LocalDate>() {
					@Override
					public void write(@Nonnull JsonWriter jsonWriter,
														@Nullable LocalDate localDate) throws IOException {
						if (localDate == null)
							jsonWriter.nullValue();
						else
							jsonWriter.value(localDate.toString());
					}

					@Override
					@Nullable
					public LocalDate read(@Nonnull JsonReader jsonReader) throws IOException {
						if (jsonReader.peek() == JsonToken.NULL) {
							jsonReader.nextNull();
							return null;
						}

						return LocalDate.parse(jsonReader.nextString());
					}
				});

		return gsonBuilder.create();
	}

	@Override
	protected void configure() {
		bind(AccountStore.class).to(DatabaseAccountStore.class);
	}

	@Nonnull
	private static String reasonPhraseForStatusCode(@Nonnull Integer statusCode) {
		requireNonNull(statusCode);
		return REASON_PHRASES_BY_STATUS_CODE.getOrDefault(statusCode, "Error");
	}
}
