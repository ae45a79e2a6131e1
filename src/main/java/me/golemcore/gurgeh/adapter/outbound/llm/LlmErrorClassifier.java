/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gurgeh.adapter.outbound.llm;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies reasoning backend failures into stable machine-readable reason
 * codes. langchain4j exceptions are matched by class name so the classifier
 * does not depend on a particular library release.
 */
public final class LlmErrorClassifier {

    public static final String REQUEST_ABORTED = "llm.request.aborted";
    public static final String REQUEST_TIMEOUT = "llm.request.timeout";
    public static final String CONTEXT_LENGTH_EXCEEDED = "llm.context.length_exceeded";
    public static final String OVERLOADED = "llm.overloaded";
    public static final String RATE_LIMIT = "llm.langchain4j.rate_limit";
    public static final String TIMEOUT = "llm.langchain4j.timeout";
    public static final String AUTHENTICATION = "llm.langchain4j.authentication";
    public static final String INVALID_REQUEST = "llm.langchain4j.invalid_request";
    public static final String MODEL_NOT_FOUND = "llm.langchain4j.model_not_found";
    public static final String INTERNAL_SERVER = "llm.langchain4j.internal_server";
    public static final String RETRIABLE = "llm.langchain4j.retriable";
    public static final String NON_RETRIABLE = "llm.langchain4j.non_retriable";
    public static final String HTTP_ERROR = "llm.langchain4j.http_error";
    public static final String ERROR = "llm.langchain4j.error";
    public static final String UNKNOWN = "llm.error.unknown";

    private static final String EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final int STATUS_OVERLOADED = 529;

    private LlmErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static String classify(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Rate limits, overload, server errors and timeouts are worth retrying.
     */
    public static boolean isTransient(String code) {
        return RATE_LIMIT.equals(code)
                || OVERLOADED.equals(code)
                || TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || RETRIABLE.equals(code);
    }

    /**
     * Failures that no later call can recover from without operator action.
     */
    public static boolean isFatal(String code) {
        return AUTHENTICATION.equals(code);
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        return "[" + code + "] " + message;
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        return switch (className.substring(EXCEPTIONS_PREFIX.length())) {
        case "RateLimitException" -> RATE_LIMIT;
        case "TimeoutException" -> TIMEOUT;
        case "AuthenticationException" -> AUTHENTICATION;
        case "InvalidRequestException" -> INVALID_REQUEST;
        case "ModelNotFoundException" -> MODEL_NOT_FOUND;
        case "InternalServerException" -> INTERNAL_SERVER;
        case "HttpException" -> classifyHttpStatus(readHttpStatusCode(throwable));
        case "RetriableException" -> RETRIABLE;
        case "NonRetriableException" -> NON_RETRIABLE;
        case "LangChain4jException" -> ERROR;
        default -> UNKNOWN;
        };
    }

    static String classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return HTTP_ERROR;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == STATUS_OVERLOADED) {
            return OVERLOADED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return HTTP_ERROR;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer status) {
                return status;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("overloaded")) {
            return OVERLOADED;
        }
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        return UNKNOWN;
    }
}
