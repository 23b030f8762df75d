package me.growmies.assistant.domain.system;

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

import feign.FeignException;
import feign.RetryableException;

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
 * Classifies backend failures into stable machine-readable reason codes.
 */
public final class BackendErrorClassifier {

    public static final String REQUEST_ABORTED = "backend.request.aborted";
    public static final String TIMEOUT = "backend.timeout";
    public static final String OVERLOADED = "backend.overloaded";
    public static final String RATE_LIMIT = "backend.rate_limit";
    public static final String AUTHENTICATION = "backend.authentication";
    public static final String INVALID_REQUEST = "backend.invalid_request";
    public static final String MODEL_NOT_FOUND = "backend.model_not_found";
    public static final String CONTENT_FILTERED = "backend.content_filtered";
    public static final String INTERNAL_SERVER = "backend.internal_server";
    public static final String CONTEXT_LENGTH_EXCEEDED = "backend.context.length_exceeded";
    public static final String HTTP_ERROR = "backend.http_error";
    public static final String EMPTY_REPLY = "backend.empty_reply";
    public static final String THREAD_UNAVAILABLE = "backend.thread.unavailable";
    public static final String THREAD_RUN_FAILED = "backend.thread.run_failed";
    public static final String THREAD_RUN_TIMEOUT = "backend.thread.run_timeout";
    public static final String THREAD_NO_ASSISTANT_MESSAGE = "backend.thread.no_assistant_message";
    public static final String UNKNOWN = "backend.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private BackendErrorClassifier() {
    }

    /**
     * Classify a backend failure based on the throwable type and its cause chain.
     */
    public static String classify(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String embedded = extractCode(current.getMessage());
            if (embedded != null) {
                return embedded;
            }

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
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[backend.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || !message.startsWith("[backend.")) {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    /**
     * Codes worth telling the user to retry later.
     */
    public static boolean isTransient(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        return RATE_LIMIT.equals(code)
                || TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code)
                || THREAD_RUN_TIMEOUT.equals(code)
                || REQUEST_ABORTED.equals(code)
                || OVERLOADED.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TIMEOUT;
        }
        if (throwable instanceof RetryableException) {
            return TIMEOUT;
        }
        if (throwable instanceof FeignException feignException) {
            return classifyStatus(feignException.status());
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }

        return switch (className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length())) {
        case "RateLimitException" -> RATE_LIMIT;
        case "TimeoutException" -> TIMEOUT;
        case "AuthenticationException" -> AUTHENTICATION;
        case "InvalidRequestException" -> INVALID_REQUEST;
        case "ModelNotFoundException" -> MODEL_NOT_FOUND;
        case "ContentFilteredException" -> CONTENT_FILTERED;
        case "InternalServerException", "RetriableException" -> INTERNAL_SERVER;
        case "HttpException" -> classifyHttpException(throwable);
        default -> UNKNOWN;
        };
    }

    private static String classifyHttpException(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        return statusCode == null ? HTTP_ERROR : classifyStatus(statusCode);
    }

    static String classifyStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 404) {
            return MODEL_NOT_FOUND;
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
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        if (normalized.contains("rate limit")) {
            return RATE_LIMIT;
        }
        return UNKNOWN;
    }
}
