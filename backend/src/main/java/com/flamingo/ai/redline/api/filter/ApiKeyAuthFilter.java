package com.flamingo.ai.redline.api.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.redline.config.RedlineConfig;
import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.ApiErrorResponse;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Requires {@code Authorization: Bearer <key>} on every {@code /v1} route.
 *
 * <p>Runs before the dispatcher, so unauthenticated uploads are rejected before any body parsing
 * or document work. The 401 response never says why the token was refused.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  private static final String BEARER_PREFIX = "Bearer ";

  private final byte[] expectedKey;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public ApiKeyAuthFilter(
      RedlineConfig config, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    String apiKey = config.getSecurity().getApiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "redline.security.api-key must be set (environment variable API_KEY)");
    }
    this.expectedKey = apiKey.getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return !(path.equals("/v1") || path.startsWith("/v1/"));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (isAuthorized(request.getHeader(HttpHeaders.AUTHORIZATION))) {
      filterChain.doFilter(request, response);
      return;
    }
    meterRegistry.counter("api_errors_total", "error_type", "unauthorized").increment();
    log.warn("Rejected unauthenticated {} {}", request.getMethod(), request.getRequestURI());
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(
        response.getOutputStream(),
        new ApiErrorResponse(ApiError.of(ApiError.UNAUTHORIZED, "Invalid or missing API key")));
  }

  boolean isAuthorized(String header) {
    if (header == null || !header.startsWith(BEARER_PREFIX)) {
      return false;
    }
    byte[] supplied = header.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(supplied, expectedKey);
  }
}
