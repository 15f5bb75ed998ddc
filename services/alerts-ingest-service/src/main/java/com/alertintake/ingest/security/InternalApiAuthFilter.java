package com.alertintake.ingest.security;

import com.alertintake.ingest.common.web.ApiExceptionHandler.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Shared-token check for /internal/** endpoints. With no token configured the internal API is
 * switched off.
 */
@Component
@Slf4j
public class InternalApiAuthFilter extends OncePerRequestFilter {

  static final String HEADER = "X-Internal-Token";

  private final byte[] expectedToken;
  private final ObjectMapper objectMapper;

  public InternalApiAuthFilter(
      @Value("${internal.auth.token:}") String expectedToken, ObjectMapper objectMapper) {
    String token = expectedToken == null ? "" : expectedToken.trim();
    this.expectedToken = token.getBytes(StandardCharsets.UTF_8);
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return !path.startsWith("/internal/");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    if (expectedToken.length == 0) {
      reject(
          response,
          HttpServletResponse.SC_SERVICE_UNAVAILABLE,
          "INTERNAL_API_DISABLED",
          "internal.auth.token is not configured");
      return;
    }

    String provided = request.getHeader(HEADER);
    if (provided == null
        || !MessageDigest.isEqual(expectedToken, provided.getBytes(StandardCharsets.UTF_8))) {
      log.warn("Internal token mismatch for {} {}", request.getMethod(), request.getRequestURI());
      reject(
          response, HttpServletResponse.SC_UNAUTHORIZED, "UNAUTHORIZED", "Invalid internal token");
      return;
    }

    filterChain.doFilter(request, response);
  }

  private void reject(HttpServletResponse response, int status, String code, String message)
      throws IOException {
    response.setStatus(status);
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(code, message, null));
  }
}
