package com.alertintake.ingest.guard;

import com.alertintake.ingest.common.web.MalformedPayloadException;
import com.alertintake.ingest.common.web.PayloadTooLargeException;
import com.alertintake.ingest.common.web.UnsupportedContentTypeException;
import com.alertintake.ingest.config.IntegrationsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Classifies a raw request before any integration code sees it.
 *
 * <p>The size limit is enforced first, from {@code Content-Length} when the client declares it
 * and otherwise while reading, so an oversized body is never fully buffered. Multipart requests
 * are refused outright. Stateless.
 */
@Component
@RequiredArgsConstructor
public class PayloadGuard {

  private final IntegrationsProperties properties;
  private final ObjectMapper objectMapper;

  public InboundPayload inspect(HttpServletRequest request, Set<PayloadFormat> accepted) {
    long limit = properties.maxPayloadSize().toBytes();
    long declared = request.getContentLengthLong();
    if (declared > limit) {
      throw new PayloadTooLargeException(limit, "Content-Length is " + declared);
    }

    MediaType mediaType = parseContentType(request.getContentType());
    PayloadFormat format = classify(mediaType);
    if (!accepted.contains(format)) {
      throw new UnsupportedContentTypeException(
          "Content-Type " + mediaType.getType() + "/" + mediaType.getSubtype()
              + " is not accepted by this endpoint",
          "accepted formats: " + accepted);
    }

    byte[] data = readBounded(request, limit);
    if (data.length == 0) {
      throw new MalformedPayloadException("Request body is empty");
    }

    JsonNode body =
        format == PayloadFormat.FORM ? decodeForm(data, charsetOf(mediaType)) : parseJson(data);
    return new InboundPayload(body, format, data.length);
  }

  private static MediaType parseContentType(String header) {
    if (header == null || header.isBlank()) {
      throw new UnsupportedContentTypeException("Content-Type header is required", null);
    }
    try {
      return MediaType.parseMediaType(header);
    } catch (InvalidMediaTypeException e) {
      throw new UnsupportedContentTypeException("Content-Type header is invalid", e.getMessage());
    }
  }

  private static PayloadFormat classify(MediaType mediaType) {
    if ("multipart".equalsIgnoreCase(mediaType.getType())) {
      throw new UnsupportedContentTypeException(
          "File uploads are not accepted", mediaType.toString());
    }
    if ("application".equalsIgnoreCase(mediaType.getType())
        && ("json".equalsIgnoreCase(mediaType.getSubtype())
            || mediaType.getSubtype().toLowerCase(Locale.ROOT).endsWith("+json"))) {
      return PayloadFormat.JSON;
    }
    if (MediaType.APPLICATION_FORM_URLENCODED.equalsTypeAndSubtype(mediaType)) {
      return PayloadFormat.FORM;
    }
    if (MediaType.TEXT_PLAIN.equalsTypeAndSubtype(mediaType)) {
      return PayloadFormat.TEXT;
    }
    throw new UnsupportedContentTypeException(
        "Content-Type " + mediaType + " is not supported", null);
  }

  private static byte[] readBounded(HttpServletRequest request, long limit) {
    int cap = (int) Math.min(limit + 1, Integer.MAX_VALUE - 8);
    try {
      InputStream in = request.getInputStream();
      byte[] data = in.readNBytes(cap);
      if (data.length > limit) {
        throw new PayloadTooLargeException(limit, "body exceeded the limit while reading");
      }
      return data;
    } catch (IOException e) {
      throw new MalformedPayloadException("Could not read request body", e.getMessage(), e);
    }
  }

  private JsonNode parseJson(byte[] data) {
    try {
      JsonNode node = objectMapper.readTree(data);
      if (node == null || node.isMissingNode()) {
        throw new MalformedPayloadException("Request body is empty");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException(
          "Request body is not valid JSON", e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new MalformedPayloadException("Could not read request body", e.getMessage(), e);
    }
  }

  private ObjectNode decodeForm(byte[] data, Charset charset) {
    ObjectNode node = objectMapper.createObjectNode();
    String text = new String(data, charset);
    try {
      for (String pair : text.split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int eq = pair.indexOf('=');
        String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), charset);
        String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), charset);

        // repeated keys keep every value, in order
        JsonNode existing = node.get(key);
        if (existing == null) {
          node.put(key, value);
        } else if (existing.isArray()) {
          ((ArrayNode) existing).add(value);
        } else {
          ArrayNode values = node.arrayNode();
          values.add(existing);
          values.add(value);
          node.set(key, values);
        }
      }
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException("Form body is not valid", e.getMessage(), e);
    }
    return node;
  }

  private static Charset charsetOf(MediaType mediaType) {
    Charset charset = mediaType.getCharset();
    return charset == null ? StandardCharsets.UTF_8 : charset;
  }
}
