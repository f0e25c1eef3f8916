package io.b2mash.b2b.accessregistry.pagination;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Turns {@link ContinuationToken}s into opaque, URL-safe strings (unpadded base64url of the JSON
 * form) and back. Decoding never throws: anything that is not a token this codec produced decodes
 * to empty.
 */
public class ContinuationTokenCodec {

  private static final Logger log = LoggerFactory.getLogger(ContinuationTokenCodec.class);

  private final ObjectMapper objectMapper;

  public ContinuationTokenCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(ContinuationToken token) {
    byte[] json = objectMapper.writeValueAsBytes(token);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
  }

  public Optional<ContinuationToken> decode(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      return Optional.empty();
    }

    byte[] json;
    try {
      json = Base64.getUrlDecoder().decode(encoded.getBytes(StandardCharsets.US_ASCII));
    } catch (IllegalArgumentException e) {
      log.debug("Rejected continuation token: not base64url");
      return Optional.empty();
    }

    try {
      var token = objectMapper.readValue(json, ContinuationToken.class);
      if (token == null || token.resumeKey() == null) {
        log.debug("Rejected continuation token: missing resume key");
        return Optional.empty();
      }
      return Optional.of(token);
    } catch (JacksonException e) {
      log.debug("Rejected continuation token: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }
}
