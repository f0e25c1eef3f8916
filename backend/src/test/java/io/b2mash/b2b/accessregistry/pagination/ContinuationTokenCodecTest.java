package io.b2mash.b2b.accessregistry.pagination;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class ContinuationTokenCodecTest {

  private final ContinuationTokenCodec codec =
      new ContinuationTokenCodec(JsonMapper.builder().build());

  @Test
  void encodedTokenIsUrlSafeAndUnpadded() {
    String encoded = codec.encode(ContinuationToken.of("res/with?odd+chars~", 17L));

    assertThat(encoded).doesNotContain("=", "+", "/");
    assertThat(codec.decode(encoded))
        .contains(new ContinuationToken("res/with?odd+chars~", 17L));
  }

  @Test
  void tokenWithoutVersionDecodes() {
    String encoded = codec.encode(ContinuationToken.of("list-b"));

    assertThat(codec.decode(encoded)).contains(new ContinuationToken("list-b", null));
  }

  @Test
  void garbageDecodesToEmpty() {
    assertThat(codec.decode("not a token!")).isEmpty();
    assertThat(codec.decode("")).isEmpty();
    assertThat(codec.decode(null)).isEmpty();
  }

  @Test
  void validBase64WithInvalidJsonDecodesToEmpty() {
    String encoded = base64("{\"resumeKey\": ");

    assertThat(codec.decode(encoded)).isEmpty();
  }

  @Test
  void jsonWithoutResumeKeyDecodesToEmpty() {
    assertThat(codec.decode(base64("{\"version\": 3}"))).isEmpty();
    assertThat(codec.decode(base64("null"))).isEmpty();
  }

  @Test
  void wrongFieldTypesDecodeToEmpty() {
    assertThat(codec.decode(base64("{\"resumeKey\": \"a\", \"version\": \"three\"}"))).isEmpty();
  }

  private static String base64(String json) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }
}
